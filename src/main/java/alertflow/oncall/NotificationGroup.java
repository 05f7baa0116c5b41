package alertflow.oncall;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.LinkedHashSet;
import java.util.Set;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationGroup {
    private String id;
    private String name;
    private Set<String> userIds = new LinkedHashSet<>();
    private String sourcePath;
}
