package alertflow.rule;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 触发条件 (from_severity -> to_severity, status),空集合表示不限制
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Trigger {
    @JsonProperty("from_severity")
    @JsonAlias("fromSeverity")
    private Set<String> fromSeverity = new LinkedHashSet<>();

    @JsonProperty("to_severity")
    @JsonAlias("toSeverity")
    private Set<String> toSeverity = new LinkedHashSet<>();

    private Set<String> status = new LinkedHashSet<>();

    private String text;                    // 触发时使用的消息模板,可引用 {default}
}
