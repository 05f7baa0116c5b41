package alertflow.alert;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 上报的原始告警
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertReport {
    private String id;                      // 上报ID,为空时自动生成
    private String environment;
    private String resource;
    private String event;
    private String customer;
    private String severity;
    private String status;
    private String value;
    private String text;
    private String group;
    private String origin;
    private String type;
    private Set<String> tags;
    private Set<String> service;
    private List<String> correlate;
    private Map<String, Object> attributes;
    private Instant createTime;
    private Duration timeout;

    public AlertKey identityKey() {
        return new AlertKey(environment, resource, event, customer);
    }
}
