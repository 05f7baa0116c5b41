package alertflow.blackout;

import alertflow.rule.AdvancedTag;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 屏蔽窗口,窗口内匹配作用域的告警不发送通知
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Blackout {
    private String id;
    private String environment;
    private Set<String> service = new LinkedHashSet<>();
    private String resource;
    private String event;
    private String group;
    private String origin;
    private String customer;
    private List<AdvancedTag> tags = new ArrayList<>();
    private Instant startTime;
    private Instant endTime;
    private Duration duration;              // 未配置 endTime 时由 startTime + duration 得出
    private String text;
    private String user;
    private String sourcePath;

    public Instant effectiveEndTime() {
        if (endTime != null) {
            return endTime;
        }
        if (startTime != null && duration != null) {
            return startTime.plus(duration);
        }
        return null;
    }

    public boolean isInWindow(Instant now) {
        Instant end = effectiveEndTime();
        return startTime != null && end != null && !now.isBefore(startTime) && now.isBefore(end);
    }
}
