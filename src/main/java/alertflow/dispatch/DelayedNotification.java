package alertflow.dispatch;

import alertflow.alert.TransitionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * 待发送标记,每个 (alertId, ruleId) 至多一条
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DelayedNotification {
    private String id;
    private String alertId;
    private String ruleId;
    private String transitionId;
    private TransitionType transitionType;
    private String template;        // 规则或触发器的消息模板,发送时按告警最新状态渲染
    private Instant createTime;
    private Duration delayTime;
    private Instant fireTime;

    public boolean isDue(Instant now) {
        return fireTime != null && !now.isBefore(fireTime);
    }
}
