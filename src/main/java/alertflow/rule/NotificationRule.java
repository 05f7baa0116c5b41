package alertflow.rule;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 通知规则
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class NotificationRule extends AlertRule {
    private String channelId;
    private List<String> receivers = new ArrayList<>();     // 渠道地址(手机号/邮箱/webhook用户)
    private Set<String> userIds = new LinkedHashSet<>();
    private Set<String> groupIds = new LinkedHashSet<>();
    private boolean useOnCall;
    private boolean waitForOnCall;                          // 无人值班时延迟到下一个班次
    private Duration delayTime;

    @Override
    public RuleKind getKind() {
        return RuleKind.NOTIFICATION;
    }

    public boolean isDelayed() {
        return delayTime != null && !delayTime.isZero() && !delayTime.isNegative();
    }
}
