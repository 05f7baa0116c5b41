package alertflow.rule;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.Duration;

/**
 * 升级规则 - 告警未恢复时按 time 间隔重复通知
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class EscalationRule extends AlertRule {
    private Duration time;

    @Override
    public RuleKind getKind() {
        return RuleKind.ESCALATION;
    }
}
