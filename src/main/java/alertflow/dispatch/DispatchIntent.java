package alertflow.dispatch;

import alertflow.alert.TransitionType;
import alertflow.oncall.Recipient;
import alertflow.rule.RuleKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 一次通知意图: 哪个告警、哪条规则、发给谁、发什么
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DispatchIntent {
    private String alertId;
    private String ruleId;
    private RuleKind ruleKind;
    private String channelId;
    private String transitionId;
    private TransitionType transitionType;
    @Builder.Default
    private List<Recipient> recipients = new ArrayList<>();
    private String message;
    private DispatchState state;
    private Instant fireTime;       // 延迟发送的计划时间
    private String error;
}
