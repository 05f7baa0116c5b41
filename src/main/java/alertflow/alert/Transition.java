package alertflow.alert;

import lombok.Builder;
import lombok.Data;

/**
 * 一次告警状态迁移,供规则触发器判断
 */
@Data
@Builder
public class Transition {
    private final String id;
    private final TransitionType type;
    private final String previousSeverity;
    private final String severity;
    private final String previousStatus;
    private final String status;
    private final HistoryEntry historyEntry;   // 重复告警且文本未变时为空

    public boolean isDuplicate() {
        return type == TransitionType.DUPLICATE;
    }

    /**
     * 基于告警当前状态构造升级迁移,id 用于升级去重
     */
    public static Transition escalation(Alert alert, String escalationId) {
        return Transition.builder()
                .id(escalationId)
                .type(TransitionType.ESCALATION)
                .previousSeverity(alert.getPreviousSeverity())
                .severity(alert.getSeverity())
                .previousStatus(alert.getStatus())
                .status(alert.getStatus())
                .build();
    }
}
