package alertflow.alert;

/**
 * 告警状态机产生的迁移类型
 */
public enum TransitionType {
    OPENED,
    DUPLICATE,
    CORRELATED,
    SEVERITY_CHANGE,
    STATUS_CHANGE,
    ESCALATION
}
