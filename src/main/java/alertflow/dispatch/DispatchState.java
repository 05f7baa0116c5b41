package alertflow.dispatch;

/**
 * 单个 (告警, 规则) 的发送状态: PENDING -> DELAYED -> READY -> SENT | FAILED
 */
public enum DispatchState {
    PENDING,
    DELAYED,
    READY,
    SENT,
    FAILED,
    SKIPPED
}
