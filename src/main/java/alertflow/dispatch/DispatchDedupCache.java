package alertflow.dispatch;

/**
 * 发送去重 - 同一 (alertId, ruleId, transitionId) 只发送一次
 */
public interface DispatchDedupCache {

    /**
     * 首次登记返回 true,已存在返回 false
     */
    boolean markIfAbsent(String alertId, String ruleId, String transitionId);

    boolean exists(String alertId, String ruleId, String transitionId);

    /**
     * 清理过期记录
     */
    void cleanup();
}
