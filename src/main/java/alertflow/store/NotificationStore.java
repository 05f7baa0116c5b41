package alertflow.store;

import alertflow.dispatch.DelayedNotification;
import alertflow.dispatch.NotificationHistory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 延迟通知与发送记录存储
 */
public interface NotificationStore {

    /**
     * 按 (alertId, ruleId) 新建或覆盖延迟通知
     */
    DelayedNotification upsertDelayedNotification(DelayedNotification notification);

    Optional<DelayedNotification> findDelayedNotification(String alertId, String ruleId);

    /**
     * 删除延迟通知,返回 true 表示当前调用方抢到了这条记录
     */
    boolean deleteDelayedNotification(String id);

    List<DelayedNotification> deleteDelayedNotificationsForAlert(String alertId);

    List<DelayedNotification> listDueDelayedNotifications(Instant now);

    /**
     * 登记某个升级周期,同一 (alertId, ruleId, period) 只有第一次返回 true
     */
    boolean claimEscalation(String alertId, String ruleId, String period);

    void clearEscalations(String alertId);

    void recordNotificationOutcome(NotificationHistory history);

    List<NotificationHistory> listNotificationHistory(String alertId);
}
