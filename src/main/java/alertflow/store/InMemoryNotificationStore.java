package alertflow.store;

import alertflow.dispatch.DelayedNotification;
import alertflow.dispatch.NotificationHistory;
import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class InMemoryNotificationStore implements NotificationStore {
    private final Map<String, DelayedNotification> delayed = new ConcurrentHashMap<>();
    private final Set<String> escalations = ConcurrentHashMap.newKeySet();
    private final List<NotificationHistory> history = new CopyOnWriteArrayList<>();

    @Override
    public DelayedNotification upsertDelayedNotification(DelayedNotification notification) {
        String key = delayedKey(notification.getAlertId(), notification.getRuleId());
        return delayed.compute(key, (k, existing) -> notification.toBuilder()
                .id(existing != null ? existing.getId()
                        : notification.getId() != null ? notification.getId() : UUID.randomUUID().toString())
                .build());
    }

    @Override
    public Optional<DelayedNotification> findDelayedNotification(String alertId, String ruleId) {
        return Optional.ofNullable(delayed.get(delayedKey(alertId, ruleId)));
    }

    @Override
    public boolean deleteDelayedNotification(String id) {
        for (Map.Entry<String, DelayedNotification> entry : delayed.entrySet()) {
            if (entry.getValue().getId().equals(id)) {
                return delayed.remove(entry.getKey(), entry.getValue());
            }
        }
        return false;
    }

    @Override
    public List<DelayedNotification> deleteDelayedNotificationsForAlert(String alertId) {
        List<DelayedNotification> removed = new ArrayList<>();
        delayed.values().stream()
                .filter(notification -> notification.getAlertId().equals(alertId))
                .forEach(notification -> {
                    if (delayed.remove(delayedKey(alertId, notification.getRuleId()), notification)) {
                        removed.add(notification);
                    }
                });
        return removed;
    }

    @Override
    public List<DelayedNotification> listDueDelayedNotifications(Instant now) {
        return delayed.values().stream()
                .filter(notification -> notification.isDue(now))
                .sorted(Comparator.comparing(DelayedNotification::getFireTime))
                .collect(Collectors.toList());
    }

    @Override
    public boolean claimEscalation(String alertId, String ruleId, String period) {
        return escalations.add(alertId + "|" + ruleId + "|" + period);
    }

    @Override
    public void clearEscalations(String alertId) {
        escalations.removeIf(key -> key.startsWith(alertId + "|"));
    }

    @Override
    public void recordNotificationOutcome(NotificationHistory entry) {
        if (entry.getId() == null) {
            entry.setId(UUID.randomUUID().toString());
        }
        history.add(entry);
    }

    @Override
    public List<NotificationHistory> listNotificationHistory(String alertId) {
        return history.stream()
                .filter(entry -> alertId.equals(entry.getAlert()))
                .collect(ImmutableList.toImmutableList());
    }

    private static String delayedKey(String alertId, String ruleId) {
        return alertId + "|" + ruleId;
    }
}
