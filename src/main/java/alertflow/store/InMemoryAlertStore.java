package alertflow.store;

import alertflow.alert.Alert;
import alertflow.alert.AlertKey;
import alertflow.exception.ConflictException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

@Slf4j
public class InMemoryAlertStore implements AlertStore {
    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();
    private final Map<AlertKey, String> keyIndex = new ConcurrentHashMap<>();

    @Override
    public Optional<Alert> getAlert(String id) {
        Alert alert = alerts.get(id);
        return alert == null ? Optional.empty() : Optional.of(alert.copy());
    }

    @Override
    public Optional<Alert> getAlertByKey(AlertKey key) {
        String id = keyIndex.get(key);
        return id == null ? Optional.empty() : getAlert(id);
    }

    @Override
    public Optional<Alert> findCorrelated(AlertKey key, List<String> correlate) {
        List<String> reportCorrelate = correlate == null ? List.of() : correlate;
        return alerts.values().stream()
                .filter(alert -> key.sameScope(alert.identityKey()))
                .filter(alert -> !key.getEvent().equals(alert.getEvent()))
                .filter(alert -> reportCorrelate.contains(alert.getEvent())
                        || (alert.getCorrelate() != null && alert.getCorrelate().contains(key.getEvent())))
                .findFirst()
                .map(Alert::copy);
    }

    @Override
    public Alert upsertAlert(Alert alert) {
        return alert.getVersion() == 0 ? insert(alert) : update(alert);
    }

    private Alert insert(Alert alert) {
        AlertKey key = alert.identityKey();
        if (keyIndex.putIfAbsent(key, alert.getId()) != null) {
            throw new ConflictException("告警已存在: " + key);
        }
        Alert stored = alert.copy();
        stored.setVersion(1);
        alerts.put(stored.getId(), stored);
        return stored.copy();
    }

    private Alert update(Alert alert) {
        Alert current = alerts.get(alert.getId());
        if (current == null) {
            throw new ConflictException("告警不存在: " + alert.getId());
        }
        AlertKey oldKey = current.identityKey();
        AlertKey newKey = alert.identityKey();
        boolean rekey = !oldKey.equals(newKey);
        if (rekey && keyIndex.putIfAbsent(newKey, alert.getId()) != null) {
            throw new ConflictException("关联后的告警键已被占用: " + newKey);
        }

        Alert[] result = new Alert[1];
        alerts.compute(alert.getId(), (id, existing) -> {
            if (existing == null || existing.getVersion() != alert.getVersion()) {
                return existing;
            }
            Alert stored = alert.copy();
            stored.setVersion(existing.getVersion() + 1);
            result[0] = stored;
            return stored;
        });

        if (result[0] == null) {
            if (rekey) {
                keyIndex.remove(newKey, alert.getId());
            }
            throw new ConflictException("告警版本冲突: " + alert.getId());
        }
        if (rekey) {
            keyIndex.remove(oldKey, alert.getId());
        }
        return result[0].copy();
    }

    @Override
    public List<Alert> findAlerts(Predicate<Alert> filter) {
        return alerts.values().stream()
                .filter(filter)
                .map(Alert::copy)
                .collect(Collectors.toList());
    }
}
