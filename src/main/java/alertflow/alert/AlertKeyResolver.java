package alertflow.alert;

import alertflow.store.AlertStore;

import java.util.Optional;

/**
 * 计算上报告警的去重/关联标识,只读不写
 */
public class AlertKeyResolver {
    private final AlertStore alertStore;

    public AlertKeyResolver(AlertStore alertStore) {
        this.alertStore = alertStore;
    }

    public KeyResolution resolve(AlertReport report) {
        AlertKey key = report.identityKey();
        Optional<Alert> exact = alertStore.getAlertByKey(key);
        if (exact.isPresent()) {
            return KeyResolution.exact(exact.get());
        }
        return alertStore.findCorrelated(key, report.getCorrelate())
                .map(KeyResolution::correlated)
                .orElseGet(KeyResolution::newAlert);
    }
}
