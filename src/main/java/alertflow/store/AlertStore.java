package alertflow.store;

import alertflow.alert.Alert;
import alertflow.alert.AlertKey;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 告警存储接口
 */
public interface AlertStore {

    Optional<Alert> getAlert(String id);

    /**
     * 按 (environment, resource, event, customer) 精确查找
     */
    Optional<Alert> getAlertByKey(AlertKey key);

    /**
     * 查找可关联的告警: 同 environment/resource/customer,且 key 的事件出现在其 correlate 列表中(或其事件出现在上报的 correlate 列表中)
     */
    Optional<Alert> findCorrelated(AlertKey key, List<String> correlate);

    /**
     * 条件写入: alert.version 为 0 表示新建,否则必须与存储中的版本一致。
     * 版本冲突或唯一键被占用时抛出 ConflictException。返回写入后的告警(版本号已递增)
     */
    Alert upsertAlert(Alert alert);

    List<Alert> findAlerts(Predicate<Alert> filter);
}
