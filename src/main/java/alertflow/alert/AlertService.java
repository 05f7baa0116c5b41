package alertflow.alert;

import alertflow.exception.ConflictException;
import alertflow.exception.NotFoundException;
import alertflow.exception.ValidationException;
import alertflow.store.AlertStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * 告警接入服务: 校验、标识解析、状态机计算、条件写入,版本冲突时重读重试
 */
@Slf4j
public class AlertService {
    private final AlertStore alertStore;
    private final AlertKeyResolver keyResolver;
    private final AlertStateMachine stateMachine;
    private final int maxRetries;

    public AlertService(AlertStore alertStore, AlertKeyResolver keyResolver,
                        AlertStateMachine stateMachine, int maxRetries) {
        this.alertStore = alertStore;
        this.keyResolver = keyResolver;
        this.stateMachine = stateMachine;
        this.maxRetries = Math.max(1, maxRetries);
    }

    public IngestResult ingestAlert(AlertReport report) {
        validate(report);

        ConflictException lastConflict = null;
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            KeyResolution resolution = keyResolver.resolve(report);
            IngestResult result = stateMachine.ingest(resolution, report);
            try {
                Alert stored = alertStore.upsertAlert(result.getAlert());
                return new IngestResult(stored, result.getTransition());
            } catch (ConflictException e) {
                lastConflict = e;
                log.debug("告警写入冲突,重试 {}/{}: {}", attempt, maxRetries, e.getMessage());
            }
        }
        log.warn("告警写入冲突重试次数耗尽: key={}", report.identityKey());
        throw lastConflict;
    }

    public IngestResult setAlertStatus(String alertId, String status, String user, String text) {
        ConflictException lastConflict = null;
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            Alert alert = alertStore.getAlert(alertId)
                    .orElseThrow(() -> new NotFoundException("告警不存在: " + alertId));
            IngestResult result = stateMachine.setStatus(alert, status, user, text);
            try {
                Alert stored = alertStore.upsertAlert(result.getAlert());
                return new IngestResult(stored, result.getTransition());
            } catch (ConflictException e) {
                lastConflict = e;
                log.debug("告警状态写入冲突,重试 {}/{}: {}", attempt, maxRetries, e.getMessage());
            }
        }
        log.warn("告警状态写入冲突重试次数耗尽: id={}", alertId);
        throw lastConflict;
    }

    public boolean isResolved(String status) {
        return stateMachine.isResolved(status);
    }

    private void validate(AlertReport report) {
        if (report == null) {
            throw new ValidationException("告警上报不能为空");
        }
        if (StringUtils.isBlank(report.getEnvironment())) {
            throw new ValidationException("environment 不能为空");
        }
        if (StringUtils.isBlank(report.getResource())) {
            throw new ValidationException("resource 不能为空");
        }
        if (StringUtils.isBlank(report.getEvent())) {
            throw new ValidationException("event 不能为空");
        }
    }
}
