package alertflow.alert;

import alertflow.config.AlertFlowConfig;
import alertflow.exception.ValidationException;
import com.google.common.collect.ImmutableSet;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * 告警生命周期状态机: 新建、重复折叠、关联、级别变化、状态变化。
 * 只计算新状态,不访问存储
 */
@Slf4j
public class AlertStateMachine {
    static final String HISTORY_NEW = "new";
    static final String HISTORY_SEVERITY = "severity";
    static final String HISTORY_STATUS = "status";
    static final String HISTORY_TEXT = "text";
    static final String HISTORY_CORRELATE = "correlate";

    private final SeverityRanking severityRanking;
    private final Clock clock;
    private final String defaultStatus;
    private final String closedStatus;
    private final Set<String> resolvedStatuses;
    private final String defaultSeverity;
    private final int historyLimit;

    public AlertStateMachine(AlertFlowConfig config, SeverityRanking severityRanking, Clock clock) {
        this.severityRanking = severityRanking;
        this.clock = clock;
        this.defaultStatus = config.getString("status.default", "open");
        List<String> resolved = config.getStringList("status.resolved", Arrays.asList("closed", "expired"));
        this.resolvedStatuses = ImmutableSet.copyOf(resolved);
        this.closedStatus = resolved.isEmpty() ? "closed" : resolved.get(0);
        this.defaultSeverity = config.getString("severity.default", "normal");
        this.historyLimit = config.getInt("history.limit", 100);
    }

    public boolean isResolved(String status) {
        return status != null && resolvedStatuses.contains(status);
    }

    public IngestResult ingest(KeyResolution resolution, AlertReport report) {
        Instant now = clock.instant();
        String severity = StringUtils.defaultIfBlank(report.getSeverity(), defaultSeverity);
        String receiveId = StringUtils.defaultIfBlank(report.getId(), UUID.randomUUID().toString());

        if (resolution.isNew()) {
            return open(report, severity, receiveId, now);
        }

        Alert alert = resolution.getExisting().copy();
        if (!resolution.isCorrelated() && severity.equals(alert.getSeverity())) {
            return duplicate(alert, report, receiveId, now);
        }
        return change(alert, resolution.isCorrelated(), report, severity, receiveId, now);
    }

    private IngestResult open(AlertReport report, String severity, String receiveId, Instant now) {
        String status = severityRanking.isCleared(severity)
                ? closedStatus
                : StringUtils.defaultIfBlank(report.getStatus(), defaultStatus);

        Alert alert = Alert.builder()
                .id(UUID.randomUUID().toString())
                .environment(report.getEnvironment())
                .resource(report.getResource())
                .event(report.getEvent())
                .customer(report.getCustomer())
                .severity(severity)
                .previousSeverity(severityRanking.getDefaultPrevious())
                .trendIndication(TrendIndication.NO_CHANGE)
                .status(status)
                .value(report.getValue())
                .text(report.getText())
                .group(report.getGroup())
                .origin(report.getOrigin())
                .type(report.getType())
                .createTime(report.getCreateTime() != null ? report.getCreateTime() : now)
                .receiveTime(now)
                .lastReceiveTime(now)
                .lastReceiveId(receiveId)
                .updateTime(now)
                .timeout(report.getTimeout())
                .duplicateCount(0)
                .repeat(false)
                .build()
                .copy();
        mergeClassification(alert, report);

        HistoryEntry entry = history(alert, receiveId, HISTORY_NEW, null, now);
        appendHistory(alert, entry);

        log.info("新告警: id={}, key={}, severity={}", alert.getId(), alert.identityKey(), severity);
        return new IngestResult(alert, Transition.builder()
                .id(receiveId)
                .type(TransitionType.OPENED)
                .previousSeverity(alert.getPreviousSeverity())
                .severity(severity)
                .status(status)
                .historyEntry(entry)
                .build());
    }

    private IngestResult duplicate(Alert alert, AlertReport report, String receiveId, Instant now) {
        boolean textChanged = !Objects.equals(alert.getText(), report.getText());
        String previousStatus = alert.getStatus();

        alert.setDuplicateCount(alert.getDuplicateCount() + 1);
        alert.setRepeat(true);
        alert.setValue(report.getValue());
        alert.setText(report.getText());
        alert.setLastReceiveTime(now);
        alert.setLastReceiveId(receiveId);
        if (report.getTimeout() != null) {
            alert.setTimeout(report.getTimeout());
        }
        mergeClassification(alert, report);

        // 已关闭的告警再次收到非恢复级别的上报时重新打开
        boolean reopened = isResolved(previousStatus) && !severityRanking.isCleared(alert.getSeverity());
        HistoryEntry entry = null;
        if (reopened) {
            alert.setStatus(defaultStatus);
            alert.setUpdateTime(now);
            entry = history(alert, receiveId, HISTORY_STATUS, null, now);
            appendHistory(alert, entry);
        } else if (textChanged) {
            entry = history(alert, receiveId, HISTORY_TEXT, null, now);
            appendHistory(alert, entry);
        }

        log.debug("重复告警: id={}, duplicateCount={}", alert.getId(), alert.getDuplicateCount());
        return new IngestResult(alert, Transition.builder()
                .id(receiveId)
                .type(reopened ? TransitionType.STATUS_CHANGE : TransitionType.DUPLICATE)
                .previousSeverity(alert.getPreviousSeverity())
                .severity(alert.getSeverity())
                .previousStatus(previousStatus)
                .status(alert.getStatus())
                .historyEntry(entry)
                .build());
    }

    private IngestResult change(Alert alert, boolean correlated, AlertReport report, String severity,
                                String receiveId, Instant now) {
        String previousSeverity = alert.getSeverity();
        String previousStatus = alert.getStatus();
        boolean severityChanged = !severity.equals(previousSeverity);

        alert.setEvent(report.getEvent());
        alert.setPreviousSeverity(previousSeverity);
        alert.setSeverity(severity);
        alert.setTrendIndication(severityChanged
                ? severityRanking.trend(previousSeverity, severity)
                : TrendIndication.NO_CHANGE);
        alert.setDuplicateCount(0);
        alert.setRepeat(false);
        alert.setValue(report.getValue());
        alert.setText(report.getText());
        alert.setReceiveTime(now);
        alert.setLastReceiveTime(now);
        alert.setLastReceiveId(receiveId);
        alert.setUpdateTime(now);
        if (report.getTimeout() != null) {
            alert.setTimeout(report.getTimeout());
        }
        mergeClassification(alert, report);

        if (severityRanking.isCleared(severity)) {
            alert.setStatus(closedStatus);
        } else if (isResolved(previousStatus)) {
            alert.setStatus(defaultStatus);
        } else if (StringUtils.isNotBlank(report.getStatus())) {
            alert.setStatus(report.getStatus());
        }

        HistoryEntry entry = history(alert, receiveId, severityChanged ? HISTORY_SEVERITY : HISTORY_CORRELATE, null, now);
        appendHistory(alert, entry);

        TransitionType type = severityChanged ? TransitionType.SEVERITY_CHANGE : TransitionType.CORRELATED;
        log.info("告警变化: id={}, type={}, {} -> {}, trend={}, status={}",
                alert.getId(), type, previousSeverity, severity, alert.getTrendIndication().getValue(), alert.getStatus());
        return new IngestResult(alert, Transition.builder()
                .id(receiveId)
                .type(type)
                .previousSeverity(previousSeverity)
                .severity(severity)
                .previousStatus(previousStatus)
                .status(alert.getStatus())
                .historyEntry(entry)
                .build());
    }

    /**
     * 人工修改告警状态,总是追加一条历史
     */
    public IngestResult setStatus(Alert existing, String status, String user, String text) {
        if (StringUtils.isBlank(status)) {
            throw new ValidationException("status 不能为空");
        }
        Instant now = clock.instant();
        Alert alert = existing.copy();
        String previousStatus = alert.getStatus();

        alert.setStatus(status);
        alert.setUpdateTime(now);

        String transitionId = UUID.randomUUID().toString();
        HistoryEntry entry = HistoryEntry.builder()
                .id(transitionId)
                .event(alert.getEvent())
                .severity(alert.getSeverity())
                .status(status)
                .value(alert.getValue())
                .text(StringUtils.defaultString(text))
                .type(HISTORY_STATUS)
                .updateTime(now)
                .user(user)
                .timeout(alert.getTimeout())
                .build();
        appendHistory(alert, entry);

        log.info("告警状态变更: id={}, {} -> {}, user={}", alert.getId(), previousStatus, status, user);
        return new IngestResult(alert, Transition.builder()
                .id(transitionId)
                .type(TransitionType.STATUS_CHANGE)
                .previousSeverity(alert.getPreviousSeverity())
                .severity(alert.getSeverity())
                .previousStatus(previousStatus)
                .status(status)
                .historyEntry(entry)
                .build());
    }

    private HistoryEntry history(Alert alert, String id, String type, String user, Instant now) {
        return HistoryEntry.builder()
                .id(id)
                .event(alert.getEvent())
                .severity(alert.getSeverity())
                .status(alert.getStatus())
                .value(alert.getValue())
                .text(alert.getText())
                .type(type)
                .updateTime(now)
                .user(user)
                .timeout(alert.getTimeout())
                .build();
    }

    /**
     * 追加历史并裁剪到 history.limit 条
     */
    private void appendHistory(Alert alert, HistoryEntry entry) {
        List<HistoryEntry> history = alert.getHistory();
        history.add(entry);
        while (history.size() > historyLimit) {
            history.remove(0);
        }
    }

    private void mergeClassification(Alert alert, AlertReport report) {
        if (report.getTags() != null) {
            alert.getTags().addAll(report.getTags());
        }
        if (report.getService() != null && !report.getService().isEmpty()) {
            alert.setService(new LinkedHashSet<>(report.getService()));
        }
        if (report.getCorrelate() != null && !report.getCorrelate().isEmpty()) {
            alert.getCorrelate().clear();
            alert.getCorrelate().addAll(report.getCorrelate());
        }
        if (report.getAttributes() != null) {
            for (Map.Entry<String, Object> attribute : report.getAttributes().entrySet()) {
                alert.getAttributes().put(attribute.getKey(), attribute.getValue());
            }
        }
        if (StringUtils.isNotBlank(report.getGroup())) {
            alert.setGroup(report.getGroup());
        }
        if (StringUtils.isNotBlank(report.getOrigin())) {
            alert.setOrigin(report.getOrigin());
        }
        if (StringUtils.isNotBlank(report.getType())) {
            alert.setType(report.getType());
        }
    }
}
