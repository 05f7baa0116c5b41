package alertflow;

import alertflow.alert.AlertReport;
import alertflow.alert.AlertService;
import alertflow.alert.IngestResult;
import alertflow.dispatch.DispatchIntent;
import alertflow.dispatch.DispatchScheduler;
import alertflow.dispatch.NotificationEngine;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 告警处理入口: 接入后立即评估通知规则;告警恢复时先取消待发送的延迟通知和升级
 */
@Slf4j
public class AlertPipeline {
    private final AlertService alertService;
    private final NotificationEngine notificationEngine;
    private final DispatchScheduler dispatchScheduler;

    public AlertPipeline(AlertService alertService, NotificationEngine notificationEngine,
                         DispatchScheduler dispatchScheduler) {
        this.alertService = alertService;
        this.notificationEngine = notificationEngine;
        this.dispatchScheduler = dispatchScheduler;
    }

    public Result receive(AlertReport report) {
        IngestResult ingest = alertService.ingestAlert(report);
        return process(ingest);
    }

    public Result changeStatus(String alertId, String status, String user, String text) {
        IngestResult ingest = alertService.setAlertStatus(alertId, status, user, text);
        return process(ingest);
    }

    private Result process(IngestResult ingest) {
        String status = ingest.getAlert().getStatus();
        if (alertService.isResolved(status) && !alertService.isResolved(ingest.getTransition().getPreviousStatus())) {
            dispatchScheduler.cancelForAlert(ingest.getAlert().getId());
        }
        List<DispatchIntent> intents = notificationEngine.evaluateNotifications(ingest.getAlert(), ingest.getTransition());
        return new Result(ingest, intents);
    }

    @Data
    public static class Result {
        private final IngestResult ingest;
        private final List<DispatchIntent> intents;
    }
}
