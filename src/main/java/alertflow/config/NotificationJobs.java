package alertflow.config;

import alertflow.dispatch.DispatchDedupCache;
import alertflow.dispatch.DispatchIntent;
import alertflow.dispatch.DispatchScheduler;
import alertflow.dispatch.EscalationSweeper;
import alertflow.rule.AlertRule;
import alertflow.rule.RuleFileLoader;
import alertflow.store.ConfigStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * 周期任务: 延迟通知扫描、升级扫描、规则自动恢复、规则文件重新扫描
 */
@Slf4j
@Component
public class NotificationJobs {

    @Autowired
    private DispatchScheduler dispatchScheduler;

    @Autowired
    private EscalationSweeper escalationSweeper;

    @Autowired
    private ConfigStore configStore;

    @Autowired
    private RuleFileLoader ruleFileLoader;

    @Autowired
    private DispatchDedupCache dispatchDedupCache;

    @Autowired
    private Clock clock;

    @Scheduled(fixedDelayString = "${alertflow.jobs.delayed-sweep-ms:30000}")
    public void sweepDelayedNotifications() {
        List<DispatchIntent> intents = dispatchScheduler.sweepDelayedNotifications(clock.instant());
        if (!intents.isEmpty()) {
            log.info("延迟通知扫描完成,处理 {} 条", intents.size());
        }
    }

    @Scheduled(fixedDelayString = "${alertflow.jobs.escalation-sweep-ms:60000}")
    public void sweepEscalations() {
        List<DispatchIntent> intents = escalationSweeper.sweep(clock.instant());
        if (!intents.isEmpty()) {
            log.info("升级扫描完成,处理 {} 条", intents.size());
        }
    }

    @Scheduled(fixedDelayString = "${alertflow.jobs.reactivate-ms:60000}")
    public void reactivateRules() {
        List<AlertRule> reactivated = configStore.reactivateRules(clock.instant());
        reactivated.forEach(rule -> log.info("规则已自动恢复: {}", rule.getId()));
    }

    @Scheduled(fixedDelayString = "${alertflow.jobs.rule-rescan-ms:300000}")
    public void rescanRules() {
        int changed = ruleFileLoader.rescan();
        if (changed > 0) {
            log.info("规则文件变更 {} 个", changed);
        }
        dispatchDedupCache.cleanup();
    }
}
