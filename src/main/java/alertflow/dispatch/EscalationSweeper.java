package alertflow.dispatch;

import alertflow.alert.Alert;
import alertflow.alert.AlertStateMachine;
import alertflow.alert.Transition;
import alertflow.rule.EscalationRule;
import alertflow.rule.RuleCache;
import alertflow.rule.RuleMatcher;
import alertflow.rule.TriggerEvaluator;
import alertflow.store.AlertStore;
import alertflow.store.NotificationStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 升级扫描: 未恢复的告警在升级规则的 time 内没有新上报时,按周期重新评估通知规则
 */
@Slf4j
public class EscalationSweeper {
    private final AlertStore alertStore;
    private final NotificationStore notificationStore;
    private final RuleCache ruleCache;
    private final RuleMatcher ruleMatcher;
    private final TriggerEvaluator triggerEvaluator;
    private final NotificationEngine notificationEngine;
    private final AlertStateMachine stateMachine;

    public EscalationSweeper(AlertStore alertStore, NotificationStore notificationStore, RuleCache ruleCache,
                             RuleMatcher ruleMatcher, TriggerEvaluator triggerEvaluator,
                             NotificationEngine notificationEngine, AlertStateMachine stateMachine) {
        this.alertStore = alertStore;
        this.notificationStore = notificationStore;
        this.ruleCache = ruleCache;
        this.ruleMatcher = ruleMatcher;
        this.triggerEvaluator = triggerEvaluator;
        this.notificationEngine = notificationEngine;
        this.stateMachine = stateMachine;
    }

    public List<DispatchIntent> sweep(Instant now) {
        List<DispatchIntent> intents = new ArrayList<>();
        List<Alert> unresolved = alertStore.findAlerts(alert -> !stateMachine.isResolved(alert.getStatus()));
        for (Alert alert : unresolved) {
            try {
                intents.addAll(escalate(alert, now));
            } catch (Exception e) {
                log.error("告警升级处理失败: alert={}", alert.getId(), e);
            }
        }
        return intents;
    }

    private List<DispatchIntent> escalate(Alert alert, Instant now) {
        List<DispatchIntent> intents = new ArrayList<>();
        List<EscalationRule> rules = ruleMatcher.match(alert, ruleCache.getEscalationRules(alert.getEnvironment()), now);
        for (EscalationRule rule : rules) {
            long period = period(alert, rule, now);
            if (period < 1) {
                continue;
            }
            // 新的上报会刷新 lastReceiveTime,周期从头计算
            String periodKey = alert.getLastReceiveTime().toEpochMilli() + ":" + period;
            Transition transition = Transition.escalation(alert, "escalation:" + rule.getId() + ":" + periodKey);
            if (!triggerEvaluator.fires(rule, transition)) {
                continue;
            }
            if (!notificationStore.claimEscalation(alert.getId(), rule.getId(), periodKey)) {
                continue;
            }
            log.info("告警升级: alert={}, escalationRule={}, period={}", alert.getId(), rule.getId(), period);
            intents.addAll(notificationEngine.evaluateNotifications(alert, transition));
        }
        return intents;
    }

    /**
     * 距最后一次上报经过了几个升级周期
     */
    static long period(Alert alert, EscalationRule rule, Instant now) {
        if (alert.getLastReceiveTime() == null || rule.getTime() == null || rule.getTime().isZero()) {
            return 0;
        }
        Duration elapsed = Duration.between(alert.getLastReceiveTime(), now);
        if (elapsed.isNegative()) {
            return 0;
        }
        return elapsed.toMillis() / rule.getTime().toMillis();
    }
}
