package alertflow.dispatch;

import alertflow.alert.Alert;
import alertflow.alert.Transition;
import alertflow.blackout.Blackout;
import alertflow.blackout.SuppressionGate;
import alertflow.rule.NotificationRule;
import alertflow.rule.RuleCache;
import alertflow.rule.RuleMatcher;
import alertflow.rule.TriggerEvaluator;
import alertflow.store.ConfigStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 通知规则评估: 匹配 -> 触发条件 -> 屏蔽 -> 调度。
 * 所有命中的规则都会触发,按优先级排序仅影响发送顺序
 */
@Slf4j
public class NotificationEngine {
    private final RuleCache ruleCache;
    private final RuleMatcher ruleMatcher;
    private final TriggerEvaluator triggerEvaluator;
    private final ConfigStore configStore;
    private final SuppressionGate suppressionGate;
    private final DispatchScheduler dispatchScheduler;
    private final Clock clock;

    public NotificationEngine(RuleCache ruleCache, RuleMatcher ruleMatcher, TriggerEvaluator triggerEvaluator,
                              ConfigStore configStore, SuppressionGate suppressionGate,
                              DispatchScheduler dispatchScheduler, Clock clock) {
        this.ruleCache = ruleCache;
        this.ruleMatcher = ruleMatcher;
        this.triggerEvaluator = triggerEvaluator;
        this.configStore = configStore;
        this.suppressionGate = suppressionGate;
        this.dispatchScheduler = dispatchScheduler;
        this.clock = clock;
    }

    public List<DispatchIntent> evaluateNotifications(Alert alert, Transition transition) {
        if (transition.isDuplicate()) {
            log.debug("重复告警不发送通知: alert={}", alert.getId());
            return Collections.emptyList();
        }
        Instant now = clock.instant();

        List<NotificationRule> firing = ruleMatcher
                .match(alert, ruleCache.getNotificationRules(alert.getEnvironment()), now)
                .stream()
                .filter(rule -> triggerEvaluator.fires(rule, transition))
                .collect(Collectors.toList());
        if (firing.isEmpty()) {
            log.debug("没有命中的通知规则: alert={}, transition={}", alert.getId(), transition.getType());
            return Collections.emptyList();
        }

        List<Blackout> blackouts = configStore.listBlackouts(alert.getEnvironment());
        Optional<Blackout> blackout = suppressionGate.findActive(alert, blackouts, now);
        if (blackout.isPresent()) {
            log.info("告警处于屏蔽窗口内,{} 条规则不发送: alert={}, blackout={}",
                    firing.size(), alert.getId(), blackout.get().getId());
            return Collections.emptyList();
        }

        List<DispatchIntent> intents = new ArrayList<>();
        for (NotificationRule rule : firing) {
            DispatchIntent pending = DispatchIntent.builder()
                    .alertId(alert.getId())
                    .ruleId(rule.getId())
                    .ruleKind(rule.getKind())
                    .channelId(rule.getChannelId())
                    .transitionId(transition.getId())
                    .transitionType(transition.getType())
                    .state(DispatchState.PENDING)
                    .build();
            String template = triggerEvaluator.messageTemplate(rule, transition);
            try {
                intents.add(dispatchScheduler.schedule(alert, rule, pending, template, now));
            } catch (Exception e) {
                log.error("调度通知失败: alert={}, rule={}", alert.getId(), rule.getId(), e);
                intents.add(pending.toBuilder().state(DispatchState.FAILED).error(e.getMessage()).build());
            }
        }
        return intents;
    }
}
