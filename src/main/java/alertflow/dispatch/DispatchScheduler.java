package alertflow.dispatch;

import alertflow.alert.Alert;
import alertflow.alert.AlertStateMachine;
import alertflow.blackout.SuppressionGate;
import alertflow.oncall.OnCallResolver;
import alertflow.oncall.Recipient;
import alertflow.oncall.RecipientResolution;
import alertflow.rule.AlertRule;
import alertflow.rule.NotificationRule;
import alertflow.store.AlertStore;
import alertflow.store.ConfigStore;
import alertflow.store.NotificationStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 通知调度: 处理延迟和等待值班,到期后调用渠道发送并记录结果
 */
@Slf4j
public class DispatchScheduler {
    static final String NO_ON_CALL_COVERAGE = "no on-call coverage";

    private final AlertStore alertStore;
    private final ConfigStore configStore;
    private final NotificationStore notificationStore;
    private final OnCallResolver onCallResolver;
    private final SuppressionGate suppressionGate;
    private final MessageRenderer messageRenderer;
    private final ChannelInvoker channelInvoker;
    private final DispatchDedupCache dedupCache;
    private final AlertStateMachine stateMachine;
    private final Clock clock;
    private final int lookaheadDays;

    public DispatchScheduler(AlertStore alertStore, ConfigStore configStore, NotificationStore notificationStore,
                             OnCallResolver onCallResolver, SuppressionGate suppressionGate,
                             MessageRenderer messageRenderer, ChannelInvoker channelInvoker,
                             DispatchDedupCache dedupCache, AlertStateMachine stateMachine,
                             Clock clock, int lookaheadDays) {
        this.alertStore = alertStore;
        this.configStore = configStore;
        this.notificationStore = notificationStore;
        this.onCallResolver = onCallResolver;
        this.suppressionGate = suppressionGate;
        this.messageRenderer = messageRenderer;
        this.channelInvoker = channelInvoker;
        this.dedupCache = dedupCache;
        this.stateMachine = stateMachine;
        this.clock = clock;
        this.lookaheadDays = lookaheadDays;
    }

    /**
     * 规则触发后调度: 配置了延迟则登记延迟通知,否则解析接收人后立即发送
     */
    public DispatchIntent schedule(Alert alert, NotificationRule rule, DispatchIntent pending, String template, Instant now) {
        if (rule.isDelayed()) {
            Instant fireTime = notificationStore.findDelayedNotification(alert.getId(), rule.getId())
                    .map(DelayedNotification::getFireTime)
                    .orElse(now.plus(rule.getDelayTime()));
            return delay(alert, rule, pending, template, now, fireTime);
        }

        RecipientResolution resolution = onCallResolver.resolve(rule, alert.getCustomer(), now);
        if (resolution.isNoCoverage()) {
            return handleNoCoverage(alert, rule, pending, template, now);
        }
        return send(alert, rule, pending, resolution.getRecipients(), template);
    }

    /**
     * 扫描到期的延迟通知,先删除(抢占)再发送,多实例并发执行时同一条只会被一个实例发送
     */
    public List<DispatchIntent> sweepDelayedNotifications(Instant now) {
        List<DispatchIntent> intents = new ArrayList<>();
        for (DelayedNotification delayed : notificationStore.listDueDelayedNotifications(now)) {
            if (!notificationStore.deleteDelayedNotification(delayed.getId())) {
                log.debug("延迟通知已被其他实例处理: {}", delayed.getId());
                continue;
            }
            try {
                fireDelayed(delayed, now).ifPresent(intents::add);
            } catch (Exception e) {
                log.error("处理延迟通知失败: alert={}, rule={}", delayed.getAlertId(), delayed.getRuleId(), e);
            }
        }
        return intents;
    }

    private Optional<DispatchIntent> fireDelayed(DelayedNotification delayed, Instant now) {
        Optional<Alert> found = alertStore.getAlert(delayed.getAlertId());
        if (!found.isPresent()) {
            log.warn("延迟通知对应的告警不存在: {}", delayed.getAlertId());
            return Optional.empty();
        }
        Alert alert = found.get();
        if (stateMachine.isResolved(alert.getStatus())) {
            log.info("告警已恢复,取消延迟通知: alert={}, rule={}", alert.getId(), delayed.getRuleId());
            return Optional.empty();
        }

        Optional<AlertRule> rule = configStore.getRule(delayed.getRuleId());
        if (!rule.isPresent() || !(rule.get() instanceof NotificationRule)) {
            log.warn("延迟通知对应的规则不存在: {}", delayed.getRuleId());
            return Optional.empty();
        }
        NotificationRule notificationRule = (NotificationRule) rule.get();
        if (!notificationRule.isActiveAt(now)) {
            log.info("规则已停用,丢弃延迟通知: rule={}", notificationRule.getId());
            return Optional.empty();
        }

        DispatchIntent pending = DispatchIntent.builder()
                .alertId(alert.getId())
                .ruleId(notificationRule.getId())
                .ruleKind(notificationRule.getKind())
                .channelId(notificationRule.getChannelId())
                .transitionId(delayed.getTransitionId())
                .transitionType(delayed.getTransitionType())
                .state(DispatchState.READY)
                .build();

        if (suppressionGate.suppressed(alert, configStore.listBlackouts(alert.getEnvironment()), now)) {
            return Optional.of(pending.toBuilder().state(DispatchState.SKIPPED).error("suppressed by blackout").build());
        }

        RecipientResolution resolution = onCallResolver.resolve(notificationRule, alert.getCustomer(), now);
        if (resolution.isNoCoverage()) {
            return Optional.of(handleNoCoverage(alert, notificationRule, pending, delayed.getTemplate(), now));
        }
        return Optional.of(send(alert, notificationRule, pending, resolution.getRecipients(), delayed.getTemplate()));
    }

    private DispatchIntent handleNoCoverage(Alert alert, NotificationRule rule, DispatchIntent pending,
                                            String template, Instant now) {
        if (rule.isWaitForOnCall()) {
            Optional<Instant> next = onCallResolver.nextCoverageStart(rule, alert.getCustomer(), now, lookaheadDays);
            if (next.isPresent()) {
                log.info("当前无人值班,等待下一个班次: alert={}, rule={}, fireTime={}", alert.getId(), rule.getId(), next.get());
                return delay(alert, rule, pending, template, now, next.get());
            }
        }
        log.warn("无人值班,跳过通知: alert={}, rule={}", alert.getId(), rule.getId());
        notificationStore.recordNotificationOutcome(NotificationHistory.builder()
                .sent(false)
                .state(DispatchState.SKIPPED)
                .channel(rule.getChannelId())
                .rule(rule.getId())
                .alert(alert.getId())
                .transitionId(pending.getTransitionId())
                .sentTime(clock.instant())
                .error(NO_ON_CALL_COVERAGE)
                .build());
        return pending.toBuilder().state(DispatchState.SKIPPED).error(NO_ON_CALL_COVERAGE).build();
    }

    private DispatchIntent delay(Alert alert, NotificationRule rule, DispatchIntent pending, String template,
                                 Instant now, Instant fireTime) {
        DelayedNotification delayed = notificationStore.upsertDelayedNotification(DelayedNotification.builder()
                .alertId(alert.getId())
                .ruleId(rule.getId())
                .transitionId(pending.getTransitionId())
                .transitionType(pending.getTransitionType())
                .template(template)
                .createTime(now)
                .delayTime(Duration.between(now, fireTime))
                .fireTime(fireTime)
                .build());
        log.debug("登记延迟通知: alert={}, rule={}, fireTime={}", alert.getId(), rule.getId(), delayed.getFireTime());
        return pending.toBuilder().state(DispatchState.DELAYED).fireTime(fireTime).build();
    }

    private DispatchIntent send(Alert alert, NotificationRule rule, DispatchIntent pending,
                                Set<Recipient> recipients, String template) {
        DispatchIntent ready = pending.toBuilder()
                .state(DispatchState.READY)
                .recipients(new ArrayList<>(recipients))
                .message(messageRenderer.render(template, alert))
                .build();

        if (!dedupCache.markIfAbsent(alert.getId(), rule.getId(), ready.getTransitionId())) {
            log.debug("通知已发送过,忽略: alert={}, rule={}, transition={}",
                    alert.getId(), rule.getId(), ready.getTransitionId());
            return ready.toBuilder().state(DispatchState.SKIPPED).error("already dispatched").build();
        }

        Optional<NotificationChannel> channel = configStore.getChannel(rule.getChannelId());
        SendOutcome outcome = channel
                .map(c -> channelInvoker.invoke(c, ready))
                .orElseGet(() -> {
                    log.error("通知渠道不存在: rule={}, channel={}", rule.getId(), rule.getChannelId());
                    return SendOutcome.failure("channel not found: " + rule.getChannelId(), 0);
                });

        notificationStore.recordNotificationOutcome(NotificationHistory.builder()
                .sent(outcome.isSuccess())
                .state(outcome.isSuccess() ? DispatchState.SENT : DispatchState.FAILED)
                .message(ready.getMessage())
                .channel(rule.getChannelId())
                .rule(rule.getId())
                .alert(alert.getId())
                .transitionId(ready.getTransitionId())
                .receivers(recipients.stream().map(Recipient::toString).collect(Collectors.toList()))
                .sender(channel.map(NotificationChannel::getSender).orElse(null))
                .sentTime(clock.instant())
                .error(outcome.getError())
                .attempts(outcome.getAttempts())
                .build());

        return ready.toBuilder()
                .state(outcome.isSuccess() ? DispatchState.SENT : DispatchState.FAILED)
                .error(outcome.getError())
                .build();
    }

    /**
     * 告警恢复/关闭时取消待发送的延迟通知和升级
     */
    public int cancelForAlert(String alertId) {
        List<DelayedNotification> cancelled = notificationStore.deleteDelayedNotificationsForAlert(alertId);
        notificationStore.clearEscalations(alertId);
        if (!cancelled.isEmpty()) {
            log.info("告警已恢复,取消延迟通知 {} 条: alert={}", cancelled.size(), alertId);
        }
        return cancelled.size();
    }
}
