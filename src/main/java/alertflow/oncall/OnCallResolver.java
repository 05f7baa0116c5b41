package alertflow.oncall;

import alertflow.rule.NotificationRule;
import alertflow.store.ConfigStore;
import alertflow.utils.TimeWindows;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 值班解析: 将规则配置的用户/分组与当前值班人员求交,得到最终接收人
 */
@Slf4j
public class OnCallResolver {
    private final ConfigStore configStore;
    private final ZoneId zone;

    public OnCallResolver(ConfigStore configStore, ZoneId zone) {
        this.configStore = configStore;
        this.zone = zone;
    }

    /**
     * 规则的固定接收人始终保留;开启值班时再追加当前值班且符合规则的用户,
     * 两者都为空才视为无人值班
     */
    public RecipientResolution resolve(NotificationRule rule, String customer, Instant now) {
        Set<Recipient> recipients = new LinkedHashSet<>();
        CollectionUtils.emptyIfNull(rule.getReceivers())
                .forEach(receiver -> recipients.add(Recipient.receiver(receiver)));

        if (!rule.isUseOnCall()) {
            CollectionUtils.emptyIfNull(rule.getUserIds()).forEach(userId -> recipients.add(Recipient.user(userId)));
            CollectionUtils.emptyIfNull(rule.getGroupIds()).forEach(groupId -> recipients.add(Recipient.group(groupId)));
            return RecipientResolution.of(recipients);
        }

        Set<String> eligible = filterByRule(rule, onDutyUsers(customer, now));
        if (eligible.isEmpty() && recipients.isEmpty()) {
            log.warn("无人值班: rule={}, customer={}", rule.getId(), customer);
            return RecipientResolution.noCoverage();
        }
        if (eligible.isEmpty()) {
            log.info("无人值班,仅发送固定接收人: rule={}, customer={}", rule.getId(), customer);
        }
        eligible.forEach(userId -> recipients.add(Recipient.user(userId)));
        return RecipientResolution.of(recipients);
    }

    /**
     * 当前时刻值班的全部用户(分组已展开)
     */
    public Set<String> onDutyUsers(String customer, Instant now) {
        ZonedDateTime time = now.atZone(zone);
        Set<String> users = new LinkedHashSet<>();
        for (OnCall onCall : configStore.listOnCalls(customer)) {
            if (isOnCall(onCall, time)) {
                users.addAll(members(onCall.getUserIds(), onCall.getGroupIds()));
            }
        }
        return users;
    }

    /**
     * 在 lookaheadDays 天内查找下一个能覆盖该规则的班次开始时间
     */
    public Optional<Instant> nextCoverageStart(NotificationRule rule, String customer, Instant now, int lookaheadDays) {
        List<OnCall> onCalls = configStore.listOnCalls(customer);
        LocalDate today = now.atZone(zone).toLocalDate();
        Instant best = null;

        for (OnCall onCall : onCalls) {
            if (filterByRule(rule, members(onCall.getUserIds(), onCall.getGroupIds())).isEmpty()) {
                continue;
            }
            LocalTime shiftStart = onCall.getStartTime() != null ? onCall.getStartTime() : LocalTime.MIDNIGHT;
            for (int day = 0; day <= lookaheadDays; day++) {
                ZonedDateTime candidate = today.plusDays(day).atTime(shiftStart).atZone(zone);
                Instant instant = candidate.toInstant();
                if (!instant.isAfter(now) || (best != null && !instant.isBefore(best))) {
                    continue;
                }
                if (isOnCall(onCall, candidate)) {
                    best = instant;
                    break;
                }
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * 判断值班安排在某时刻是否生效,跨零点班次的后半段按前一天的日期判断
     */
    public boolean isOnCall(OnCall onCall, ZonedDateTime time) {
        LocalTime timeOfDay = time.toLocalTime();
        if (!TimeWindows.contains(onCall.getStartTime(), onCall.getEndTime(), timeOfDay)) {
            return false;
        }
        LocalDate date = TimeWindows.inWrappedTail(onCall.getStartTime(), onCall.getEndTime(), timeOfDay)
                ? time.toLocalDate().minusDays(1)
                : time.toLocalDate();

        if (onCall.getRepeatType() == RepeatType.LIST) {
            return withinDateRange(onCall, date) && matchesRepeat(onCall, date);
        }
        if (onCall.getStartDate() == null) {
            return false;
        }
        if (onCall.getEndDate() == null) {
            return date.equals(onCall.getStartDate());
        }
        return withinDateRange(onCall, date);
    }

    private static boolean withinDateRange(OnCall onCall, LocalDate date) {
        return (onCall.getStartDate() == null || !date.isBefore(onCall.getStartDate()))
                && (onCall.getEndDate() == null || !date.isAfter(onCall.getEndDate()));
    }

    private static boolean matchesRepeat(OnCall onCall, LocalDate date) {
        if (CollectionUtils.isNotEmpty(onCall.getRepeatDays())
                && !onCall.getRepeatDays().contains(TimeWindows.dayAbbreviation(date.getDayOfWeek()))) {
            return false;
        }
        if (CollectionUtils.isNotEmpty(onCall.getRepeatWeeks())
                && !onCall.getRepeatWeeks().contains(TimeWindows.weekOfMonth(date.getDayOfMonth()))) {
            return false;
        }
        return CollectionUtils.isEmpty(onCall.getRepeatMonths())
                || onCall.getRepeatMonths().contains(TimeWindows.monthAbbreviation(date.getMonth()));
    }

    /**
     * 规则未指定用户和分组时,所有值班人员都是接收人
     */
    private Set<String> filterByRule(NotificationRule rule, Set<String> onDuty) {
        if (CollectionUtils.isEmpty(rule.getUserIds()) && CollectionUtils.isEmpty(rule.getGroupIds())) {
            return onDuty;
        }
        Set<String> ruleUsers = members(rule.getUserIds(), rule.getGroupIds());
        ruleUsers.retainAll(onDuty);
        return ruleUsers;
    }

    private Set<String> members(Set<String> userIds, Set<String> groupIds) {
        Set<String> users = new LinkedHashSet<>();
        if (userIds != null) {
            users.addAll(userIds);
        }
        if (groupIds != null) {
            for (String groupId : groupIds) {
                Optional<NotificationGroup> group = configStore.getGroup(groupId);
                if (group.isPresent()) {
                    users.addAll(CollectionUtils.emptyIfNull(group.get().getUserIds()));
                } else {
                    log.warn("通知分组不存在: {}", groupId);
                }
            }
        }
        return users;
    }
}
