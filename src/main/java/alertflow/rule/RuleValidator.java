package alertflow.rule;

import alertflow.alert.SeverityRanking;
import alertflow.blackout.Blackout;
import alertflow.dispatch.NotificationChannel;
import alertflow.exception.ValidationException;
import alertflow.oncall.OnCall;
import alertflow.oncall.RepeatType;
import alertflow.utils.TimeWindows;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.time.DayOfWeek;
import java.time.Month;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 配置保存前校验,匹配阶段假定配置合法
 */
public class RuleValidator {
    private static final Set<String> DAYS = Arrays.stream(DayOfWeek.values())
            .map(TimeWindows::dayAbbreviation)
            .collect(ImmutableSet.toImmutableSet());
    private static final Set<String> MONTHS = Arrays.stream(Month.values())
            .map(TimeWindows::monthAbbreviation)
            .collect(ImmutableSet.toImmutableSet());
    private static final Set<String> CHANNEL_TYPES = ImmutableSet.of("webhook", "dingding", "log");

    private final SeverityRanking severityRanking;

    public RuleValidator(SeverityRanking severityRanking) {
        this.severityRanking = severityRanking;
    }

    public void validate(AlertRule rule) {
        if (rule == null) {
            throw new ValidationException("规则不能为空");
        }
        String name = StringUtils.defaultString(rule.getName(), rule.getId());
        if (StringUtils.isBlank(rule.getEnvironment())) {
            throw new ValidationException("规则 environment 不能为空: " + name);
        }
        if (rule.getPriority() != null && rule.getPriority() < 0) {
            throw new ValidationException("规则 priority 不能为负数: " + name);
        }
        validateTags(rule.getTags(), name, "tags");
        validateTags(rule.getExcludedTags(), name, "excludedTags");
        validateDays(rule.getDays(), name);
        if ((rule.getStartTime() == null) != (rule.getEndTime() == null)) {
            throw new ValidationException("startTime 和 endTime 必须同时配置: " + name);
        }
        validateTriggers(rule, name);

        if (rule instanceof NotificationRule) {
            validateNotificationRule((NotificationRule) rule, name);
        } else if (rule instanceof EscalationRule) {
            EscalationRule escalation = (EscalationRule) rule;
            if (escalation.getTime() == null || escalation.getTime().isZero() || escalation.getTime().isNegative()) {
                throw new ValidationException("升级规则 time 必须大于0: " + name);
            }
        }
    }

    private void validateNotificationRule(NotificationRule rule, String name) {
        if (StringUtils.isBlank(rule.getChannelId())) {
            throw new ValidationException("通知规则 channelId 不能为空: " + name);
        }
        // YAML 中的空键会被反序列化为 null
        if (rule.getReceivers() == null) {
            rule.setReceivers(new ArrayList<>());
        }
        if (rule.getUserIds() == null) {
            rule.setUserIds(new LinkedHashSet<>());
        }
        if (rule.getGroupIds() == null) {
            rule.setGroupIds(new LinkedHashSet<>());
        }
        if (rule.getDelayTime() != null && rule.getDelayTime().isNegative()) {
            throw new ValidationException("通知规则 delayTime 不能为负数: " + name);
        }
        if (!rule.isUseOnCall()
                && CollectionUtils.isEmpty(rule.getReceivers())
                && CollectionUtils.isEmpty(rule.getUserIds())
                && CollectionUtils.isEmpty(rule.getGroupIds())) {
            throw new ValidationException("通知规则未配置接收人: " + name);
        }
        if (rule.isWaitForOnCall() && !rule.isUseOnCall()) {
            throw new ValidationException("waitForOnCall 需要同时开启 useOnCall: " + name);
        }
    }

    private void validateTags(List<AdvancedTag> tags, String name, String field) {
        if (tags == null) {
            throw new ValidationException(field + " 不能为 null: " + name);
        }
        for (AdvancedTag tag : tags) {
            if (tag == null || tag.getAll() == null || tag.getAny() == null) {
                throw new ValidationException(field + " 结构不合法: " + name);
            }
            if (tag.getAll().stream().anyMatch(StringUtils::isBlank) || tag.getAny().stream().anyMatch(StringUtils::isBlank)) {
                throw new ValidationException(field + " 包含空标签: " + name);
            }
        }
    }

    private void validateTriggers(AlertRule rule, String name) {
        if (rule.getTriggers() == null) {
            throw new ValidationException("triggers 不能为 null: " + name);
        }
        for (Trigger trigger : rule.getTriggers()) {
            if (trigger == null || trigger.getFromSeverity() == null
                    || trigger.getToSeverity() == null || trigger.getStatus() == null) {
                throw new ValidationException("触发条件结构不合法: " + name);
            }
            Set<String> unknown = Stream
                    .concat(trigger.getFromSeverity().stream(), trigger.getToSeverity().stream())
                    .filter(severity -> !severityRanking.isKnown(severity))
                    .collect(Collectors.toSet());
            if (!unknown.isEmpty()) {
                throw new ValidationException("触发条件包含未知级别 " + unknown + ": " + name);
            }
        }
    }

    private void validateDays(Set<String> days, String name) {
        if (days == null) {
            return;
        }
        for (String day : days) {
            if (!DAYS.contains(day)) {
                throw new ValidationException("无效的星期 " + day + ": " + name);
            }
        }
    }

    public void validate(Blackout blackout) {
        if (StringUtils.isBlank(blackout.getEnvironment())) {
            throw new ValidationException("屏蔽窗口 environment 不能为空: " + blackout.getId());
        }
        if (blackout.getStartTime() == null || blackout.effectiveEndTime() == null) {
            throw new ValidationException("屏蔽窗口必须配置 startTime 以及 endTime 或 duration: " + blackout.getId());
        }
        if (!blackout.effectiveEndTime().isAfter(blackout.getStartTime())) {
            throw new ValidationException("屏蔽窗口结束时间必须晚于开始时间: " + blackout.getId());
        }
        validateTags(blackout.getTags(), blackout.getId(), "tags");
    }

    public void validate(OnCall onCall) {
        if (CollectionUtils.isEmpty(onCall.getUserIds()) && CollectionUtils.isEmpty(onCall.getGroupIds())) {
            throw new ValidationException("值班安排至少需要配置 userIds 或 groupIds: " + onCall.getId());
        }
        if ((onCall.getStartTime() == null) != (onCall.getEndTime() == null)) {
            throw new ValidationException("值班 startTime 和 endTime 必须同时配置: " + onCall.getId());
        }
        if (onCall.getRepeatType() == RepeatType.NONE && onCall.getStartDate() == null) {
            throw new ValidationException("不重复的值班安排必须配置 startDate: " + onCall.getId());
        }
        if (onCall.getStartDate() != null && onCall.getEndDate() != null
                && onCall.getEndDate().isBefore(onCall.getStartDate())) {
            throw new ValidationException("值班 endDate 不能早于 startDate: " + onCall.getId());
        }
        validateDays(onCall.getRepeatDays(), onCall.getId());
        if (onCall.getRepeatWeeks() != null
                && onCall.getRepeatWeeks().stream().anyMatch(week -> week == null || week < 1 || week > 5)) {
            throw new ValidationException("值班 repeatWeeks 取值范围 1-5: " + onCall.getId());
        }
        if (onCall.getRepeatMonths() != null && !MONTHS.containsAll(onCall.getRepeatMonths())) {
            throw new ValidationException("无效的月份 " + onCall.getRepeatMonths() + ": " + onCall.getId());
        }
    }

    public void validate(NotificationChannel channel) {
        if (StringUtils.isBlank(channel.getId())) {
            throw new ValidationException("通知渠道 id 不能为空");
        }
        if (channel.getType() == null || !CHANNEL_TYPES.contains(channel.getType())) {
            throw new ValidationException("不支持的通知渠道类型 " + channel.getType() + ": " + channel.getId());
        }
        if (!"log".equals(channel.getType()) && StringUtils.isBlank(channel.getUrl())) {
            throw new ValidationException("通知渠道 url 不能为空: " + channel.getId());
        }
    }
}
