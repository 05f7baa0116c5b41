package alertflow.rule;

import alertflow.alert.Alert;
import alertflow.utils.TimeWindows;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 规则匹配: 作用域、标签、排除标签、启用状态、生效时间窗口。
 * 不判断级别和状态迁移,无副作用
 */
@Slf4j
public class RuleMatcher {
    private static final Comparator<AlertRule> ORDER = Comparator
            .comparingInt(AlertRule::effectivePriority)
            .thenComparing(AlertRule::getCreateTime, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingLong(AlertRule::getSequence);

    private final ZoneId zone;

    public RuleMatcher(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * 返回匹配的规则,按优先级升序、创建时间升序排列
     */
    public <T extends AlertRule> List<T> match(Alert alert, List<T> rules, Instant now) {
        return rules.stream()
                .filter(rule -> matches(alert, rule, now))
                .sorted(ORDER)
                .collect(Collectors.toList());
    }

    public boolean matches(Alert alert, AlertRule rule, Instant now) {
        if (!rule.isActiveAt(now)) {
            log.debug("规则未启用: rule={}", rule.getId());
            return false;
        }
        if (!matchesScope(alert, rule)) {
            return false;
        }
        if (!matchesTags(alert.getTags(), rule.getTags())) {
            log.debug("规则标签不匹配: rule={}, tags={}", rule.getId(), alert.getTags());
            return false;
        }
        if (isExcluded(alert.getTags(), rule.getExcludedTags())) {
            log.debug("告警命中排除标签: rule={}, tags={}", rule.getId(), alert.getTags());
            return false;
        }
        if (!isInTimeWindow(rule, now)) {
            log.debug("不在规则生效时间内: rule={}", rule.getId());
            return false;
        }
        return true;
    }

    private boolean matchesScope(Alert alert, AlertRule rule) {
        return Objects.equals(rule.getEnvironment(), alert.getEnvironment())
                && matchesOptional(rule.getResource(), alert.getResource())
                && matchesOptional(rule.getEvent(), alert.getEvent())
                && matchesOptional(rule.getGroup(), alert.getGroup())
                && matchesOptional(rule.getCustomer(), alert.getCustomer())
                && matchesService(rule.getService(), alert.getService());
    }

    static boolean matchesOptional(String expected, String actual) {
        return StringUtils.isEmpty(expected) || expected.equals(actual);
    }

    /**
     * 规则配置的 service 必须全部出现在告警的 service 中
     */
    static boolean matchesService(Set<String> expected, Set<String> actual) {
        return CollectionUtils.isEmpty(expected) || (actual != null && actual.containsAll(expected));
    }

    /**
     * 任意一个标签条件满足即匹配,未配置标签条件时不限制
     */
    static boolean matchesTags(Set<String> tags, List<AdvancedTag> conditions) {
        if (CollectionUtils.isEmpty(conditions)) {
            return true;
        }
        return conditions.stream().anyMatch(condition -> condition.matches(tags));
    }

    static boolean isExcluded(Set<String> tags, List<AdvancedTag> excluded) {
        return excluded != null && excluded.stream().anyMatch(condition -> condition.excludes(tags));
    }

    private boolean isInTimeWindow(AlertRule rule, Instant now) {
        ZonedDateTime local = now.atZone(zone);
        LocalTime time = local.toLocalTime();
        if (!TimeWindows.contains(rule.getStartTime(), rule.getEndTime(), time)) {
            return false;
        }
        if (CollectionUtils.isEmpty(rule.getDays())) {
            return true;
        }
        // 跨零点窗口的后半段属于前一天的班次
        ZonedDateTime day = TimeWindows.inWrappedTail(rule.getStartTime(), rule.getEndTime(), time)
                ? local.minusDays(1)
                : local;
        return rule.getDays().contains(TimeWindows.dayAbbreviation(day.getDayOfWeek()));
    }
}
