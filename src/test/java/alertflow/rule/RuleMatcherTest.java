package alertflow.rule;

import alertflow.alert.Alert;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

class RuleMatcherTest {

    // 2024-01-01 是星期一
    private static final Instant MONDAY_10AM = Instant.parse("2024-01-01T10:00:00Z");

    private final RuleMatcher matcher = new RuleMatcher(ZoneOffset.UTC);

    @Test
    void shouldMatchAdvancedTags() {
        NotificationRule rule = rule("r1");
        rule.setTags(Collections.singletonList(new AdvancedTag(set("db"), set("prod", "staging"))));

        assertThat(matcher.matches(alert(set("db", "prod", "eu")), rule, MONDAY_10AM), is(true));
        assertThat(matcher.matches(alert(set("db", "dev")), rule, MONDAY_10AM), is(false));
    }

    @Test
    void shouldMatchWhenAnyTagGroupMatches() {
        NotificationRule rule = rule("r1");
        rule.setTags(Arrays.asList(AdvancedTag.ofAll(set("web")), AdvancedTag.ofAll(set("db"))));

        assertThat(matcher.matches(alert(set("db")), rule, MONDAY_10AM), is(true));
        assertThat(matcher.matches(alert(set("cache")), rule, MONDAY_10AM), is(false));
    }

    @Test
    void shouldVetoOnExcludedTags() {
        NotificationRule rule = rule("r1");
        rule.setExcludedTags(Collections.singletonList(new AdvancedTag(set(), set("maintenance", "test"))));

        assertThat(matcher.matches(alert(set("db", "test")), rule, MONDAY_10AM), is(false));
        assertThat(matcher.matches(alert(set("db")), rule, MONDAY_10AM), is(true));
    }

    @Test
    void shouldIgnoreEmptyExcludedGroup() {
        NotificationRule rule = rule("r1");
        rule.setExcludedTags(Collections.singletonList(new AdvancedTag()));

        assertThat(matcher.matches(alert(set("db")), rule, MONDAY_10AM), is(true));
    }

    @Test
    void shouldRequireServiceSubset() {
        NotificationRule rule = rule("r1");
        rule.setService(set("billing", "api"));

        Alert both = alert(set());
        both.setService(set("billing", "api", "web"));
        Alert one = alert(set());
        one.setService(set("billing"));

        assertThat(matcher.matches(both, rule, MONDAY_10AM), is(true));
        assertThat(matcher.matches(one, rule, MONDAY_10AM), is(false));
    }

    @Test
    void shouldMatchScopeFields() {
        NotificationRule rule = rule("r1");
        rule.setResource("db01");
        rule.setCustomer("acme");

        Alert alert = alert(set());
        assertThat(matcher.matches(alert, rule, MONDAY_10AM), is(false));
        alert.setCustomer("acme");
        assertThat(matcher.matches(alert, rule, MONDAY_10AM), is(true));
        alert.setEnvironment("Development");
        assertThat(matcher.matches(alert, rule, MONDAY_10AM), is(false));
    }

    @Test
    void shouldHonourReactivateTime() {
        NotificationRule rule = rule("r1");
        rule.setActive(false);
        rule.setReactivate(MONDAY_10AM.plusSeconds(60));

        assertThat(matcher.matches(alert(set()), rule, MONDAY_10AM), is(false));
        assertThat(matcher.matches(alert(set()), rule, MONDAY_10AM.plusSeconds(60)), is(true));
    }

    @Test
    void shouldCheckDaysAndTimeWindow() {
        NotificationRule rule = rule("r1");
        rule.setDays(set("Mon", "Tue"));
        rule.setStartTime(LocalTime.of(9, 0));
        rule.setEndTime(LocalTime.of(17, 0));

        assertThat(matcher.matches(alert(set()), rule, MONDAY_10AM), is(true));
        assertThat(matcher.matches(alert(set()), rule, Instant.parse("2024-01-01T18:00:00Z")), is(false));
        assertThat(matcher.matches(alert(set()), rule, Instant.parse("2024-01-03T10:00:00Z")), is(false));
    }

    @Test
    void shouldAttributeWrappedWindowTailToPreviousDay() {
        NotificationRule rule = rule("r1");
        rule.setDays(set("Mon"));
        rule.setStartTime(LocalTime.of(22, 0));
        rule.setEndTime(LocalTime.of(6, 0));

        // 周二凌晨属于周一晚上的窗口
        assertThat(matcher.matches(alert(set()), rule, Instant.parse("2024-01-02T02:00:00Z")), is(true));
        assertThat(matcher.matches(alert(set()), rule, Instant.parse("2024-01-01T02:00:00Z")), is(false));
        assertThat(matcher.matches(alert(set()), rule, Instant.parse("2024-01-01T23:00:00Z")), is(true));
    }

    @Test
    void shouldOrderByPriorityThenCreation() {
        NotificationRule late = rule("late");
        late.setPriority(1);
        late.setCreateTime(MONDAY_10AM);
        NotificationRule early = rule("early");
        early.setPriority(1);
        early.setCreateTime(MONDAY_10AM.minusSeconds(60));
        NotificationRule first = rule("first");
        first.setPriority(0);
        first.setCreateTime(MONDAY_10AM.plusSeconds(60));
        NotificationRule other = rule("other");
        other.setEnvironment("Development");

        List<NotificationRule> matched = matcher.match(alert(set()), Arrays.asList(late, other, early, first), MONDAY_10AM);

        assertThat(matched, contains(first, early, late));
    }

    @Test
    void shouldReturnEmptyWhenNothingMatches() {
        NotificationRule rule = rule("r1");
        rule.setEvent("CpuHigh");

        assertThat(matcher.match(alert(set()), Collections.singletonList(rule), MONDAY_10AM), empty());
    }

    static NotificationRule rule(String id) {
        NotificationRule rule = new NotificationRule();
        rule.setId(id);
        rule.setEnvironment("Production");
        rule.setChannelId("ops");
        rule.setReceivers(Collections.singletonList("ops@example.com"));
        return rule;
    }

    static Alert alert(Set<String> tags) {
        Alert alert = Alert.builder()
                .id("a1")
                .environment("Production")
                .resource("db01")
                .event("DiskFull")
                .severity("major")
                .status("open")
                .build()
                .copy();
        alert.getTags().addAll(tags);
        return alert;
    }

    static Set<String> set(String... values) {
        return new LinkedHashSet<>(ImmutableSet.copyOf(values));
    }
}
