package alertflow.rule;

import alertflow.alert.Transition;
import alertflow.alert.TransitionType;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static alertflow.rule.RuleMatcherTest.set;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

class TriggerEvaluatorTest {

    private final TriggerEvaluator evaluator = new TriggerEvaluator();

    @Test
    void shouldFireOnlyOnConfiguredTransition() {
        NotificationRule rule = RuleMatcherTest.rule("r1");
        rule.setTriggers(Collections.singletonList(new Trigger(set("warning"), set("critical"), set(), null)));

        assertThat(evaluator.fires(rule, transition("warning", "critical", "open")), is(true));
        assertThat(evaluator.fires(rule, transition("critical", "warning", "open")), is(false));
        assertThat(evaluator.fires(rule, transition("normal", "critical", "open")), is(false));
    }

    @Test
    void shouldAlwaysFireWithoutTriggers() {
        NotificationRule rule = RuleMatcherTest.rule("r1");

        assertThat(evaluator.fires(rule, transition("normal", "critical", "open")), is(true));
        assertThat(evaluator.fires(rule, transition("critical", "critical", "ack")), is(true));
    }

    @Test
    void shouldTreatEmptySetsAsWildcards() {
        NotificationRule rule = RuleMatcherTest.rule("r1");
        rule.setTriggers(Collections.singletonList(new Trigger(set(), set("critical", "major"), set(), null)));

        assertThat(evaluator.fires(rule, transition("normal", "major", "open")), is(true));
        assertThat(evaluator.fires(rule, transition("normal", "minor", "open")), is(false));
    }

    @Test
    void shouldMatchStatusTriggers() {
        NotificationRule rule = RuleMatcherTest.rule("r1");
        rule.setTriggers(Collections.singletonList(new Trigger(set(), set(), set("ack"), null)));

        assertThat(evaluator.fires(rule, transition("major", "major", "ack")), is(true));
        assertThat(evaluator.fires(rule, transition("major", "major", "open")), is(false));
    }

    @Test
    void shouldUseTriggerTextWithDefaultPlaceholder() {
        NotificationRule rule = RuleMatcherTest.rule("r1");
        rule.setText("{resource} is {event}");
        rule.setTriggers(Collections.singletonList(new Trigger(set(), set("critical"), set(), "URGENT {default}")));

        assertThat(evaluator.messageTemplate(rule, transition("major", "critical", "open")),
                equalTo("URGENT {resource} is {event}"));
    }

    @Test
    void shouldFallBackToRuleTextThenStandardMessage() {
        NotificationRule rule = RuleMatcherTest.rule("r1");
        assertThat(evaluator.messageTemplate(rule, transition("major", "critical", "open")), nullValue());

        rule.setText("custom");
        assertThat(evaluator.messageTemplate(rule, transition("major", "critical", "open")), equalTo("custom"));
    }

    private static Transition transition(String from, String to, String status) {
        return Transition.builder()
                .id("t1")
                .type(TransitionType.SEVERITY_CHANGE)
                .previousSeverity(from)
                .severity(to)
                .status(status)
                .build();
    }
}
