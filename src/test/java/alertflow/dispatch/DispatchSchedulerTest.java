package alertflow.dispatch;

import alertflow.PipelineFixture;
import alertflow.alert.Alert;
import alertflow.alert.AlertReport;
import alertflow.alert.TransitionType;
import alertflow.rule.NotificationRule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

class DispatchSchedulerTest {

    private PipelineFixture fixture;
    private NotificationRule rule;
    private Alert alert;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture();
        rule = PipelineFixture.notificationRule("ops");
        fixture.getConfigStore().saveRule(rule);
        alert = fixture.getAlertStore().upsertAlert(Alert.builder()
                .id("a1")
                .environment("Production")
                .resource("db01")
                .event("DiskFull")
                .severity("critical")
                .status("open")
                .build());
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void shouldSendEachTransitionOnce() {
        DispatchIntent first = schedule("t1");
        DispatchIntent again = schedule("t1");
        DispatchIntent next = schedule("t2");

        assertThat(first.getState(), equalTo(DispatchState.SENT));
        assertThat(again.getState(), equalTo(DispatchState.SKIPPED));
        assertThat(again.getError(), equalTo("already dispatched"));
        assertThat(next.getState(), equalTo(DispatchState.SENT));
        assertThat(fixture.getSender().getSent(), hasSize(2));
    }

    @Test
    void shouldFailWhenChannelMissing() {
        rule.setChannelId("missing");

        DispatchIntent intent = schedule("t1");

        assertThat(intent.getState(), equalTo(DispatchState.FAILED));
        assertThat(fixture.getNotificationStore().listNotificationHistory("a1").get(0).isSent(), is(false));
    }

    @Test
    void shouldDropDelayedNotificationForRemovedRule() {
        rule.setDelayTime(Duration.ofMinutes(5));
        assertThat(schedule("t1").getState(), equalTo(DispatchState.DELAYED));
        fixture.getConfigStore().deleteRule("ops");

        fixture.getClock().advance(Duration.ofMinutes(5));

        assertThat(fixture.getDispatchScheduler().sweepDelayedNotifications(fixture.getClock().instant()), empty());
        assertThat(fixture.getSender().getSent(), empty());
        assertThat(fixture.getNotificationStore().findDelayedNotification("a1", "ops").isPresent(), is(false));
    }

    @Test
    void shouldCancelPendingWorkForAlert() {
        rule.setDelayTime(Duration.ofMinutes(5));
        schedule("t1");

        assertThat(fixture.getDispatchScheduler().cancelForAlert("a1"), is(1));
        assertThat(fixture.getDispatchScheduler().cancelForAlert("a1"), is(0));
    }

    private DispatchIntent schedule(String transitionId) {
        DispatchIntent pending = DispatchIntent.builder()
                .alertId(alert.getId())
                .ruleId(rule.getId())
                .channelId(rule.getChannelId())
                .transitionId(transitionId)
                .transitionType(TransitionType.OPENED)
                .state(DispatchState.PENDING)
                .build();
        return fixture.getDispatchScheduler().schedule(alert, rule, pending, null, fixture.getClock().instant());
    }
}
