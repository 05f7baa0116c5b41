package alertflow.dispatch;

import alertflow.AlertPipeline;
import alertflow.PipelineFixture;
import alertflow.alert.Alert;
import alertflow.alert.AlertReport;
import alertflow.alert.TransitionType;
import alertflow.rule.EscalationRule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

class EscalationSweeperTest {

    private PipelineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture();
        fixture.getConfigStore().saveRule(PipelineFixture.notificationRule("ops"));
        EscalationRule escalation = new EscalationRule();
        escalation.setId("esc-30m");
        escalation.setEnvironment("Production");
        escalation.setTime(Duration.ofMinutes(30));
        fixture.getConfigStore().saveRule(escalation);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void shouldEscalateOncePerPeriod() {
        fixture.getPipeline().receive(report());
        assertThat(fixture.getSender().getSent(), hasSize(1));

        assertThat(sweepAfter(Duration.ofMinutes(29)), empty());

        List<DispatchIntent> first = sweepAfter(Duration.ofMinutes(1));
        assertThat(first, hasSize(1));
        assertThat(first.get(0).getTransitionType(), equalTo(TransitionType.ESCALATION));
        assertThat(first.get(0).getState(), equalTo(DispatchState.SENT));

        assertThat(sweepAfter(Duration.ofMinutes(10)), empty());
        assertThat(sweepAfter(Duration.ofMinutes(20)), hasSize(1));
        assertThat(fixture.getSender().getSent(), hasSize(3));
    }

    @Test
    void shouldRestartPeriodsOnNewReport() {
        fixture.getPipeline().receive(report());
        assertThat(sweepAfter(Duration.ofMinutes(30)), hasSize(1));

        fixture.getPipeline().receive(report());
        assertThat(sweepAfter(Duration.ofMinutes(29)), empty());
        assertThat(sweepAfter(Duration.ofMinutes(1)), hasSize(1));
    }

    @Test
    void shouldSkipResolvedAlerts() {
        AlertPipeline.Result result = fixture.getPipeline().receive(report());
        fixture.getPipeline().changeStatus(result.getIngest().getAlert().getId(), "closed", "alice", null);

        assertThat(sweepAfter(Duration.ofHours(2)), empty());
    }

    @Test
    void shouldCountElapsedPeriods() {
        EscalationRule rule = new EscalationRule();
        rule.setTime(Duration.ofMinutes(30));
        Instant received = Instant.parse("2024-01-01T10:00:00Z");
        Alert alert = Alert.builder().lastReceiveTime(received).build();

        assertThat(EscalationSweeper.period(alert, rule, received.plus(Duration.ofMinutes(29))), is(0L));
        assertThat(EscalationSweeper.period(alert, rule, received.plus(Duration.ofMinutes(30))), is(1L));
        assertThat(EscalationSweeper.period(alert, rule, received.plus(Duration.ofMinutes(95))), is(3L));
        assertThat(EscalationSweeper.period(alert, rule, received.minusSeconds(1)), is(0L));
    }

    private List<DispatchIntent> sweepAfter(Duration duration) {
        fixture.getClock().advance(duration);
        return fixture.getEscalationSweeper().sweep(fixture.getClock().instant());
    }

    private static AlertReport report() {
        return AlertReport.builder()
                .environment("Production")
                .resource("db01")
                .event("DiskFull")
                .severity("critical")
                .build();
    }
}
