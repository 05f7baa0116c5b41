package alertflow.alert;

import alertflow.MutableClock;
import alertflow.config.AlertFlowConfig;
import alertflow.exception.ConflictException;
import alertflow.exception.NotFoundException;
import alertflow.exception.ValidationException;
import alertflow.store.AlertStore;
import alertflow.store.InMemoryAlertStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class AlertServiceTest {

    private MutableClock clock;
    private AlertStore alertStore;
    private AlertService alertService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T10:00:00Z"));
        alertStore = new InMemoryAlertStore();
        alertService = service(alertStore, 5);
    }

    private AlertService service(AlertStore store, int maxRetries) {
        AlertStateMachine stateMachine = new AlertStateMachine(AlertFlowConfig.defaults(), SeverityRanking.defaults(), clock);
        return new AlertService(store, new AlertKeyResolver(store), stateMachine, maxRetries);
    }

    @Test
    void shouldRejectReportWithoutScope() {
        AlertReport report = AlertStateMachineTest.report("major", "x");
        report.setResource(null);

        assertThrows(ValidationException.class, () -> alertService.ingestAlert(report));
        assertThat(alertStore.findAlerts(alert -> true), hasSize(0));
    }

    @Test
    void shouldKeepOneRecordForRepeatedReports() {
        for (int i = 0; i < 5; i++) {
            alertService.ingestAlert(AlertStateMachineTest.report("major", "x"));
        }

        List<Alert> alerts = alertStore.findAlerts(alert -> true);
        assertThat(alerts, hasSize(1));
        assertThat(alerts.get(0).getDuplicateCount(), is(4));
        assertThat(alerts.get(0).isRepeat(), is(true));
        assertThat(alerts.get(0).getHistory(), hasSize(1));
    }

    @Test
    void shouldResolveCorrelatedEventToExistingAlert() {
        AlertReport down = AlertStateMachineTest.report("major", "down");
        down.setEvent("NodeDown");
        down.setCorrelate(List.of("NodeDown", "NodeUp"));
        IngestResult opened = alertService.ingestAlert(down);

        AlertReport up = AlertStateMachineTest.report("normal", "up");
        up.setEvent("NodeUp");
        IngestResult correlated = alertService.ingestAlert(up);

        assertThat(correlated.getAlert().getId(), equalTo(opened.getAlert().getId()));
        assertThat(alertStore.findAlerts(alert -> true), hasSize(1));
        assertThat(alertStore.getAlertByKey(up.identityKey()).isPresent(), is(true));
        assertThat(alertStore.getAlertByKey(down.identityKey()).isPresent(), is(false));
    }

    @Test
    void shouldConvergeConcurrentIngestsOfSameKey() throws Exception {
        AlertService concurrent = service(alertStore, 100);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<IngestResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 16; i++) {
                Callable<IngestResult> task = () -> {
                    start.await();
                    return concurrent.ingestAlert(AlertStateMachineTest.report("major", "x"));
                };
                futures.add(executor.submit(task));
            }
            start.countDown();
            for (Future<IngestResult> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        List<Alert> alerts = alertStore.findAlerts(alert -> true);
        assertThat(alerts, hasSize(1));
        assertThat(alerts.get(0).getDuplicateCount(), is(15));
    }

    @Test
    void shouldRetryOnConflict() {
        AlertStore store = mock(AlertStore.class);
        given(store.getAlertByKey(any())).willReturn(Optional.empty());
        given(store.findCorrelated(any(), any())).willReturn(Optional.empty());
        given(store.upsertAlert(any()))
                .willThrow(new ConflictException("race"))
                .willAnswer(invocation -> invocation.getArgument(0));

        IngestResult result = service(store, 3).ingestAlert(AlertStateMachineTest.report("major", "x"));

        assertThat(result.getAlert().getSeverity(), equalTo("major"));
        verify(store, times(2)).upsertAlert(any());
    }

    @Test
    void shouldSurfaceConflictAfterRetriesExhausted() {
        AlertStore store = mock(AlertStore.class);
        given(store.getAlertByKey(any())).willReturn(Optional.empty());
        given(store.findCorrelated(any(), any())).willReturn(Optional.empty());
        given(store.upsertAlert(any())).willThrow(new ConflictException("race"));

        assertThrows(ConflictException.class,
                () -> service(store, 3).ingestAlert(AlertStateMachineTest.report("major", "x")));
        verify(store, times(3)).upsertAlert(any());
    }

    @Test
    void shouldSetStatus() {
        IngestResult opened = alertService.ingestAlert(AlertStateMachineTest.report("major", "x"));

        IngestResult result = alertService.setAlertStatus(opened.getAlert().getId(), "ack", "alice", "on it");

        assertThat(result.getAlert().getStatus(), equalTo("ack"));
        assertThat(alertStore.getAlert(opened.getAlert().getId()).get().getStatus(), equalTo("ack"));
        assertThat(result.getAlert().getVersion(), is(2L));
    }

    @Test
    void shouldFailStatusChangeForUnknownAlert() {
        AlertStore store = mock(AlertStore.class);
        given(store.getAlert("missing")).willReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service(store, 3).setAlertStatus("missing", "ack", "alice", null));
        verify(store, never()).upsertAlert(any());
    }
}
