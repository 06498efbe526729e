package com.example.rcaengine.rca;

import com.example.rcaengine.activity.ActivityLogService;
import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.domain.ActivityType;
import com.example.rcaengine.domain.RcaStatus;
import com.example.rcaengine.repository.IncidentRepository;
import com.example.rcaengine.rca.RcaRunCoordinator.TriggerOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RcaRunCoordinatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String INCIDENT = "inc-1";

    @Mock
    private RcaService rcaService;
    @Mock
    private IncidentRepository incidentRepository;
    @Mock
    private ActivityLogService activityLog;
    @Mock
    private TaskScheduler scheduler;

    private final List<ScheduledTask> scheduled = new ArrayList<>();
    private final Deque<Runnable> queued = new ArrayDeque<>();
    private boolean runInline;

    private RcaProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private RcaRunCoordinator coordinator;

    private record ScheduledTask(Runnable task, Instant at) {
    }

    @BeforeEach
    void setUp() {
        properties = new RcaProperties();
        meterRegistry = new SimpleMeterRegistry();
        when(scheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(inv -> {
            scheduled.add(new ScheduledTask(inv.getArgument(0), inv.getArgument(1)));
            return mock(ScheduledFuture.class);
        });
        when(incidentRepository.existsById(INCIDENT)).thenReturn(true);
        when(rcaService.begin(INCIDENT)).thenReturn(RcaStatus.NOT_STARTED);
        when(rcaService.execute(eq(INCIDENT), any())).thenReturn(new RankingResult(RankingResult.HEURISTIC, null, List.of()));

        coordinator = new RcaRunCoordinator(properties, rcaService, incidentRepository, activityLog,
                command -> {
                    if (runInline) command.run();
                    else queued.add(command);
                },
                scheduler, Clock.fixed(NOW, ZoneOffset.UTC), meterRegistry);
    }

    @Test
    @DisplayName("Should debounce automatic triggers into one scheduled run")
    void shouldDebounceTriggers() {
        assertThat(coordinator.requestRun(INCIDENT)).isEqualTo(TriggerOutcome.SCHEDULED);
        assertThat(coordinator.requestRun(INCIDENT)).isEqualTo(TriggerOutcome.COALESCED);
        assertThat(coordinator.requestRun(INCIDENT)).isEqualTo(TriggerOutcome.COALESCED);

        assertThat(scheduled).hasSize(1);
        assertThat(scheduled.get(0).at()).isEqualTo(NOW.plus(properties.getRuns().getDebounce()));
        verify(rcaService, never()).begin(anyString());
    }

    @Test
    @DisplayName("Should coalesce triggers during a run into exactly one follow-up")
    void shouldCoalesceIntoSingleFollowUp() {
        coordinator.requestRun(INCIDENT);
        fireDebounce();
        assertThat(coordinator.isRunning(INCIDENT)).isTrue();

        assertThat(coordinator.requestRun(INCIDENT)).isEqualTo(TriggerOutcome.COALESCED);
        assertThat(coordinator.requestRun(INCIDENT)).isEqualTo(TriggerOutcome.COALESCED);

        runQueued();
        assertThat(coordinator.isRunning(INCIDENT)).isTrue();
        runQueued();

        assertThat(coordinator.isRunning(INCIDENT)).isFalse();
        verify(rcaService, times(2)).execute(eq(INCIDENT), any());
        assertThat(meterRegistry.counter("rca.run.coalesced").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should abort a run that exceeds the maximum duration and restore the RCA status")
    void shouldAbortOnTimeout() {
        coordinator.requestRun(INCIDENT);
        fireDebounce();

        fireTimeout();

        verify(incidentRepository).revertRcaStatus(eq(INCIDENT), eq(RcaStatus.NOT_STARTED), contains("exceeded"));
        verify(activityLog).record(eq(ActivityType.RCA_FAILED), any(), eq(INCIDENT), anyString(), any());
        assertThat(coordinator.isRunning(INCIDENT)).isTrue();

        // the worker picks the task up after cancellation, must not run it, and frees the slot on exit
        runQueued();
        verify(rcaService, never()).execute(anyString(), any());
        assertThat(coordinator.isRunning(INCIDENT)).isFalse();
    }

    @Test
    @DisplayName("A follow-up should wait until a timed-out worker has actually exited")
    void shouldHoldSlotUntilTimedOutWorkerExits() {
        List<Boolean> runningDuringOverrun = new ArrayList<>();
        when(rcaService.execute(eq(INCIDENT), any()))
                .thenAnswer(inv -> {
                    fireTimeout();
                    // cancel(true) interrupts this thread; the run ignores it and keeps going
                    Thread.interrupted();
                    runningDuringOverrun.add(coordinator.isRunning(INCIDENT));
                    runningDuringOverrun.add(coordinator.requestRun(INCIDENT) == TriggerOutcome.COALESCED);
                    runningDuringOverrun.add(queued.isEmpty());
                    return new RankingResult(RankingResult.HEURISTIC, null, List.of());
                })
                .thenReturn(new RankingResult(RankingResult.HEURISTIC, null, List.of()));

        coordinator.requestRun(INCIDENT);
        fireDebounce();
        runQueued();

        assertThat(runningDuringOverrun).containsExactly(true, true, true);
        verify(incidentRepository).revertRcaStatus(eq(INCIDENT), eq(RcaStatus.NOT_STARTED), contains("exceeded"));

        // the coalesced follow-up starts only after the overrunning worker returned
        assertThat(queued).hasSize(1);
        runQueued();
        verify(rcaService, times(2)).execute(eq(INCIDENT), any());
        assertThat(coordinator.isRunning(INCIDENT)).isFalse();
    }

    @Test
    @DisplayName("Should suppress automatic triggers after repeated failures until a manual rerun")
    void shouldSuppressAfterRepeatedFailures() {
        when(rcaService.execute(eq(INCIDENT), any())).thenThrow(new IllegalStateException("boom"));

        for (int i = 0; i < properties.getRuns().getMaxConsecutiveFailures(); i++) {
            assertThat(coordinator.requestRun(INCIDENT)).isEqualTo(TriggerOutcome.SCHEDULED);
            fireDebounce();
            runQueued();
        }

        assertThat(coordinator.isSuppressed(INCIDENT)).isTrue();
        assertThat(coordinator.requestRun(INCIDENT)).isEqualTo(TriggerOutcome.SUPPRESSED);
        verify(incidentRepository, times(3)).revertRcaStatus(eq(INCIDENT), eq(RcaStatus.NOT_STARTED), eq("boom"));
        assertThat(meterRegistry.counter("rca.run.failures").count()).isEqualTo(3.0);

        assertThat(coordinator.requestManualRun(INCIDENT)).isEqualTo(TriggerOutcome.SCHEDULED);
        assertThat(coordinator.isSuppressed(INCIDENT)).isFalse();
    }

    @Test
    @DisplayName("Should reset the failure streak after a successful run")
    void shouldResetFailureStreak() {
        when(rcaService.execute(eq(INCIDENT), any()))
                .thenThrow(new IllegalStateException("first"))
                .thenThrow(new IllegalStateException("second"))
                .thenReturn(new RankingResult(RankingResult.HEURISTIC, null, List.of()))
                .thenThrow(new IllegalStateException("third"));

        for (int i = 0; i < 4; i++) {
            coordinator.requestRun(INCIDENT);
            fireDebounce();
            runQueued();
        }

        assertThat(coordinator.isSuppressed(INCIDENT)).isFalse();
    }

    @Test
    @DisplayName("Manual rerun of an unknown incident should be rejected")
    void shouldRejectUnknownIncident() {
        when(incidentRepository.existsById("missing")).thenReturn(false);

        assertThatThrownBy(() -> coordinator.requestManualRun("missing"))
                .isInstanceOf(IncidentNotFoundException.class);
        assertThatThrownBy(() -> coordinator.runNow("missing"))
                .isInstanceOf(IncidentNotFoundException.class);
    }

    @Test
    @DisplayName("Manual rerun during a run should coalesce instead of running concurrently")
    void manualRunCoalescesWhileRunning() {
        coordinator.requestManualRun(INCIDENT);
        assertThat(coordinator.isRunning(INCIDENT)).isTrue();

        assertThat(coordinator.requestManualRun(INCIDENT)).isEqualTo(TriggerOutcome.COALESCED);
        assertThatThrownBy(() -> coordinator.runNow(INCIDENT)).isInstanceOf(RcaRunException.class);

        runQueued();
        runQueued();
        verify(rcaService, times(2)).execute(eq(INCIDENT), any());
    }

    @Test
    @DisplayName("Synchronous rerun should return the ranking")
    void runNowReturnsRanking() {
        runInline = true;

        RankingResult result = coordinator.runNow(INCIDENT);

        assertThat(result.mode()).isEqualTo(RankingResult.HEURISTIC);
        assertThat(coordinator.isRunning(INCIDENT)).isFalse();
    }

    @Test
    @DisplayName("Synchronous rerun should surface a failed run")
    void runNowSurfacesFailure() {
        runInline = true;
        when(rcaService.execute(eq(INCIDENT), any())).thenThrow(new IllegalStateException("no database"));

        assertThatThrownBy(() -> coordinator.runNow(INCIDENT))
                .isInstanceOf(RcaRunException.class)
                .hasMessageContaining("no database");
        verify(incidentRepository).revertRcaStatus(INCIDENT, RcaStatus.NOT_STARTED, "no database");
    }

    private void fireDebounce() {
        fire(NOW.plus(properties.getRuns().getDebounce()));
    }

    private void fireTimeout() {
        fire(NOW.plus(properties.getRuns().getMaxDuration()));
    }

    private void fire(Instant at) {
        Iterator<ScheduledTask> it = scheduled.iterator();
        while (it.hasNext()) {
            ScheduledTask task = it.next();
            if (task.at().equals(at)) {
                it.remove();
                task.task().run();
                return;
            }
        }
        throw new AssertionError("Nothing scheduled at " + at);
    }

    private void runQueued() {
        Runnable next = queued.poll();
        assertThat(next).as("queued run").isNotNull();
        next.run();
    }
}
