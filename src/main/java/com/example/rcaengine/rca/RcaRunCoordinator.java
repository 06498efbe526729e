package com.example.rcaengine.rca;

import com.example.rcaengine.activity.ActivityLogService;
import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.domain.ActivityType;
import com.example.rcaengine.domain.RcaStatus;
import com.example.rcaengine.repository.IncidentRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Schedules RCA runs with at most one run per incident at a time.
 *
 * <ul>
 *   <li>Automatic triggers are debounced: the first trigger schedules a run
 *       after the debounce delay and later triggers join it.</li>
 *   <li>Triggers that arrive while a run is executing are coalesced into a
 *       single follow-up run.</li>
 *   <li>A run exceeding the maximum duration is aborted and cannot commit; the
 *       incident's RCA status is restored and the failure is recorded. The
 *       slot stays taken until the interrupted worker has actually exited.</li>
 *   <li>After repeated consecutive failures automatic triggers are suppressed
 *       until a manual rerun.</li>
 * </ul>
 */
@Slf4j
@Service
public class RcaRunCoordinator {

    public enum TriggerOutcome {
        SCHEDULED, COALESCED, SUPPRESSED
    }

    private final RcaProperties properties;
    private final RcaService rcaService;
    private final IncidentRepository incidentRepository;
    private final ActivityLogService activityLog;
    private final Executor rcaExecutor;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Counter failures;
    private final Counter coalesced;

    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    public RcaRunCoordinator(RcaProperties properties,
                             RcaService rcaService,
                             IncidentRepository incidentRepository,
                             ActivityLogService activityLog,
                             @Qualifier("rcaExecutor") Executor rcaExecutor,
                             @Qualifier("rcaTriggerScheduler") TaskScheduler scheduler,
                             Clock clock,
                             MeterRegistry meterRegistry) {
        this.properties = properties;
        this.rcaService = rcaService;
        this.incidentRepository = incidentRepository;
        this.activityLog = activityLog;
        this.rcaExecutor = rcaExecutor;
        this.scheduler = scheduler;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.failures = Counter.builder("rca.run.failures").register(meterRegistry);
        this.coalesced = Counter.builder("rca.run.coalesced").register(meterRegistry);
    }

    /** A started run; {@code exited} opens once the worker has left the slot. */
    private record RunHandle(FutureTask<RankingResult> task, CountDownLatch exited) {
    }

    /** Per-incident run state; guarded by its own monitor. */
    private static final class Slot {
        boolean running;
        boolean followUp;
        ScheduledFuture<?> pending;
        int consecutiveFailures;
        boolean suppressed;
    }

    /**
     * Automatic trigger from the grouper. Debounced and coalesced.
     */
    public TriggerOutcome requestRun(String incidentId) {
        Slot slot = slot(incidentId);
        synchronized (slot) {
            if (slot.suppressed) {
                log.debug("Automatic RCA trigger for incident {} suppressed after repeated failures", incidentId);
                return TriggerOutcome.SUPPRESSED;
            }
            if (slot.running) {
                slot.followUp = true;
                coalesced.increment();
                return TriggerOutcome.COALESCED;
            }
            if (slot.pending != null && !slot.pending.isDone()) {
                coalesced.increment();
                return TriggerOutcome.COALESCED;
            }
            Duration debounce = properties.getRuns().getDebounce();
            slot.pending = scheduler.schedule(() -> launch(incidentId), clock.instant().plus(debounce));
            return TriggerOutcome.SCHEDULED;
        }
    }

    /**
     * Manual rerun. Starts as soon as the slot is free and lifts any
     * suppression of automatic triggers.
     */
    public TriggerOutcome requestManualRun(String incidentId) {
        if (!incidentRepository.existsById(incidentId)) {
            throw new IncidentNotFoundException(incidentId);
        }
        Slot slot = slot(incidentId);
        synchronized (slot) {
            slot.suppressed = false;
            slot.consecutiveFailures = 0;
            if (slot.running) {
                slot.followUp = true;
                coalesced.increment();
                return TriggerOutcome.COALESCED;
            }
            cancelPending(slot);
        }
        launch(incidentId);
        return TriggerOutcome.SCHEDULED;
    }

    /**
     * Manual rerun that waits for the outcome. Fails fast when a run for the
     * incident is already executing.
     */
    public RankingResult runNow(String incidentId) {
        if (!incidentRepository.existsById(incidentId)) {
            throw new IncidentNotFoundException(incidentId);
        }
        Slot slot = slot(incidentId);
        synchronized (slot) {
            if (slot.running) {
                throw new RcaRunException(incidentId, "An RCA run is already in progress");
            }
            slot.suppressed = false;
            slot.consecutiveFailures = 0;
            cancelPending(slot);
            slot.running = true;
        }
        RunHandle handle = start(incidentId, slot);
        if (handle == null) {
            throw new RcaRunException(incidentId, "RCA run could not be started");
        }
        long waitMillis = properties.getRuns().getMaxDuration().toMillis() + 1_000;
        try {
            RankingResult result = handle.task().get(waitMillis, TimeUnit.MILLISECONDS);
            handle.exited().await(waitMillis, TimeUnit.MILLISECONDS);
            return result;
        } catch (CancellationException | TimeoutException e) {
            throw new RcaRunException(incidentId, "RCA run timed out", e);
        } catch (ExecutionException e) {
            awaitExit(handle, waitMillis);
            throw new RcaRunException(incidentId, "RCA run failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RcaRunException(incidentId, "Interrupted while waiting for RCA run", e);
        }
    }

    private static void awaitExit(RunHandle handle, long waitMillis) {
        try {
            handle.exited().await(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning(String incidentId) {
        Slot slot = slots.get(incidentId);
        if (slot == null) return false;
        synchronized (slot) {
            return slot.running;
        }
    }

    public boolean isSuppressed(String incidentId) {
        Slot slot = slots.get(incidentId);
        if (slot == null) return false;
        synchronized (slot) {
            return slot.suppressed;
        }
    }

    private void launch(String incidentId) {
        Slot slot = slot(incidentId);
        synchronized (slot) {
            slot.pending = null;
            if (slot.running) {
                slot.followUp = true;
                return;
            }
            slot.running = true;
        }
        start(incidentId, slot);
    }

    /**
     * Begin a run for a slot already marked running. Returns null when the run
     * could not be started; the slot is released in that case. Otherwise the
     * slot is released when the worker exits, not when the task completes, so
     * a timed-out worker still blocks the next run until it has stopped.
     */
    private RunHandle start(String incidentId, Slot slot) {
        RcaStatus previous;
        try {
            previous = rcaService.begin(incidentId);
        } catch (RuntimeException e) {
            log.warn("Could not start RCA for incident {}: {}", incidentId, e.getMessage());
            release(incidentId, slot);
            return null;
        }

        RunToken token = new RunToken(incidentId);
        Timer.Sample sample = Timer.start(meterRegistry);
        FutureTask<RankingResult> task = new FutureTask<>(() -> rcaService.execute(incidentId, token)) {
            @Override
            protected void done() {
                finish(incidentId, slot, token, previous, this, sample);
            }
        };

        Duration maxDuration = properties.getRuns().getMaxDuration();
        ScheduledFuture<?> timeout = scheduler.schedule(() -> {
            if (token.abort()) {
                fail(incidentId, slot, previous, "RCA run exceeded " + maxDuration.toSeconds() + "s");
                task.cancel(true);
            }
        }, clock.instant().plus(maxDuration));

        CountDownLatch exited = new CountDownLatch(1);
        try {
            rcaExecutor.execute(() -> {
                try {
                    task.run();
                } finally {
                    timeout.cancel(false);
                    exit(incidentId, slot, exited);
                }
            });
        } catch (RuntimeException e) {
            timeout.cancel(false);
            if (token.abort()) {
                fail(incidentId, slot, previous, "RCA run rejected: " + e.getMessage());
                task.cancel(false);
            }
            exit(incidentId, slot, exited);
        }
        return new RunHandle(task, exited);
    }

    private void exit(String incidentId, Slot slot, CountDownLatch exited) {
        try {
            release(incidentId, slot);
        } finally {
            exited.countDown();
        }
    }

    private void finish(String incidentId, Slot slot, RunToken token, RcaStatus previous,
                        FutureTask<RankingResult> task, Timer.Sample sample) {
        sample.stop(Timer.builder("rca.run.duration").register(meterRegistry));
        if (!task.isCancelled()) {
            try {
                task.get();
                synchronized (slot) {
                    slot.consecutiveFailures = 0;
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                // An aborted token means the timeout already recorded this failure.
                if (token.abort() || token.isCommitted()) {
                    log.error("RCA run failed for incident {}: {}", incidentId, cause.getMessage(), cause);
                    fail(incidentId, slot, previous, cause.getMessage());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void fail(String incidentId, Slot slot, RcaStatus previous, String reason) {
        failures.increment();
        int consecutive;
        synchronized (slot) {
            consecutive = ++slot.consecutiveFailures;
            if (consecutive >= properties.getRuns().getMaxConsecutiveFailures()) {
                slot.suppressed = true;
            }
        }
        try {
            incidentRepository.revertRcaStatus(incidentId, previous, truncate(reason));
        } catch (RuntimeException e) {
            log.error("Could not restore RCA status for incident {}: {}", incidentId, e.getMessage(), e);
        }
        log.warn("RCA run for incident {} failed ({} consecutive): {}", incidentId, consecutive, reason);
        activityLog.record(ActivityType.RCA_FAILED, null, incidentId, "RCA failed: " + reason,
                Map.of("consecutive_failures", consecutive));
        if (consecutive >= properties.getRuns().getMaxConsecutiveFailures()) {
            log.error("RCA for incident {} failed {} times in a row; automatic triggers suspended until a manual rerun",
                    incidentId, consecutive);
        }
    }

    private void release(String incidentId, Slot slot) {
        boolean rerun;
        synchronized (slot) {
            slot.running = false;
            rerun = slot.followUp && !slot.suppressed;
            slot.followUp = false;
        }
        if (rerun) {
            log.debug("Starting coalesced follow-up RCA run for incident {}", incidentId);
            launch(incidentId);
        }
    }

    private void cancelPending(Slot slot) {
        if (slot.pending != null) {
            slot.pending.cancel(false);
            slot.pending = null;
        }
    }

    private Slot slot(String incidentId) {
        return slots.computeIfAbsent(incidentId, k -> new Slot());
    }

    private static String truncate(String reason) {
        if (reason == null) return null;
        return reason.length() <= 1000 ? reason : reason.substring(0, 1000);
    }
}
