package com.stealthradar.monitor.scan;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Self-rescheduling scan loop of one chain. Each run executes one {@link ChainScanCycle}, applies
 * success/backoff to its {@link ChainState}, then schedules the next run at {@code nextScanTime}. A disabled
 * chain is never rescheduled. The shared running flag and this loop's own stop flag are checked before every run
 * and every reschedule; once stopped, a loop never runs again even if the shared flag is set by a later start.
 */
@Slf4j
public class ChainScanScheduler {

    private final ChainState state;
    private final ChainScanCycle cycle;
    private final TaskScheduler taskScheduler;
    private final BooleanSupplier running;
    private final int maxFailureCount;
    private final Clock clock;
    private final Semaphore inFlight = new Semaphore(1);

    private volatile boolean stopped;
    private volatile ScheduledFuture<?> next;

    public ChainScanScheduler(
            ChainState state,
            ChainScanCycle cycle,
            TaskScheduler taskScheduler,
            BooleanSupplier running,
            int maxFailureCount,
            Clock clock
    ) {
        this.state = state;
        this.cycle = cycle;
        this.taskScheduler = taskScheduler;
        this.running = running;
        this.maxFailureCount = Math.max(1, maxFailureCount);
        this.clock = clock;
    }

    public void start() {
        scheduleAt(state.getNextScanTime());
    }

    /**
     * Runs one cycle now and reschedules. Exposed for the scheduler and for tests.
     */
    public void runOnce() {
        if (!isActive() || state.isDisabled()) {
            return;
        }
        if (!inFlight.tryAcquire()) {
            log.debug("{}: previous cycle still running, skipping", state.getName());
            return;
        }
        try {
            state.markScanning();
            try {
                cycle.run(state, this::isActive);
                state.recordSuccess(clock.instant());
            } catch (RuntimeException e) {
                boolean disabled = state.recordFailure(clock.instant(), maxFailureCount);
                if (disabled) {
                    log.error("{}: disabled after {} consecutive failures, last error: {}",
                            state.getName(), state.getConsecutiveFailures(), e.getMessage(), e);
                } else {
                    log.warn("{}: scan failed ({} consecutive), next attempt in {}: {}",
                            state.getName(), state.getConsecutiveFailures(), state.getScanInterval(), e.getMessage());
                }
            }
        } finally {
            inFlight.release();
        }
        if (!isActive()) {
            state.markStopped();
            return;
        }
        if (!state.isDisabled()) {
            scheduleAt(state.getNextScanTime());
        }
    }

    /**
     * Cancels the pending run without interrupting one in flight.
     */
    public void stop() {
        stopped = true;
        ScheduledFuture<?> pending = next;
        if (pending != null) {
            pending.cancel(false);
        }
        state.markStopped();
    }

    /**
     * @return true if no cycle was in flight within the timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        if (inFlight.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            inFlight.release();
            return true;
        }
        return false;
    }

    public ChainState getState() {
        return state;
    }

    boolean isActive() {
        return !stopped && running.getAsBoolean();
    }

    private void scheduleAt(Instant when) {
        if (!isActive()) {
            return;
        }
        next = taskScheduler.schedule(this::runOnce, when);
    }
}
