package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.domain.AnalysisResult;
import com.phillippitts.insightbot.service.settings.AnalysisIntervalPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Periodic analysis loop of one guild session.
 *
 * <p><b>Loop body:</b>
 * <ol>
 *   <li>Exit if the session is no longer active.</li>
 *   <li>Ask the {@link AnalysisIntervalPolicy} for the current interval. This is the only point
 *       where the interval is read, so a settings change applies from the next cycle.</li>
 *   <li>Wait for the interval, or until {@link #signalStop()} is called.</li>
 *   <li>Exit if stop was signalled or the session became inactive while waiting.</li>
 *   <li>Run the analysis trigger. Failures are logged and the loop continues.</li>
 * </ol>
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → RUNNING (via start)
 * RUNNING → STOPPING (via signalStop)
 * RUNNING | STOPPING → TERMINATED (loop exit)
 * IDLE → TERMINATED (stop before start)
 * </pre>
 * TERMINATED is final; a scheduler is never restarted.
 *
 * <p><b>Cancellation:</b> The wait is a latch await, so a stop wakes the loop immediately instead
 * of after the remaining interval. A cycle already analyzing is not interrupted; stop waits for it
 * only as long as the caller's grace period.
 */
public final class SessionScheduler {

    private static final Logger LOG = LogManager.getLogger(SessionScheduler.class);

    public enum State { IDLE, RUNNING, STOPPING, TERMINATED }

    private final long guildId;
    private final BooleanSupplier active;
    private final AnalysisIntervalPolicy intervalPolicy;
    private final Duration fallbackInterval;
    private final Supplier<AnalysisResult> trigger;

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicLong completedCycles = new AtomicLong();

    /**
     * @param guildId          guild whose session this loop serves
     * @param active           liveness check of the session
     * @param intervalPolicy   source of the interval, consulted every iteration
     * @param fallbackInterval used when the policy fails or returns a non-positive interval
     * @param trigger          runs one periodic analysis
     */
    public SessionScheduler(long guildId,
                            BooleanSupplier active,
                            AnalysisIntervalPolicy intervalPolicy,
                            Duration fallbackInterval,
                            Supplier<AnalysisResult> trigger) {
        this.guildId = guildId;
        this.active = Objects.requireNonNull(active, "active must not be null");
        this.intervalPolicy = Objects.requireNonNull(intervalPolicy, "intervalPolicy must not be null");
        this.fallbackInterval = Objects.requireNonNull(fallbackInterval, "fallbackInterval must not be null");
        this.trigger = Objects.requireNonNull(trigger, "trigger must not be null");
    }

    /**
     * Submits the loop to the executor.
     *
     * @throws IllegalStateException      if the scheduler was already started or stopped
     * @throws RejectedExecutionException if the executor has no capacity; the scheduler is then
     *                                    terminated
     */
    public void start(Executor executor) {
        Objects.requireNonNull(executor, "executor must not be null");
        if (!state.compareAndSet(State.IDLE, State.RUNNING)) {
            throw new IllegalStateException("Scheduler for guild " + guildId + " cannot start from " + state.get());
        }
        try {
            executor.execute(this::loop);
        } catch (RejectedExecutionException e) {
            state.set(State.TERMINATED);
            terminated.countDown();
            throw e;
        }
    }

    /**
     * Asks the loop to exit and wakes it if it is waiting. Returns immediately.
     */
    public void signalStop() {
        while (true) {
            State current = state.get();
            if (current == State.IDLE) {
                if (state.compareAndSet(State.IDLE, State.TERMINATED)) {
                    stopSignal.countDown();
                    terminated.countDown();
                    return;
                }
            } else if (current == State.RUNNING) {
                if (state.compareAndSet(State.RUNNING, State.STOPPING)) {
                    stopSignal.countDown();
                    return;
                }
            } else {
                stopSignal.countDown();
                return;
            }
        }
    }

    /**
     * Waits for the loop to exit.
     *
     * @return true if the loop terminated within the timeout
     */
    public boolean awaitTermination(Duration timeout) {
        try {
            return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Signals stop and waits up to {@code grace} for the loop to exit.
     *
     * @return true if the loop terminated within the grace period
     */
    public boolean stop(Duration grace) {
        signalStop();
        return awaitTermination(grace);
    }

    public State state() {
        return state.get();
    }

    /** Number of analysis cycles run so far, failed ones included. */
    public long completedCycles() {
        return completedCycles.get();
    }

    private void loop() {
        ThreadContext.put("guildId", String.valueOf(guildId));
        LOG.info("Periodic analysis loop started for guild {}", guildId);
        try {
            while (state.get() == State.RUNNING && active.getAsBoolean()) {
                Duration interval = nextInterval();
                LOG.debug("Next analysis for guild {} in {}s", guildId, interval.toSeconds());
                if (awaitStopSignal(interval)) {
                    break;
                }
                if (state.get() != State.RUNNING || !active.getAsBoolean()) {
                    break;
                }
                runCycle();
            }
        } finally {
            state.set(State.TERMINATED);
            terminated.countDown();
            LOG.info("Periodic analysis loop terminated for guild {} after {} cycles", guildId, completedCycles.get());
            ThreadContext.remove("guildId");
        }
    }

    private Duration nextInterval() {
        try {
            Duration interval = intervalPolicy.currentInterval(guildId);
            if (interval == null || interval.isZero() || interval.isNegative()) {
                LOG.warn("Invalid interval {} for guild {}, using {}s", interval, guildId, fallbackInterval.toSeconds());
                return fallbackInterval;
            }
            return interval;
        } catch (RuntimeException e) {
            LOG.warn("Interval lookup failed for guild {}, using {}s: {}", guildId, fallbackInterval.toSeconds(),
                    e.getMessage());
            return fallbackInterval;
        }
    }

    /**
     * @return true if stop was signalled (or the thread interrupted) before the interval elapsed
     */
    private boolean awaitStopSignal(Duration interval) {
        try {
            return stopSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private void runCycle() {
        try {
            AnalysisResult result = trigger.get();
            LOG.info("Periodic analysis for guild {} finished: {}", guildId,
                    result == null ? "no result" : result.status());
        } catch (RuntimeException e) {
            LOG.error("Periodic analysis for guild {} failed; next cycle continues", guildId, e);
        } finally {
            completedCycles.incrementAndGet();
        }
    }
}
