package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.domain.AnalysisResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SessionSchedulerTest {

    private static final Duration FALLBACK = Duration.ofMillis(50);

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void runsAnalysisEveryInterval() {
        AtomicInteger runs = new AtomicInteger();
        SessionScheduler scheduler = new SessionScheduler(1L, () -> true, g -> Duration.ofMillis(20), FALLBACK,
                () -> {
                    runs.incrementAndGet();
                    return AnalysisResult.noAudio();
                });

        scheduler.start(executor);

        await().atMost(2, TimeUnit.SECONDS).until(() -> runs.get() >= 3);
        assertThat(scheduler.stop(Duration.ofSeconds(1))).isTrue();
        assertThat(scheduler.state()).isEqualTo(SessionScheduler.State.TERMINATED);
    }

    @Test
    void stopWakesLoopWithoutWaitingForInterval() {
        // Arrange
        AtomicInteger runs = new AtomicInteger();
        SessionScheduler scheduler = new SessionScheduler(1L, () -> true, g -> Duration.ofHours(1), FALLBACK,
                () -> {
                    runs.incrementAndGet();
                    return AnalysisResult.noAudio();
                });
        scheduler.start(executor);
        await().atMost(1, TimeUnit.SECONDS).until(() -> scheduler.state() == SessionScheduler.State.RUNNING);

        // Act
        long start = System.nanoTime();
        boolean terminated = scheduler.stop(Duration.ofSeconds(2));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // Assert
        assertThat(terminated).isTrue();
        assertThat(elapsedMs).isLessThan(1000);
        assertThat(runs.get()).isZero();
    }

    @Test
    void intervalChangeAppliesFromNextCycle() {
        // Arrange
        AtomicReference<Duration> interval = new AtomicReference<>(Duration.ofMillis(20));
        List<Duration> seen = new CopyOnWriteArrayList<>();
        SessionScheduler scheduler = new SessionScheduler(1L, () -> true, g -> {
            Duration d = interval.get();
            seen.add(d);
            return d;
        }, FALLBACK, AnalysisResult::noAudio);

        // Act
        scheduler.start(executor);
        await().atMost(1, TimeUnit.SECONDS).until(() -> scheduler.completedCycles() >= 1);
        interval.set(Duration.ofMillis(30));
        await().atMost(1, TimeUnit.SECONDS).until(() -> seen.contains(Duration.ofMillis(30)));
        scheduler.stop(Duration.ofSeconds(1));

        // Assert
        assertThat(seen.get(0)).isEqualTo(Duration.ofMillis(20));
        assertThat(seen).contains(Duration.ofMillis(30));
    }

    @Test
    void failingCycleDoesNotEndLoop() {
        AtomicInteger attempts = new AtomicInteger();
        SessionScheduler scheduler = new SessionScheduler(1L, () -> true, g -> Duration.ofMillis(10), FALLBACK,
                () -> {
                    attempts.incrementAndGet();
                    throw new IllegalStateException("boom");
                });

        scheduler.start(executor);

        await().atMost(2, TimeUnit.SECONDS).until(() -> attempts.get() >= 3);
        assertThat(scheduler.state()).isEqualTo(SessionScheduler.State.RUNNING);
        scheduler.stop(Duration.ofSeconds(1));
    }

    @Test
    void failingIntervalPolicyFallsBackToDefault() {
        AtomicInteger runs = new AtomicInteger();
        SessionScheduler scheduler = new SessionScheduler(1L, () -> true, g -> {
            throw new IllegalStateException("db down");
        }, FALLBACK, () -> {
            runs.incrementAndGet();
            return AnalysisResult.noAudio();
        });

        scheduler.start(executor);

        await().atMost(2, TimeUnit.SECONDS).until(() -> runs.get() >= 1);
        scheduler.stop(Duration.ofSeconds(1));
    }

    @Test
    void exitsWhenSessionBecomesInactive() {
        AtomicBoolean active = new AtomicBoolean(true);
        SessionScheduler scheduler = new SessionScheduler(1L, active::get, g -> Duration.ofMillis(10), FALLBACK,
                AnalysisResult::noAudio);
        scheduler.start(executor);

        active.set(false);

        assertThat(scheduler.awaitTermination(Duration.ofSeconds(2))).isTrue();
    }

    @Test
    void cannotBeRestarted() {
        SessionScheduler scheduler = new SessionScheduler(1L, () -> true, g -> Duration.ofHours(1), FALLBACK,
                AnalysisResult::noAudio);
        scheduler.start(executor);
        scheduler.stop(Duration.ofSeconds(1));

        assertThatThrownBy(() -> scheduler.start(executor)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void stopBeforeStartTerminatesImmediately() {
        SessionScheduler scheduler = new SessionScheduler(1L, () -> true, g -> Duration.ofHours(1), FALLBACK,
                AnalysisResult::noAudio);

        assertThat(scheduler.stop(Duration.ZERO)).isTrue();
        assertThat(scheduler.state()).isEqualTo(SessionScheduler.State.TERMINATED);
    }

    @Test
    void rejectedStartLeavesSchedulerTerminated() {
        SessionScheduler scheduler = new SessionScheduler(1L, () -> true, g -> Duration.ofHours(1), FALLBACK,
                AnalysisResult::noAudio);

        assertThatThrownBy(() -> scheduler.start(command -> {
            throw new RejectedExecutionException("full");
        })).isInstanceOf(RejectedExecutionException.class);
        assertThat(scheduler.state()).isEqualTo(SessionScheduler.State.TERMINATED);
    }
}
