package com.phillippitts.insightbot.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralized metrics for guild sessions and discussion analyses.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Analysis latency per trigger (periodic, manual, final)</li>
 *   <li>Analysis outcomes per trigger and result status</li>
 *   <li>Per-speaker upload failures</li>
 *   <li>Number of active sessions</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class AnalysisMetrics {

    private static final String METRIC_PREFIX = "insightbot";

    private final MeterRegistry registry;

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the duration of one analysis run.
     *
     * @param trigger what started the run (periodic, manual, final)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String trigger, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".analysis.latency")
                .description("Time taken to flush, upload, analyze and publish")
                .tag("trigger", trigger)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts one analysis outcome.
     *
     * @param trigger what started the run (periodic, manual, final)
     * @param outcome result status name
     */
    public void incrementOutcome(String trigger, String outcome) {
        Counter.builder(METRIC_PREFIX + ".analysis.outcome")
                .description("Number of analysis runs by outcome")
                .tag("trigger", trigger)
                .tag("outcome", outcome.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Counts a speaker file that was left out of an analysis.
     *
     * @param reason failure reason (write, rate_limited, transient, fatal)
     */
    public void incrementUploadFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".upload.failure")
                .description("Number of speaker files excluded from an analysis")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Exposes the number of active sessions as a gauge.
     */
    public void registerActiveSessions(Supplier<Number> activeSessions) {
        Gauge.builder(METRIC_PREFIX + ".sessions.active", activeSessions)
                .description("Number of guilds currently recording")
                .register(registry);
    }
}
