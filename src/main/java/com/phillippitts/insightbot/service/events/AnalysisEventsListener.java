package com.phillippitts.insightbot.service.events;

import com.phillippitts.insightbot.domain.AnalysisResult;
import com.phillippitts.insightbot.service.metrics.AnalysisMetrics;
import com.phillippitts.insightbot.service.session.event.AnalysisCompletedEvent;
import com.phillippitts.insightbot.service.session.event.SessionStartedEvent;
import com.phillippitts.insightbot.service.session.event.SessionStoppedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records metrics for session and analysis events and logs the ones operators care about.
 * Rate-limit warnings are throttled per guild to avoid log spam.
 */
@Component
class AnalysisEventsListener {
    private static final Logger LOG = LogManager.getLogger(AnalysisEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(10);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final AnalysisMetrics metrics;

    AnalysisEventsListener(AnalysisMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onAnalysisCompleted(AnalysisCompletedEvent e) {
        String trigger = e.trigger().tag();
        metrics.incrementOutcome(trigger, e.result().status().name());
        if (e.result().status() != AnalysisResult.Status.NO_AUDIO) {
            metrics.recordLatency(trigger, e.durationNanos());
        }

        if (e.result().status() == AnalysisResult.Status.RATE_LIMITED
                && shouldLog("rate-limited-" + e.guildId())) {
            LOG.warn("Analysis quota reached for guild {}. Reports resume once the quota recovers.", e.guildId());
        }
    }

    @EventListener
    void onSessionStarted(SessionStartedEvent e) {
        LOG.info("Recording guild {} voice channel {}", e.guildId(), e.voiceChannelId());
    }

    @EventListener
    void onSessionStopped(SessionStoppedEvent e) {
        LOG.info("Recording of guild {} ended, final analysis {}", e.guildId(), e.finalStatus());
        lastLog.remove("rate-limited-" + e.guildId());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
