package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.config.properties.SessionProperties;
import com.phillippitts.insightbot.domain.AnalysisMode;
import com.phillippitts.insightbot.domain.AnalysisResult;
import com.phillippitts.insightbot.domain.AudioSnapshot;
import com.phillippitts.insightbot.exception.NoAudioException;
import com.phillippitts.insightbot.exception.SessionCapacityException;
import com.phillippitts.insightbot.exception.SessionNotFoundException;
import com.phillippitts.insightbot.exception.VoiceCaptureException;
import com.phillippitts.insightbot.service.analysis.AnalysisPipeline;
import com.phillippitts.insightbot.service.audio.SessionRecorder;
import com.phillippitts.insightbot.service.capture.VoiceCaptureService;
import com.phillippitts.insightbot.service.metrics.AnalysisMetrics;
import com.phillippitts.insightbot.service.session.event.AnalysisCompletedEvent;
import com.phillippitts.insightbot.service.session.event.SessionStartedEvent;
import com.phillippitts.insightbot.service.session.event.SessionStoppedEvent;
import com.phillippitts.insightbot.service.settings.AnalysisIntervalPolicy;
import com.phillippitts.insightbot.service.settings.GuildSettingsStore;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for guild session lifecycle: start, manual analysis, stop.
 *
 * <p><b>Start:</b> the registry entry is reserved atomically, then voice capture is joined and
 * the periodic loop submitted. If either step fails the reservation is rolled back.
 *
 * <p><b>Stop sequence:</b>
 * <ol>
 *   <li>Remove the session from the registry; a concurrent second stop is rejected.</li>
 *   <li>Deactivate the session and signal its loop, which wakes immediately.</li>
 *   <li>Wait up to the stop grace period for the loop to exit.</li>
 *   <li>Release the capture handle, so no further fragments arrive.</li>
 *   <li>Run exactly one final analysis over what remains in the recorder.</li>
 * </ol>
 * Steps 1 and 2 run on the caller; the rest on the analysis executor.
 *
 * <p>Manual and periodic analyses of one session may overlap. Each takes its own atomic flush
 * of the recorder, so they never see the same audio.
 */
@Service
public class GuildSessionManager {

    private static final Logger LOG = LogManager.getLogger(GuildSessionManager.class);

    private final SessionRegistry registry;
    private final VoiceCaptureService captureService;
    private final AnalysisPipeline pipeline;
    private final GuildSettingsStore settingsStore;
    private final AnalysisIntervalPolicy intervalPolicy;
    private final SessionProperties properties;
    private final ApplicationEventPublisher publisher;
    private final Executor sessionExecutor;
    private final Executor analysisExecutor;
    private final Clock clock = Clock.systemUTC();

    public GuildSessionManager(SessionRegistry registry,
                               VoiceCaptureService captureService,
                               AnalysisPipeline pipeline,
                               GuildSettingsStore settingsStore,
                               AnalysisIntervalPolicy intervalPolicy,
                               SessionProperties properties,
                               ApplicationEventPublisher publisher,
                               AnalysisMetrics metrics,
                               @Qualifier("sessionExecutor") Executor sessionExecutor,
                               @Qualifier("analysisExecutor") Executor analysisExecutor) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.captureService = Objects.requireNonNull(captureService, "captureService must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.settingsStore = Objects.requireNonNull(settingsStore, "settingsStore must not be null");
        this.intervalPolicy = Objects.requireNonNull(intervalPolicy, "intervalPolicy must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor must not be null");
        this.analysisExecutor = Objects.requireNonNull(analysisExecutor, "analysisExecutor must not be null");
        metrics.registerActiveSessions(registry::size);
    }

    /**
     * Starts recording a guild's voice channel.
     *
     * @throws com.phillippitts.insightbot.exception.SessionAlreadyExistsException if the guild is
     *         already recording
     * @throws VoiceCaptureException    if the voice channel cannot be joined
     * @throws SessionCapacityException if no loop thread is available
     * @throws SessionNotFoundException if the session was stopped while it was starting
     */
    public GuildSession startSession(long guildId, long textChannelId, long voiceChannelId) {
        GuildSession session = registry.createIfAbsent(guildId, id -> new GuildSession(id, textChannelId,
                voiceChannelId, new SessionRecorder(id, clock), properties.getContextWindowChars()));
        try {
            if (!session.attachCapture(captureService.join(guildId, voiceChannelId, session))) {
                throw new SessionNotFoundException(guildId);
            }
            SessionScheduler scheduler = new SessionScheduler(guildId, session::isActive, intervalPolicy,
                    Duration.ofSeconds(properties.getDefaultIntervalSeconds()),
                    () -> analyze(session, AnalysisTrigger.PERIODIC));
            session.attachScheduler(scheduler);
            scheduler.start(sessionExecutor);
        } catch (VoiceCaptureException e) {
            rollback(session);
            throw e;
        } catch (RejectedExecutionException e) {
            rollback(session);
            throw new SessionCapacityException("No capacity to start a session for guild " + guildId, e);
        }

        LOG.info("Session started: guild={}, textChannel={}, voiceChannel={}", guildId, textChannelId, voiceChannelId);
        publisher.publishEvent(new SessionStartedEvent(guildId, textChannelId, voiceChannelId, session.startedAt()));
        return session;
    }

    /**
     * Runs an analysis now, alongside the periodic loop.
     *
     * @return future of the result; {@code NO_AUDIO} if nothing was recorded since the last flush
     * @throws SessionNotFoundException if the guild is not recording
     */
    public CompletableFuture<AnalysisResult> analyzeNow(long guildId) {
        GuildSession session = requireSession(guildId);
        return CompletableFuture.supplyAsync(() -> analyze(session, AnalysisTrigger.MANUAL), analysisExecutor);
    }

    /**
     * Stops a session and runs its final analysis.
     *
     * @return future of the final analysis result
     * @throws SessionNotFoundException if the guild is not recording
     */
    public CompletableFuture<AnalysisResult> stopSession(long guildId) {
        GuildSession session = registry.remove(guildId).orElseThrow(() -> new SessionNotFoundException(guildId));
        session.deactivate();
        SessionScheduler scheduler = session.scheduler();
        if (scheduler != null) {
            scheduler.signalStop();
        }
        LOG.info("Stopping session for guild {}", guildId);
        return CompletableFuture.supplyAsync(() -> finish(session, scheduler), analysisExecutor);
    }

    /**
     * Records a speaker's display name for the guild's session.
     *
     * @throws SessionNotFoundException if the guild is not recording
     */
    public void registerSpeaker(long guildId, long speakerId, String displayName) {
        requireSession(guildId).registerSpeaker(speakerId, displayName);
    }

    public Optional<GuildSession> findSession(long guildId) {
        return registry.get(guildId);
    }

    public int activeSessionCount() {
        return registry.size();
    }

    /**
     * Stops every remaining session on shutdown, final analyses included, bounded by the stop
     * grace period per session.
     */
    @PreDestroy
    public void stopAll() {
        List<CompletableFuture<AnalysisResult>> pending = new ArrayList<>();
        for (Long guildId : registry.guildIds()) {
            try {
                pending.add(stopSession(guildId));
            } catch (SessionNotFoundException e) {
                LOG.debug("Session for guild {} already stopped", guildId);
            }
        }
        if (pending.isEmpty()) {
            return;
        }
        LOG.info("Stopping {} sessions on shutdown", pending.size());
        long timeoutMs = properties.getStopGrace().toMillis() * 2;
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while stopping sessions");
        } catch (ExecutionException | TimeoutException e) {
            LOG.warn("Not all sessions finished their final analysis: {}", e.toString());
        }
    }

    private AnalysisResult finish(GuildSession session, SessionScheduler scheduler) {
        long guildId = session.guildId();
        if (scheduler != null && !scheduler.awaitTermination(properties.getStopGrace())) {
            LOG.warn("Loop for guild {} still busy after {}s; continuing stop", guildId,
                    properties.getStopGrace().toSeconds());
        }
        session.releaseCapture();
        AnalysisResult result = analyze(session, AnalysisTrigger.FINAL);
        LOG.info("Session stopped: guild={}, final analysis {}", guildId, result.status());
        publisher.publishEvent(new SessionStoppedEvent(guildId, result.status(), Instant.now(clock)));
        return result;
    }

    AnalysisResult analyze(GuildSession session, AnalysisTrigger trigger) {
        long start = System.nanoTime();
        AnalysisResult result;
        try {
            AudioSnapshot snapshot;
            if (trigger == AnalysisTrigger.PERIODIC) {
                Optional<AudioSnapshot> flushed = session.flushWhileActive();
                if (flushed.isEmpty()) {
                    LOG.debug("Skipping periodic analysis for stopped guild {}", session.guildId());
                    return AnalysisResult.noAudio();
                }
                snapshot = flushed.get();
            } else {
                snapshot = session.recorder().flush();
            }
            result = pipeline.run(session, snapshot, currentMode(session.guildId()), trigger == AnalysisTrigger.FINAL);
        } catch (NoAudioException e) {
            LOG.debug("{} analysis for guild {}: {}", trigger.tag(), session.guildId(), e.getMessage());
            result = AnalysisResult.noAudio();
        }
        publisher.publishEvent(new AnalysisCompletedEvent(session.guildId(), result, trigger,
                System.nanoTime() - start, Instant.now(clock)));
        return result;
    }

    private AnalysisMode currentMode(long guildId) {
        try {
            return settingsStore.load(guildId).mode();
        } catch (RuntimeException e) {
            LOG.warn("Settings lookup failed for guild {}, using mode {}: {}", guildId,
                    properties.getDefaultMode().value(), e.getMessage());
            return properties.getDefaultMode();
        }
    }

    private GuildSession requireSession(long guildId) {
        return registry.get(guildId).orElseThrow(() -> new SessionNotFoundException(guildId));
    }

    private void rollback(GuildSession session) {
        session.deactivate();
        session.releaseCapture();
        registry.remove(session.guildId(), session);
    }
}
