package com.phillippitts.insightbot.service.analysis;

import com.phillippitts.insightbot.config.properties.PublicationProperties;
import com.phillippitts.insightbot.config.properties.SessionProperties;
import com.phillippitts.insightbot.domain.AnalysisMode;
import com.phillippitts.insightbot.domain.AnalysisResult;
import com.phillippitts.insightbot.domain.AudioSnapshot;
import com.phillippitts.insightbot.exception.AnalysisServiceException;
import com.phillippitts.insightbot.service.audio.AudioFrameWriter;
import com.phillippitts.insightbot.service.audio.AudioMimeTypes;
import com.phillippitts.insightbot.service.metrics.AnalysisMetrics;
import com.phillippitts.insightbot.service.publication.MessageHandle;
import com.phillippitts.insightbot.service.publication.ReportPublisher;
import com.phillippitts.insightbot.service.publication.ThreadHandle;
import com.phillippitts.insightbot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Drives one analysis pass: persist, upload, analyze, publish, clean up.
 *
 * <p>Steps:
 * <ol>
 *   <li>An empty snapshot yields {@code NO_AUDIO} without touching disk or network.</li>
 *   <li>Each speaker's fragments are written to a transient file and uploaded with the
 *       speaker's display name. A speaker whose write or upload fails is left out; the others
 *       continue.</li>
 *   <li>If no file was uploaded the result is {@code NO_AUDIO} and nothing is published.</li>
 *   <li>A starter message is posted in the channel, a thread opened on it and a progress line
 *       sent into the thread.</li>
 *   <li>One report is requested for the whole batch. The outcome is classified; a successful
 *       report replaces the target's rolling context.</li>
 *   <li>The report, or the advisory or error text, is sent into the thread.</li>
 *   <li>Local files and remote uploads are always released, best effort.</li>
 * </ol>
 *
 * <p><b>Thread Safety:</b> Stateless; concurrent runs for the same or different guilds are
 * independent. File names include the flush sequence, so concurrent runs never collide.
 *
 * <p>No exception escapes {@link #run}: every failure becomes an {@link AnalysisResult}.
 */
@Service
public class AnalysisPipeline {

    private static final Logger LOG = LogManager.getLogger(AnalysisPipeline.class);

    private final AnalysisClient client;
    private final ReportPublisher publisher;
    private final SessionProperties sessionProperties;
    private final PublicationProperties publicationProperties;
    private final AnalysisMetrics metrics;

    public AnalysisPipeline(AnalysisClient client,
                            ReportPublisher publisher,
                            SessionProperties sessionProperties,
                            PublicationProperties publicationProperties,
                            AnalysisMetrics metrics) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.sessionProperties = Objects.requireNonNull(sessionProperties, "sessionProperties must not be null");
        this.publicationProperties = Objects.requireNonNull(publicationProperties,
                "publicationProperties must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Runs one analysis pass.
     *
     * @param target   session state providing names and context, receiving the new context
     * @param snapshot flushed audio, may be empty
     * @param mode     prompt mode
     * @param isFinal  true for the pass run when a session stops
     * @return classified outcome, never null
     */
    public AnalysisResult run(AnalysisTarget target, AudioSnapshot snapshot, AnalysisMode mode, boolean isFinal) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (snapshot == null || snapshot.isEmpty()) {
            LOG.debug("Nothing to analyze for guild {}", target.guildId());
            return AnalysisResult.noAudio();
        }

        List<Path> localFiles = new ArrayList<>();
        List<UploadedAudio> uploaded = new ArrayList<>();
        try {
            boolean rateLimited = uploadAll(target, snapshot, localFiles, uploaded);
            if (uploaded.isEmpty()) {
                LOG.warn("No speaker file could be uploaded for guild {} ({} speakers{})",
                        target.guildId(), snapshot.speakerCount(), rateLimited ? ", quota reached" : "");
                return AnalysisResult.noAudio();
            }

            ThreadHandle thread;
            try {
                thread = openThread(target, snapshot, mode, isFinal);
            } catch (RuntimeException e) {
                LOG.error("Failed to open report thread for guild {}: {}", target.guildId(), e.getMessage());
                return AnalysisResult.transientError("Report could not be published: " + e.getMessage());
            }

            AnalysisResult result = analyze(target, uploaded, mode);
            if (result.isSuccess()) {
                target.replaceContext(result.report());
            }
            return publish(target, thread, result, isFinal);
        } catch (RuntimeException e) {
            LOG.error("Analysis failed unexpectedly for guild {}", target.guildId(), e);
            return AnalysisResult.transientError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } finally {
            releaseUploads(uploaded);
            deleteLocalFiles(localFiles);
        }
    }

    /**
     * @return true if at least one upload was refused for quota
     */
    private boolean uploadAll(AnalysisTarget target, AudioSnapshot snapshot,
                              List<Path> localFiles, List<UploadedAudio> uploaded) {
        boolean rateLimited = false;
        for (Map.Entry<Long, List<byte[]>> entry : snapshot.fragments().entrySet()) {
            long speakerId = entry.getKey();
            String label = target.displayNameFor(speakerId);

            Path file;
            try {
                file = writeSpeakerFile(snapshot, speakerId, entry.getValue());
                localFiles.add(file);
            } catch (RuntimeException e) {
                LOG.warn("Failed to write audio of speaker {} in guild {}: {}",
                        speakerId, target.guildId(), e.getMessage());
                metrics.incrementUploadFailure("write");
                continue;
            }

            try {
                uploaded.add(client.upload(new AudioUpload(speakerId, label, file, AudioMimeTypes.forPath(file))));
            } catch (AnalysisServiceException e) {
                LOG.warn("Upload failed for {} in guild {}, excluding from batch: {}",
                        LogSanitizer.truncate(label, 32), target.guildId(), e.getMessage());
                metrics.incrementUploadFailure(e.getKind().name().toLowerCase(Locale.ROOT));
                rateLimited |= e.isRateLimited();
            } catch (RuntimeException e) {
                LOG.warn("Upload failed for {} in guild {}, excluding from batch",
                        LogSanitizer.truncate(label, 32), target.guildId(), e);
                metrics.incrementUploadFailure("error");
            }
        }
        return rateLimited;
    }

    private Path writeSpeakerFile(AudioSnapshot snapshot, long speakerId, List<byte[]> fragments) {
        Path dir = sessionProperties.getTempAudioDir();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create audio directory " + dir + ": " + e.getMessage(), e);
        }
        Path file = dir.resolve(AudioFrameWriter.fileName(snapshot, speakerId));
        AudioFrameWriter.writeFrames(fragments, file);
        return file;
    }

    private AnalysisResult analyze(AnalysisTarget target, List<UploadedAudio> uploaded, AnalysisMode mode) {
        try {
            String report = client.generateReport(uploaded, mode, target.context());
            if (report == null || report.isBlank()) {
                report = ReportMessages.FALLBACK_REPORT;
            }
            return AnalysisResult.success(report);
        } catch (AnalysisServiceException e) {
            if (e.isRateLimited()) {
                LOG.warn("Analysis rate limited for guild {}: {}", target.guildId(), e.getMessage());
                return AnalysisResult.rateLimited();
            }
            LOG.error("Analysis failed for guild {} ({}): {}", target.guildId(), e.getKind(), e.getMessage());
            return AnalysisResult.transientError(e.getMessage());
        }
    }

    private ThreadHandle openThread(AnalysisTarget target, AudioSnapshot snapshot, AnalysisMode mode,
                                    boolean isFinal) {
        MessageHandle starter = publisher.postMessage(target.textChannelId(),
                ReportMessages.starter(isFinal, snapshot.flushedAt()));
        ThreadHandle thread = publisher.createThread(starter,
                ReportMessages.threadTitle(isFinal, snapshot.flushedAt()));
        publisher.sendToThread(thread, ReportMessages.progress(mode));
        return thread;
    }

    private AnalysisResult publish(AnalysisTarget target, ThreadHandle thread, AnalysisResult result,
                                   boolean isFinal) {
        List<String> messages = ReportMessages.threadMessages(result, isFinal,
                publicationProperties.getMessageLimit(), publicationProperties.getChunkSize());
        try {
            for (String message : messages) {
                publisher.sendToThread(thread, message);
            }
            LOG.info("Published {} result for guild {} in {} messages",
                    result.status(), target.guildId(), messages.size());
            return result;
        } catch (RuntimeException e) {
            LOG.error("Failed to publish {} result for guild {}: {}", result.status(), target.guildId(), e.getMessage());
            return AnalysisResult.transientError("Report could not be published: " + e.getMessage());
        }
    }

    private void releaseUploads(List<UploadedAudio> uploaded) {
        for (UploadedAudio file : uploaded) {
            try {
                client.delete(file);
            } catch (RuntimeException e) {
                LOG.warn("Failed to release remote file {}: {}", file.remoteName(), e.getMessage());
            }
        }
    }

    private void deleteLocalFiles(List<Path> files) {
        for (Path file : files) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                LOG.warn("Failed to delete transient audio file {}: {}", file, e.getMessage());
            }
        }
    }
}
