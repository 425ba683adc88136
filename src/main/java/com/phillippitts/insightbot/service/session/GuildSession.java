package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.domain.AudioSnapshot;
import com.phillippitts.insightbot.service.analysis.AnalysisTarget;
import com.phillippitts.insightbot.service.audio.SessionRecorder;
import com.phillippitts.insightbot.service.capture.AudioFrameSink;
import com.phillippitts.insightbot.service.capture.VoiceCaptureHandle;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One guild's recording session.
 *
 * <p>Aggregates the recorder, the publication channel, the owned voice capture handle, the
 * speaker display-name table, the rolling context and the periodic scheduler.
 *
 * <p><b>Thread Safety:</b> The mutable fields (active flag, display names, context, scheduler
 * and capture handles) are guarded by one {@link ReentrantReadWriteLock} scoped to this
 * session. Readers such as the loop polling {@link #isActive()} or a pipeline reading the
 * context share the read lock. Audio fragments bypass the lock and go straight to the
 * {@link SessionRecorder}, which has its own fine-grained concurrency.
 *
 * <p><b>Lifecycle:</b> A session is active from construction until {@link #deactivate()}.
 * It is never reactivated; recording again requires a new session.
 */
public final class GuildSession implements AnalysisTarget, AudioFrameSink {

    static final String UNKNOWN_SPEAKER_PREFIX = "User_";

    private final long guildId;
    private final long textChannelId;
    private final long voiceChannelId;
    private final SessionRecorder recorder;
    private final int contextWindowChars;
    private final Instant startedAt;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Long, String> displayNames = new HashMap<>();
    private String context = "";
    private boolean active = true;
    private SessionScheduler scheduler;
    private VoiceCaptureHandle captureHandle;

    public GuildSession(long guildId, long textChannelId, long voiceChannelId,
                        SessionRecorder recorder, int contextWindowChars) {
        if (contextWindowChars <= 0) {
            throw new IllegalArgumentException("contextWindowChars must be positive, got: " + contextWindowChars);
        }
        this.guildId = guildId;
        this.textChannelId = textChannelId;
        this.voiceChannelId = voiceChannelId;
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.contextWindowChars = contextWindowChars;
        this.startedAt = Instant.ofEpochMilli(recorder.sessionStartedAt());
    }

    @Override
    public long guildId() {
        return guildId;
    }

    @Override
    public long textChannelId() {
        return textChannelId;
    }

    public long voiceChannelId() {
        return voiceChannelId;
    }

    public SessionRecorder recorder() {
        return recorder;
    }

    public Instant startedAt() {
        return startedAt;
    }

    @Override
    public void onFragment(long speakerId, byte[] fragment) {
        recorder.ingest(speakerId, fragment);
    }

    @Override
    public void onSpeakerIdentified(long speakerId, String displayName) {
        registerSpeaker(speakerId, displayName);
    }

    /**
     * Records or updates a speaker's display name. Entries are never removed while the
     * session lives. Blank names are ignored.
     */
    public void registerSpeaker(long speakerId, String displayName) {
        if (displayName == null || displayName.isBlank()) {
            return;
        }
        lock.writeLock().lock();
        try {
            displayNames.put(speakerId, displayName.trim());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String displayNameFor(long speakerId) {
        lock.readLock().lock();
        try {
            String name = displayNames.get(speakerId);
            return name != null ? name : UNKNOWN_SPEAKER_PREFIX + speakerId;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Copy of the display-name table. */
    public Map<Long, String> displayNames() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new HashMap<>(displayNames));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String context() {
        lock.readLock().lock();
        try {
            return context;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the rolling context with the last {@code contextWindowChars} characters of the
     * report. The previous context is discarded, never concatenated.
     */
    @Override
    public void replaceContext(String report) {
        String trailing = trailingWindow(report == null ? "" : report, contextWindowChars);
        lock.writeLock().lock();
        try {
            context = trailing;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isActive() {
        lock.readLock().lock();
        try {
            return active;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Marks the session inactive.
     *
     * @return true if this call changed the state
     */
    public boolean deactivate() {
        lock.writeLock().lock();
        try {
            boolean wasActive = active;
            active = false;
            return wasActive;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Flushes the recorder unless the session has been deactivated. The active check and the
     * flush happen under the read lock, so {@link #deactivate()} cannot slip in between.
     *
     * @return the snapshot, or empty if the session is no longer active
     * @throws com.phillippitts.insightbot.exception.NoAudioException if nothing was buffered
     */
    Optional<AudioSnapshot> flushWhileActive() {
        lock.readLock().lock();
        try {
            if (!active) {
                return Optional.empty();
            }
            return Optional.of(recorder.flush());
        } finally {
            lock.readLock().unlock();
        }
    }

    void attachScheduler(SessionScheduler scheduler) {
        lock.writeLock().lock();
        try {
            if (this.scheduler != null) {
                throw new IllegalStateException("Scheduler already attached for guild " + guildId);
            }
            this.scheduler = scheduler;
        } finally {
            lock.writeLock().unlock();
        }
    }

    SessionScheduler scheduler() {
        lock.readLock().lock();
        try {
            return scheduler;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Takes ownership of the capture handle. A session deactivated in the meantime refuses it
     * and closes the handle right away.
     *
     * @return false if the session was no longer active
     */
    boolean attachCapture(VoiceCaptureHandle handle) {
        lock.writeLock().lock();
        try {
            if (this.captureHandle != null) {
                throw new IllegalStateException("Capture already attached for guild " + guildId);
            }
            if (active) {
                this.captureHandle = handle;
                return true;
            }
        } finally {
            lock.writeLock().unlock();
        }
        handle.close();
        return false;
    }

    public boolean hasOpenCapture() {
        lock.readLock().lock();
        try {
            return captureHandle != null && captureHandle.isOpen();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Detaches and closes the capture handle. Safe to call more than once.
     */
    void releaseCapture() {
        VoiceCaptureHandle handle;
        lock.writeLock().lock();
        try {
            handle = captureHandle;
            captureHandle = null;
        } finally {
            lock.writeLock().unlock();
        }
        if (handle != null) {
            handle.close();
        }
    }

    static String trailingWindow(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        int start = text.length() - maxChars;
        if (Character.isLowSurrogate(text.charAt(start)) && start > 0
                && Character.isHighSurrogate(text.charAt(start - 1))) {
            start++;
        }
        return text.substring(start);
    }
}
