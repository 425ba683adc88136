package com.phillippitts.insightbot.service.audio;

import com.phillippitts.insightbot.domain.AudioSnapshot;
import com.phillippitts.insightbot.exception.NoAudioException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Collects audio fragments per speaker for one guild session.
 *
 * <p><b>Thread Safety:</b> {@link #ingest(long, byte[])} may be called concurrently from any
 * number of capture threads. Ingestion shares the read side of a generation lock and uses the
 * per-key locking of {@link ConcurrentHashMap#compute}, so distinct speakers never serialize on
 * each other. {@link #flush()} takes the write side only long enough to swap in an empty
 * generation, then drains the old one without holding any lock.
 *
 * <p><b>Flush Guarantees:</b>
 * <ul>
 *   <li>A fragment whose {@code ingest} completed before the swap is in that flush's snapshot.</li>
 *   <li>A fragment ingested after the swap lands in the next generation and is returned by a
 *       later flush.</li>
 *   <li>No fragment is ever returned by two flushes.</li>
 * </ul>
 * Concurrent flushes (periodic and manual) therefore never observe overlapping audio.
 */
public final class SessionRecorder {

    private static final Logger LOG = LogManager.getLogger(SessionRecorder.class);

    private final long guildId;
    private final long sessionStartedAt;
    private final Clock clock;
    private final ReadWriteLock generationLock = new ReentrantReadWriteLock();
    private final AtomicLong flushSequence = new AtomicLong();

    private volatile ConcurrentMap<Long, SpeakerBuffer> generation = new ConcurrentHashMap<>();

    public SessionRecorder(long guildId, Clock clock) {
        this.guildId = guildId;
        this.clock = clock;
        this.sessionStartedAt = clock.instant().toEpochMilli();
    }

    public long guildId() {
        return guildId;
    }

    /** Epoch milliseconds at which this recorder was created. */
    public long sessionStartedAt() {
        return sessionStartedAt;
    }

    /**
     * Appends a fragment to the speaker's buffer, creating the buffer on first use.
     *
     * @param speakerId  opaque speaker key (capture stream id)
     * @param fragment   raw encoded audio; copied, so callers may reuse the array
     * @return {@code true} if the fragment was buffered, {@code false} if it was null, empty or
     *         larger than {@link AudioFrameWriter#MAX_FRAGMENT_BYTES}
     */
    public boolean ingest(long speakerId, byte[] fragment) {
        if (fragment == null || fragment.length == 0) {
            return false;
        }
        if (fragment.length > AudioFrameWriter.MAX_FRAGMENT_BYTES) {
            LOG.warn("Rejected {}-byte fragment of speaker {} in guild {}", fragment.length, speakerId, guildId);
            return false;
        }
        byte[] copy = fragment.clone();
        generationLock.readLock().lock();
        try {
            generation.compute(speakerId, (id, buffer) -> {
                SpeakerBuffer target = buffer != null ? buffer : new SpeakerBuffer(id, clock.instant());
                target.append(copy);
                return target;
            });
        } finally {
            generationLock.readLock().unlock();
        }
        return true;
    }

    /**
     * Atomically takes every buffered fragment and resets the recorder.
     *
     * @return snapshot of speaker id to fragments in arrival order
     * @throws NoAudioException if no speaker had buffered audio
     */
    public AudioSnapshot flush() {
        ConcurrentMap<Long, SpeakerBuffer> drained;
        generationLock.writeLock().lock();
        try {
            drained = generation;
            generation = new ConcurrentHashMap<>();
        } finally {
            generationLock.writeLock().unlock();
        }

        Map<Long, List<byte[]>> fragments = new LinkedHashMap<>();
        for (SpeakerBuffer buffer : drained.values()) {
            List<byte[]> frames = buffer.drain();
            if (!frames.isEmpty()) {
                fragments.put(buffer.speakerId(), frames);
            }
        }

        if (fragments.isEmpty()) {
            throw new NoAudioException("No audio buffered for guild " + guildId);
        }

        Instant flushedAt = clock.instant();
        AudioSnapshot snapshot = new AudioSnapshot(guildId, sessionStartedAt, flushedAt,
                flushSequence.incrementAndGet(), fragments);
        LOG.debug("Flushed {} speakers ({} bytes) for guild {} (flush #{})",
                snapshot.speakerCount(), snapshot.totalBytes(), guildId, snapshot.sequence());
        return snapshot;
    }

    public boolean hasAudio() {
        for (SpeakerBuffer buffer : generation.values()) {
            if (!buffer.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /** Speakers that currently have buffered audio, in ascending id order. */
    public Set<Long> bufferedSpeakers() {
        Set<Long> speakers = new TreeSet<>();
        generation.forEach((id, buffer) -> {
            if (!buffer.isEmpty()) {
                speakers.add(id);
            }
        });
        return Collections.unmodifiableSet(speakers);
    }

    public long bufferedBytes() {
        long total = 0;
        for (SpeakerBuffer buffer : generation.values()) {
            total += buffer.byteCount();
        }
        return total;
    }
}
