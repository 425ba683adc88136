package com.phillippitts.insightbot.service.audio;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only fragment buffer for one speaker within one recording generation.
 *
 * <p>Fragments are kept in arrival order and never reordered. {@link #drain()} hands the
 * accumulated fragments to the caller and leaves the buffer empty.
 */
final class SpeakerBuffer {

    private final long speakerId;
    private final Instant createdAt;
    private List<byte[]> fragments = new ArrayList<>();
    private long byteCount;

    SpeakerBuffer(long speakerId, Instant createdAt) {
        this.speakerId = speakerId;
        this.createdAt = createdAt;
    }

    long speakerId() {
        return speakerId;
    }

    Instant createdAt() {
        return createdAt;
    }

    synchronized void append(byte[] fragment) {
        fragments.add(fragment);
        byteCount += fragment.length;
    }

    /**
     * Returns the buffered fragments as an immutable list and resets the buffer.
     */
    synchronized List<byte[]> drain() {
        List<byte[]> taken = Collections.unmodifiableList(fragments);
        fragments = new ArrayList<>();
        byteCount = 0;
        return taken;
    }

    synchronized int fragmentCount() {
        return fragments.size();
    }

    synchronized long byteCount() {
        return byteCount;
    }

    synchronized boolean isEmpty() {
        return fragments.isEmpty();
    }
}
