package com.phillippitts.insightbot.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable result of draining a session recorder.
 *
 * <p>Fragments of each speaker keep their arrival order. Speakers without fragments never
 * appear. {@code sessionStartedAt}, {@code flushedAt} and {@code sequence} together identify the
 * flush and are used to derive collision-free file names.
 *
 * @param guildId          guild the audio was recorded in
 * @param sessionStartedAt epoch milliseconds at which the recording session started
 * @param flushedAt        when the flush happened
 * @param sequence         per-session flush counter, starting at 1
 * @param fragments        speaker id to ordered fragments
 */
public record AudioSnapshot(long guildId,
                            long sessionStartedAt,
                            Instant flushedAt,
                            long sequence,
                            Map<Long, List<byte[]>> fragments) {

    public AudioSnapshot {
        Objects.requireNonNull(flushedAt, "flushedAt must not be null");
        Objects.requireNonNull(fragments, "fragments must not be null");
        Map<Long, List<byte[]>> copy = new LinkedHashMap<>();
        fragments.forEach((speaker, frames) -> {
            if (frames != null && !frames.isEmpty()) {
                copy.put(speaker, Collections.unmodifiableList(new ArrayList<>(frames)));
            }
        });
        fragments = Collections.unmodifiableMap(copy);
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    public int speakerCount() {
        return fragments.size();
    }

    /** Total number of buffered bytes across all speakers. */
    public long totalBytes() {
        long total = 0;
        for (List<byte[]> frames : fragments.values()) {
            for (byte[] frame : frames) {
                total += frame.length;
            }
        }
        return total;
    }
}
