package com.phillippitts.insightbot.service.audio;

import com.phillippitts.insightbot.domain.AudioSnapshot;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Persists a speaker's encoded fragments to a transient file for upload.
 *
 * <p>Layout: each fragment is written as an unsigned 16-bit little-endian length followed by the
 * fragment bytes. Fragments are written in arrival order.
 */
public final class AudioFrameWriter {

    /** Largest fragment representable by the 16-bit length prefix. */
    public static final int MAX_FRAGMENT_BYTES = 0xFFFF;

    public static final String FILE_EXTENSION = ".opus";

    private AudioFrameWriter() {}

    /**
     * Writes the fragments to the given path, creating or overwriting it.
     *
     * @param fragments ordered fragments of one speaker
     * @param path      output file
     * @throws IllegalArgumentException if a fragment exceeds {@link #MAX_FRAGMENT_BYTES}
     * @throws IllegalStateException    if the file cannot be written
     */
    public static void writeFrames(List<byte[]> fragments, Path path) {
        Objects.requireNonNull(fragments, "fragments must not be null");
        Objects.requireNonNull(path, "path must not be null");
        try (OutputStream os = Files.newOutputStream(path)) {
            for (byte[] fragment : fragments) {
                if (fragment.length > MAX_FRAGMENT_BYTES) {
                    throw new IllegalArgumentException(
                            "Fragment of " + fragment.length + " bytes exceeds " + MAX_FRAGMENT_BYTES);
                }
                os.write(fragment.length & 0xFF);
                os.write((fragment.length >>> 8) & 0xFF);
                os.write(fragment);
            }
            os.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write audio frames to " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * File name for one speaker of one flush:
     * {@code <guild>_<sessionStart>_<speaker>_<flushMillis>_<sequence>.opus}.
     *
     * <p>Unique across guilds, across sessions of the same guild, and across repeated or
     * concurrent flushes of the same session.
     */
    public static String fileName(AudioSnapshot snapshot, long speakerId) {
        return snapshot.guildId() + "_" + snapshot.sessionStartedAt() + "_" + speakerId + "_"
                + snapshot.flushedAt().toEpochMilli() + "_" + snapshot.sequence() + FILE_EXTENSION;
    }
}
