package com.phillippitts.insightbot.service.audio;

import java.nio.file.Path;
import java.util.Locale;

/**
 * MIME hints sent alongside uploaded audio files.
 */
public final class AudioMimeTypes {

    public static final String OGG = "audio/ogg";

    private AudioMimeTypes() {}

    /**
     * Resolves the MIME type from the file extension. Raw opus frames are declared as
     * {@code audio/ogg}; unknown extensions fall back to the same.
     */
    public static String forPath(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String ext = dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return switch (ext) {
            case "mp3" -> "audio/mp3";
            case "wav" -> "audio/wav";
            case "flac" -> "audio/flac";
            case "pcm" -> "audio/pcm";
            default -> OGG;
        };
    }
}
