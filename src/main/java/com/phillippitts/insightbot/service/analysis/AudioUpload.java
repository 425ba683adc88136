package com.phillippitts.insightbot.service.analysis;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One speaker's audio file ready for upload.
 *
 * @param speakerId speaker stream id
 * @param label     display name sent with the file
 * @param file      local transient file
 * @param mimeType  MIME hint for the remote service
 */
public record AudioUpload(long speakerId, String label, Path file, String mimeType) {

    public AudioUpload {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(mimeType, "mimeType must not be null");
    }
}
