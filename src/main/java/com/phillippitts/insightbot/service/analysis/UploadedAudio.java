package com.phillippitts.insightbot.service.analysis;

/**
 * A file accepted and processed by the remote analysis service.
 *
 * @param speakerId  speaker stream id
 * @param label      display name sent with the file
 * @param remoteName service-side resource name, used for deletion
 * @param uri        service-side URI referenced in the analysis request
 * @param mimeType   MIME type reported by the service
 */
public record UploadedAudio(long speakerId, String label, String remoteName, String uri, String mimeType) {
}
