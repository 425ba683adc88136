package com.phillippitts.insightbot.exception;

/**
 * Thrown when the voice capture subsystem cannot join or serve a voice channel.
 */
public class VoiceCaptureException extends InsightBotException {

    public VoiceCaptureException(String message) {
        super(message);
    }

    public VoiceCaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
