package com.phillippitts.insightbot.exception;

/**
 * Thrown when a flush finds no buffered audio.
 *
 * <p>This is the normal outcome for an idle guild and is only surfaced to users
 * when they explicitly asked for an analysis.
 */
public class NoAudioException extends InsightBotException {

    public NoAudioException(String message) {
        super(message);
    }
}
