package com.phillippitts.insightbot.exception;

/**
 * Thrown when no executor capacity is left to host another session loop.
 */
public class SessionCapacityException extends InsightBotException {

    public SessionCapacityException(String message, Throwable cause) {
        super(message, cause);
    }
}
