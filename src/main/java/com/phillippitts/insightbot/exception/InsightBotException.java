package com.phillippitts.insightbot.exception;

/**
 * Base exception for all insightbot application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class InsightBotException extends RuntimeException {

    public InsightBotException(String message) {
        super(message);
    }

    public InsightBotException(String message, Throwable cause) {
        super(message, cause);
    }

    public InsightBotException(Throwable cause) {
        super(cause);
    }
}
