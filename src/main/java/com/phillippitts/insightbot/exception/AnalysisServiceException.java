package com.phillippitts.insightbot.exception;

/**
 * Thrown when the remote analysis service rejects or fails a request.
 *
 * <p>The {@link Kind} drives how the analysis pipeline classifies the outcome:
 * rate limits map to a fixed advisory, everything else is reported as a transient error
 * and retried naturally on the next scheduled run.
 */
public class AnalysisServiceException extends InsightBotException {

    public enum Kind { RATE_LIMITED, TRANSIENT, FATAL }

    private final Kind kind;
    private final int statusCode;

    public AnalysisServiceException(String message, Kind kind) {
        this(message, kind, 0, null);
    }

    public AnalysisServiceException(String message, Kind kind, Throwable cause) {
        this(message, kind, 0, cause);
    }

    public AnalysisServiceException(String message, Kind kind, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? Kind.TRANSIENT : kind;
        this.statusCode = statusCode;
    }

    public Kind getKind() {
        return kind;
    }

    /** HTTP status code of the failed call, or 0 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return kind == Kind.RATE_LIMITED;
    }
}
