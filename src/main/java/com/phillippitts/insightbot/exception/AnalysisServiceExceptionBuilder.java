package com.phillippitts.insightbot.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link AnalysisServiceException} with contextual details.
 *
 * <p>Keeps the remote client's failure messages consistent across upload, polling and
 * generation calls.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw AnalysisServiceExceptionBuilder.create("Generation failed")
 *         .kind(AnalysisServiceException.Kind.TRANSIENT)
 *         .status(503)
 *         .durationMs(1200)
 *         .metadata("model", model)
 *         .build();
 * </pre>
 */
public final class AnalysisServiceExceptionBuilder {

    private final String message;
    private AnalysisServiceException.Kind kind = AnalysisServiceException.Kind.TRANSIENT;
    private Throwable cause;
    private Integer status;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private AnalysisServiceExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static AnalysisServiceExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new AnalysisServiceExceptionBuilder(message);
    }

    public AnalysisServiceExceptionBuilder kind(AnalysisServiceException.Kind kind) {
        this.kind = kind;
        return this;
    }

    public AnalysisServiceExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the HTTP status of the failed call.
     *
     * @param status HTTP status code
     * @return this builder for chaining
     */
    public AnalysisServiceExceptionBuilder status(int status) {
        this.status = status;
        return this;
    }

    public AnalysisServiceExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public AnalysisServiceExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The final message format is:
     * <pre>
     * {message} (status={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return constructed AnalysisServiceException
     */
    public AnalysisServiceException build() {
        return new AnalysisServiceException(buildDetailedMessage(), kind,
                status != null ? status : 0, cause);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = status != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (status != null) {
            sb.append("status=").append(status);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        return sb.append(")").toString();
    }
}
