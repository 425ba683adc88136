package com.phillippitts.insightbot.domain;

import java.util.Objects;

/**
 * Outcome of one analysis pass over a flushed audio snapshot.
 *
 * <p>Every pipeline run produces exactly one result; callers decide how to surface it.
 * {@code report} is set for {@link Status#SUCCESS}, {@code message} carries the failure
 * description for {@link Status#TRANSIENT_ERROR}.
 *
 * @param status  classified outcome
 * @param report  report text (success only, otherwise null)
 * @param message failure detail (may be null)
 */
public record AnalysisResult(Status status, String report, String message) {

    public enum Status { SUCCESS, NO_AUDIO, RATE_LIMITED, TRANSIENT_ERROR }

    public AnalysisResult {
        Objects.requireNonNull(status, "status must not be null");
        if (status == Status.SUCCESS) {
            Objects.requireNonNull(report, "report must not be null for a successful result");
        }
    }

    public static AnalysisResult success(String report) {
        return new AnalysisResult(Status.SUCCESS, report, null);
    }

    public static AnalysisResult noAudio() {
        return new AnalysisResult(Status.NO_AUDIO, null, "No audio was recorded");
    }

    public static AnalysisResult rateLimited() {
        return new AnalysisResult(Status.RATE_LIMITED, null, "Analysis quota exceeded");
    }

    public static AnalysisResult transientError(String message) {
        return new AnalysisResult(Status.TRANSIENT_ERROR, null, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
