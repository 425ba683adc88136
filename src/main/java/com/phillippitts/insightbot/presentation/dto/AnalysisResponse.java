package com.phillippitts.insightbot.presentation.dto;

import com.phillippitts.insightbot.domain.AnalysisResult;

/**
 * Outcome of a manual analysis.
 *
 * @param status  result status
 * @param message human-readable outcome
 * @param report  report text, success only
 */
public record AnalysisResponse(AnalysisResult.Status status, String message, String report) {

    static final String NO_AUDIO_MESSAGE = "No audio recorded yet.";

    public static AnalysisResponse of(AnalysisResult result) {
        String message = switch (result.status()) {
            case SUCCESS -> "Report published.";
            case NO_AUDIO -> NO_AUDIO_MESSAGE;
            case RATE_LIMITED -> "Analysis quota reached; the advisory was published.";
            case TRANSIENT_ERROR -> result.message();
        };
        return new AnalysisResponse(result.status(), message, result.report());
    }
}
