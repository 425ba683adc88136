package com.phillippitts.insightbot.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Prompt mode used when asking the remote service to analyze a discussion.
 */
public enum AnalysisMode {
    DEBATE("debate"),
    SUMMARY("summary");

    private final String value;

    AnalysisMode(String value) {
        this.value = value;
    }

    /** Lower-case identifier used in storage and on the REST surface. */
    public String value() {
        return value;
    }

    /**
     * Parses a mode identifier, ignoring case and surrounding whitespace.
     *
     * @param raw identifier such as {@code "debate"} or {@code "Summary"}
     * @return the matching mode, or empty if the identifier is unknown
     */
    public static Optional<AnalysisMode> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AnalysisMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
