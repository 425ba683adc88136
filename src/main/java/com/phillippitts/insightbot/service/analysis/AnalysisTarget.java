package com.phillippitts.insightbot.service.analysis;

/**
 * The session-side state an analysis run reads and updates.
 */
public interface AnalysisTarget {

    long guildId();

    /** Channel the report is published to. */
    long textChannelId();

    /** Trailing excerpt of the previous successful report; empty before the first one. */
    String context();

    /** Display name of a speaker, or a synthetic {@code User_<id>} label if unknown. */
    String displayNameFor(long speakerId);

    /** Replaces the rolling context with the trailing window of a new report. */
    void replaceContext(String report);
}
