package com.phillippitts.insightbot.domain;

import java.util.Objects;

/**
 * Per-guild analysis settings.
 *
 * @param guildId         guild the settings belong to
 * @param mode            analysis prompt mode
 * @param intervalSeconds seconds between periodic analyses
 */
public record GuildSettings(long guildId, AnalysisMode mode, long intervalSeconds) {

    public GuildSettings {
        Objects.requireNonNull(mode, "mode must not be null");
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("intervalSeconds must be positive, got: " + intervalSeconds);
        }
    }

    public GuildSettings withMode(AnalysisMode newMode) {
        return new GuildSettings(guildId, newMode, intervalSeconds);
    }

    public GuildSettings withIntervalSeconds(long seconds) {
        return new GuildSettings(guildId, mode, seconds);
    }
}
