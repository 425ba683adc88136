package com.phillippitts.insightbot.service.settings;

import com.phillippitts.insightbot.config.properties.SessionProperties;
import com.phillippitts.insightbot.domain.AnalysisMode;
import com.phillippitts.insightbot.domain.GuildSettings;
import com.phillippitts.insightbot.exception.InvalidSettingException;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Validated access to guild settings.
 */
@Service
public class GuildSettingsService {

    private final GuildSettingsStore store;
    private final SessionProperties properties;

    public GuildSettingsService(GuildSettingsStore store, SessionProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    public GuildSettings getSettings(long guildId) {
        return store.load(guildId);
    }

    /**
     * Sets the analysis mode.
     *
     * @param rawMode mode identifier, case-insensitive
     * @throws InvalidSettingException if the mode is unknown
     */
    public GuildSettings setMode(long guildId, String rawMode) {
        AnalysisMode mode = AnalysisMode.fromValue(rawMode).orElseThrow(() ->
                new InvalidSettingException("mode", rawMode, "expected one of " + Arrays.stream(AnalysisMode.values())
                        .map(AnalysisMode::value)
                        .collect(Collectors.joining(", "))));
        return store.save(store.load(guildId).withMode(mode));
    }

    /**
     * Sets the periodic analysis interval.
     *
     * @throws InvalidSettingException if the interval is outside the configured range
     */
    public GuildSettings setInterval(long guildId, long intervalSeconds) {
        long min = properties.getMinIntervalSeconds();
        long max = properties.getMaxIntervalSeconds();
        if (intervalSeconds < min || intervalSeconds > max) {
            throw new InvalidSettingException("intervalSeconds", String.valueOf(intervalSeconds),
                    "must be between " + min + " and " + max + " seconds");
        }
        return store.save(store.load(guildId).withIntervalSeconds(intervalSeconds));
    }
}
