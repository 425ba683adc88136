package com.phillippitts.insightbot.service.settings;

import com.phillippitts.insightbot.config.properties.SessionProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Reads the interval from the guild's stored settings.
 *
 * <p>If the store cannot be read the default interval is used, so a database outage slows
 * nothing down and never stops a running loop.
 */
@Component
public class SettingsIntervalPolicy implements AnalysisIntervalPolicy {

    private static final Logger LOG = LogManager.getLogger(SettingsIntervalPolicy.class);

    private final GuildSettingsStore store;
    private final SessionProperties properties;

    public SettingsIntervalPolicy(GuildSettingsStore store, SessionProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    @Override
    public Duration currentInterval(long guildId) {
        try {
            return Duration.ofSeconds(store.load(guildId).intervalSeconds());
        } catch (RuntimeException e) {
            LOG.warn("Failed to read interval for guild {}, using default {}s: {}",
                    guildId, properties.getDefaultIntervalSeconds(), e.getMessage());
            return Duration.ofSeconds(properties.getDefaultIntervalSeconds());
        }
    }
}
