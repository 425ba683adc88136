package com.phillippitts.insightbot.service.settings;

import com.phillippitts.insightbot.config.properties.SessionProperties;
import com.phillippitts.insightbot.domain.AnalysisMode;
import com.phillippitts.insightbot.domain.GuildSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link GuildSettingsStore} backed by the {@code guild_settings} table.
 *
 * <p>Rows are created lazily on the first update; a guild without a row gets the configured
 * defaults. A stored mode that no longer parses falls back to the default mode.
 */
@Component
public class JpaGuildSettingsStore implements GuildSettingsStore {

    private static final Logger LOG = LogManager.getLogger(JpaGuildSettingsStore.class);

    private final GuildSettingsRepository repository;
    private final SessionProperties properties;

    public JpaGuildSettingsStore(GuildSettingsRepository repository, SessionProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    @Override
    @Transactional(readOnly = true)
    public GuildSettings load(long guildId) {
        return repository.findById(guildId)
            .map(this::toDomain)
            .orElseGet(() -> defaults(guildId));
    }

    @Override
    @Transactional
    public GuildSettings save(GuildSettings settings) {
        GuildSettingsEntity entity = repository.findById(settings.guildId())
            .orElseGet(() -> GuildSettingsEntity.of(settings.guildId(), settings.mode().value(),
                settings.intervalSeconds()));
        entity.setAnalysisMode(settings.mode().value());
        entity.setRecordingInterval(settings.intervalSeconds());
        repository.save(entity);
        LOG.info("Saved settings for guild {}: mode={}, interval={}s",
            settings.guildId(), settings.mode().value(), settings.intervalSeconds());
        return settings;
    }

    private GuildSettings defaults(long guildId) {
        return new GuildSettings(guildId, properties.getDefaultMode(), properties.getDefaultIntervalSeconds());
    }

    private GuildSettings toDomain(GuildSettingsEntity entity) {
        AnalysisMode mode = AnalysisMode.fromValue(entity.getAnalysisMode()).orElseGet(() -> {
            LOG.warn("Unknown stored analysis mode '{}' for guild {}, using {}",
                entity.getAnalysisMode(), entity.getGuildId(), properties.getDefaultMode().value());
            return properties.getDefaultMode();
        });
        long interval = entity.getRecordingInterval() == null || entity.getRecordingInterval() <= 0
            ? properties.getDefaultIntervalSeconds()
            : entity.getRecordingInterval();
        return new GuildSettings(entity.getGuildId(), mode, interval);
    }
}
