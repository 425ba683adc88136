package com.phillippitts.insightbot.service.settings;

import com.phillippitts.insightbot.domain.GuildSettings;

/**
 * Persistent per-guild settings.
 *
 * <p>Implementations must be safe for concurrent use; the periodic loops of many guilds read
 * from the store while operators update it.
 */
public interface GuildSettingsStore {

    /**
     * @return the stored settings, or the configured defaults if the guild has none
     */
    GuildSettings load(long guildId);

    /**
     * Inserts or replaces the guild's settings.
     */
    GuildSettings save(GuildSettings settings);
}
