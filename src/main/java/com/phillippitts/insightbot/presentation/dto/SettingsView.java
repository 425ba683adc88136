package com.phillippitts.insightbot.presentation.dto;

import com.phillippitts.insightbot.domain.GuildSettings;

public record SettingsView(long guildId, String mode, long intervalSeconds) {

    public static SettingsView of(GuildSettings settings) {
        return new SettingsView(settings.guildId(), settings.mode().value(), settings.intervalSeconds());
    }
}
