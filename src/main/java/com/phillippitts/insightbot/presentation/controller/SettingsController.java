package com.phillippitts.insightbot.presentation.controller;

import com.phillippitts.insightbot.domain.GuildSettings;
import com.phillippitts.insightbot.exception.InvalidSettingException;
import com.phillippitts.insightbot.presentation.dto.SettingsView;
import com.phillippitts.insightbot.presentation.dto.UpdateSettingsRequest;
import com.phillippitts.insightbot.service.settings.GuildSettingsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/guilds/{guildId}/settings")
class SettingsController {

    private final GuildSettingsService settingsService;

    SettingsController(GuildSettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping
    SettingsView get(@PathVariable long guildId) {
        return SettingsView.of(settingsService.getSettings(guildId));
    }

    /**
     * Applies the fields present in the request. A running session picks up a new interval
     * at its next cycle.
     */
    @PutMapping
    SettingsView update(@PathVariable long guildId, @RequestBody UpdateSettingsRequest request) {
        if (request.mode() == null && request.intervalSeconds() == null) {
            throw new InvalidSettingException("settings", "{}", "mode or intervalSeconds is required");
        }
        GuildSettings settings = null;
        if (request.mode() != null) {
            settings = settingsService.setMode(guildId, request.mode());
        }
        if (request.intervalSeconds() != null) {
            settings = settingsService.setInterval(guildId, request.intervalSeconds());
        }
        return SettingsView.of(settings);
    }
}
