package com.phillippitts.insightbot.service.settings;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "guild_settings")
public class GuildSettingsEntity {

    @Id
    @Column(name = "guild_id", nullable = false, updatable = false)
    private Long guildId;

    @Column(name = "analysis_mode", nullable = false)
    private String analysisMode;

    @Column(name = "recording_interval", nullable = false)
    private Long recordingInterval;

    protected GuildSettingsEntity() {
    }

    public static GuildSettingsEntity of(long guildId, String analysisMode, long recordingInterval) {
        GuildSettingsEntity entity = new GuildSettingsEntity();
        entity.guildId = guildId;
        entity.analysisMode = analysisMode;
        entity.recordingInterval = recordingInterval;
        return entity;
    }

    public Long getGuildId() {
        return guildId;
    }

    public String getAnalysisMode() {
        return analysisMode;
    }

    public void setAnalysisMode(String analysisMode) {
        this.analysisMode = analysisMode;
    }

    public Long getRecordingInterval() {
        return recordingInterval;
    }

    public void setRecordingInterval(Long recordingInterval) {
        this.recordingInterval = recordingInterval;
    }
}
