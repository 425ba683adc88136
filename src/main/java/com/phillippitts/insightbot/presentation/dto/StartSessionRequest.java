package com.phillippitts.insightbot.presentation.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request to start recording a guild.
 *
 * @param textChannelId  channel reports are published to
 * @param voiceChannelId voice channel to record
 */
public record StartSessionRequest(@NotNull @Positive Long textChannelId,
                                  @NotNull @Positive Long voiceChannelId) {
}
