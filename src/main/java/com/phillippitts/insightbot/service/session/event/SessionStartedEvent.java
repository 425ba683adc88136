package com.phillippitts.insightbot.service.session.event;

import java.time.Instant;

/**
 * Emitted when a guild session has joined voice and its periodic loop is running.
 *
 * @param guildId        guild of the session
 * @param textChannelId  channel reports are published to
 * @param voiceChannelId recorded voice channel
 * @param startedAt      session start time
 */
public record SessionStartedEvent(long guildId, long textChannelId, long voiceChannelId, Instant startedAt) {
}
