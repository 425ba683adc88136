package com.phillippitts.insightbot.presentation.dto;

import com.phillippitts.insightbot.service.session.GuildSession;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Snapshot of a live session for the REST surface.
 */
public record SessionView(
        long guildId,
        boolean active,
        long textChannelId,
        long voiceChannelId,
        Instant startedAt,
        boolean captureOpen,
        Map<Long, String> speakers,
        Set<Long> bufferedSpeakers,
        long bufferedBytes
) {

    public static SessionView of(GuildSession session) {
        return new SessionView(
                session.guildId(),
                session.isActive(),
                session.textChannelId(),
                session.voiceChannelId(),
                session.startedAt(),
                session.hasOpenCapture(),
                session.displayNames(),
                session.recorder().bufferedSpeakers(),
                session.recorder().bufferedBytes());
    }
}
