package com.phillippitts.insightbot.exception;

/**
 * Thrown when an operation targets a guild without an active recording session.
 */
public class SessionNotFoundException extends InsightBotException {

    private final long guildId;

    public SessionNotFoundException(long guildId) {
        super("No recording session is active for guild " + guildId);
        this.guildId = guildId;
    }

    public long getGuildId() {
        return guildId;
    }
}
