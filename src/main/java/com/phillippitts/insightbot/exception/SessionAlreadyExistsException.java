package com.phillippitts.insightbot.exception;

/**
 * Thrown when a recording session is requested for a guild that already has one.
 * Two concurrent start requests for the same guild produce exactly one session and one of these.
 */
public class SessionAlreadyExistsException extends InsightBotException {

    private final long guildId;

    public SessionAlreadyExistsException(long guildId) {
        super("A recording session is already active for guild " + guildId);
        this.guildId = guildId;
    }

    public long getGuildId() {
        return guildId;
    }
}
