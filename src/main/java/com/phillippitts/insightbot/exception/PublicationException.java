package com.phillippitts.insightbot.exception;

/**
 * Thrown when a report message, thread or chunk cannot be delivered to the messaging channel.
 */
public class PublicationException extends InsightBotException {

    private final long channelId;

    public PublicationException(String message, long channelId) {
        super(message + " (channel: " + channelId + ")");
        this.channelId = channelId;
    }

    public PublicationException(String message, long channelId, Throwable cause) {
        super(message + " (channel: " + channelId + ")", cause);
        this.channelId = channelId;
    }

    public long getChannelId() {
        return channelId;
    }
}
