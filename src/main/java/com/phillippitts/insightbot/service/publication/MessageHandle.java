package com.phillippitts.insightbot.service.publication;

/**
 * A posted message.
 *
 * @param channelId channel the message was posted to
 * @param messageId platform message id
 */
public record MessageHandle(long channelId, long messageId) {
}
