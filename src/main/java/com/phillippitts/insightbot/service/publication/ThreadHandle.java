package com.phillippitts.insightbot.service.publication;

/**
 * A sub-thread opened from a posted message.
 *
 * @param threadId platform channel id of the thread
 * @param name     thread title
 */
public record ThreadHandle(long threadId, String name) {
}
