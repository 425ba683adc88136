package com.phillippitts.insightbot.service.publication;

import com.phillippitts.insightbot.exception.PublicationException;

/**
 * Messaging surface used to publish analysis reports.
 *
 * <p>Every method throws {@link PublicationException} when the platform rejects the call.
 * Text passed to any method must not exceed {@link #messageLimit()}.
 */
public interface ReportPublisher {

    MessageHandle postMessage(long channelId, String text);

    ThreadHandle createThread(MessageHandle message, String title);

    void sendToThread(ThreadHandle thread, String text);

    /** Largest text a single message may carry. */
    int messageLimit();
}
