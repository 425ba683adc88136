package com.phillippitts.insightbot.service.capture;

/**
 * Ownership token for a joined voice channel. Closing the handle leaves the channel and
 * stops event delivery to the sink. Closing twice is a no-op.
 */
public interface VoiceCaptureHandle extends AutoCloseable {

    long guildId();

    long voiceChannelId();

    boolean isOpen();

    @Override
    void close();
}
