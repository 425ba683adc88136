package com.phillippitts.insightbot.service.capture;

/**
 * Receiver of capture events for one joined voice channel.
 *
 * <p>Implementations must be thread-safe: fragments for different speakers arrive on
 * arbitrary threads, roughly every 20 ms per active speaker.
 */
public interface AudioFrameSink {

    /**
     * Delivers one encoded audio fragment.
     *
     * @param speakerId ephemeral per-connection speaker stream id
     * @param fragment  raw encoded bytes
     */
    void onFragment(long speakerId, byte[] fragment);

    /**
     * Associates a speaker stream id with a human-readable name once the capture layer has
     * resolved it.
     */
    void onSpeakerIdentified(long speakerId, String displayName);
}
