package com.phillippitts.insightbot.service.capture;

import com.phillippitts.insightbot.exception.VoiceCaptureException;

/**
 * Joins guild voice channels and streams per-speaker audio fragments to a sink.
 *
 * <p>At most one capture per guild may be open at a time.
 */
public interface VoiceCaptureService {

    /**
     * Joins the voice channel and starts delivering fragments to the sink.
     *
     * @param guildId        guild owning the channel
     * @param voiceChannelId channel to join
     * @param sink           receiver of fragments and speaker identification events
     * @return handle that must be closed to leave the channel
     * @throws VoiceCaptureException if the guild already has an open capture or the join fails
     */
    VoiceCaptureHandle join(long guildId, long voiceChannelId, AudioFrameSink sink);

    /**
     * @return true if a capture is currently open for the guild
     */
    boolean isJoined(long guildId);
}
