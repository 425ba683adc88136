package com.phillippitts.insightbot.service.capture;

import com.phillippitts.insightbot.exception.VoiceCaptureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Voice capture backed by an external capture bridge.
 *
 * <p>The bridge process holds the actual voice connection and pushes fragments and speaker
 * identification events through the REST surface. This service routes each pushed event to the
 * sink registered for the guild. Events for guilds without an open capture are rejected, so
 * nothing is buffered after a session released its handle.
 */
@Service
public class BridgedVoiceCaptureService implements VoiceCaptureService {

    private static final Logger LOG = LogManager.getLogger(BridgedVoiceCaptureService.class);

    private final ConcurrentMap<Long, BridgeHandle> captures = new ConcurrentHashMap<>();

    @Override
    public VoiceCaptureHandle join(long guildId, long voiceChannelId, AudioFrameSink sink) {
        Objects.requireNonNull(sink, "sink must not be null");
        BridgeHandle handle = new BridgeHandle(guildId, voiceChannelId, sink);
        BridgeHandle existing = captures.putIfAbsent(guildId, handle);
        if (existing != null) {
            throw new VoiceCaptureException("Guild " + guildId + " is already connected to voice channel "
                    + existing.voiceChannelId());
        }
        LOG.info("Voice capture opened: guild={}, channel={}", guildId, voiceChannelId);
        return handle;
    }

    @Override
    public boolean isJoined(long guildId) {
        return captures.containsKey(guildId);
    }

    /**
     * Routes a fragment pushed by the bridge.
     *
     * @return false if the guild has no open capture
     */
    public boolean deliverFragment(long guildId, long speakerId, byte[] fragment) {
        BridgeHandle handle = captures.get(guildId);
        if (handle == null) {
            LOG.debug("Dropping fragment for guild {} without open capture", guildId);
            return false;
        }
        handle.sink.onFragment(speakerId, fragment);
        return true;
    }

    /**
     * Routes a speaker identification pushed by the bridge.
     *
     * @return false if the guild has no open capture
     */
    public boolean identifySpeaker(long guildId, long speakerId, String displayName) {
        BridgeHandle handle = captures.get(guildId);
        if (handle == null) {
            return false;
        }
        handle.sink.onSpeakerIdentified(speakerId, displayName);
        return true;
    }

    private final class BridgeHandle implements VoiceCaptureHandle {

        private final long guildId;
        private final long voiceChannelId;
        private final AudioFrameSink sink;
        private final AtomicBoolean open = new AtomicBoolean(true);

        private BridgeHandle(long guildId, long voiceChannelId, AudioFrameSink sink) {
            this.guildId = guildId;
            this.voiceChannelId = voiceChannelId;
            this.sink = sink;
        }

        @Override
        public long guildId() {
            return guildId;
        }

        @Override
        public long voiceChannelId() {
            return voiceChannelId;
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }

        @Override
        public void close() {
            if (open.compareAndSet(true, false)) {
                captures.remove(guildId, this);
                LOG.info("Voice capture closed: guild={}, channel={}", guildId, voiceChannelId);
            }
        }
    }
}
