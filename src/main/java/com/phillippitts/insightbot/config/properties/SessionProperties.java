package com.phillippitts.insightbot.config.properties;

import com.phillippitts.insightbot.domain.AnalysisMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Typed properties for guild recording sessions.
 */
@Validated
@ConfigurationProperties(prefix = "insightbot.session")
public class SessionProperties {

    public static final int DEFAULT_CONTEXT_WINDOW_CHARS = 2000;
    public static final long DEFAULT_INTERVAL_SECONDS = 300;
    public static final long DEFAULT_MIN_INTERVAL_SECONDS = 60;
    public static final long DEFAULT_MAX_INTERVAL_SECONDS = 3600;

    /** Directory for transient per-speaker audio files. */
    @NotNull
    private final Path tempAudioDir;

    /** Trailing characters of the last report kept as context for the next analysis. */
    @Min(1)
    private final int contextWindowChars;

    /** How long a stop waits for the periodic loop to terminate. */
    @NotNull
    private final Duration stopGrace;

    @Min(1)
    private final long defaultIntervalSeconds;

    @NotNull
    private final AnalysisMode defaultMode;

    @Min(1)
    private final long minIntervalSeconds;

    @Min(1)
    private final long maxIntervalSeconds;

    @ConstructorBinding
    public SessionProperties(Path tempAudioDir,
                             Integer contextWindowChars,
                             Duration stopGrace,
                             Long defaultIntervalSeconds,
                             AnalysisMode defaultMode,
                             Long minIntervalSeconds,
                             Long maxIntervalSeconds) {
        this.tempAudioDir = tempAudioDir == null
                ? Path.of(System.getProperty("java.io.tmpdir"), "insightbot-audio")
                : tempAudioDir;
        this.contextWindowChars = contextWindowChars == null ? DEFAULT_CONTEXT_WINDOW_CHARS : contextWindowChars;
        this.stopGrace = stopGrace == null ? Duration.ofSeconds(10) : stopGrace;
        this.defaultIntervalSeconds = defaultIntervalSeconds == null ? DEFAULT_INTERVAL_SECONDS : defaultIntervalSeconds;
        this.defaultMode = defaultMode == null ? AnalysisMode.DEBATE : defaultMode;
        this.minIntervalSeconds = minIntervalSeconds == null ? DEFAULT_MIN_INTERVAL_SECONDS : minIntervalSeconds;
        this.maxIntervalSeconds = maxIntervalSeconds == null ? DEFAULT_MAX_INTERVAL_SECONDS : maxIntervalSeconds;
        if (this.minIntervalSeconds > this.maxIntervalSeconds) {
            throw new IllegalArgumentException("insightbot.session.min-interval-seconds ("
                    + this.minIntervalSeconds + ") must not exceed max-interval-seconds (" + this.maxIntervalSeconds + ")");
        }
    }

    /**
     * Defaults for everything except the audio directory (tests).
     */
    public SessionProperties(Path tempAudioDir) {
        this(tempAudioDir, null, null, null, null, null, null);
    }

    public Path getTempAudioDir() {
        return tempAudioDir;
    }

    public int getContextWindowChars() {
        return contextWindowChars;
    }

    public Duration getStopGrace() {
        return stopGrace;
    }

    public long getDefaultIntervalSeconds() {
        return defaultIntervalSeconds;
    }

    public AnalysisMode getDefaultMode() {
        return defaultMode;
    }

    public long getMinIntervalSeconds() {
        return minIntervalSeconds;
    }

    public long getMaxIntervalSeconds() {
        return maxIntervalSeconds;
    }
}
