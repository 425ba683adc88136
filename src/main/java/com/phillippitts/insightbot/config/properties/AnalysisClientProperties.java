package com.phillippitts.insightbot.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings for the remote analysis service.
 */
@Validated
@ConfigurationProperties(prefix = "insightbot.analysis")
public class AnalysisClientProperties {

    @NotBlank
    private final String baseUrl;

    @NotBlank
    private final String uploadBaseUrl;

    /** API key; blank disables analysis (every run ends in a transient error). */
    private final String apiKey;

    @NotBlank
    private final String model;

    @NotNull
    private final Duration connectTimeout;

    @NotNull
    private final Duration readTimeout;

    /** Status polls before an uploaded file that never became ACTIVE is given up. */
    @Min(1)
    private final int filePollAttempts;

    @NotNull
    private final Duration filePollInterval;

    private final boolean groundingEnabled;

    @ConstructorBinding
    public AnalysisClientProperties(String baseUrl,
                                    String uploadBaseUrl,
                                    String apiKey,
                                    String model,
                                    Duration connectTimeout,
                                    Duration readTimeout,
                                    Integer filePollAttempts,
                                    Duration filePollInterval,
                                    Boolean groundingEnabled) {
        this.baseUrl = baseUrl == null ? "https://generativelanguage.googleapis.com" : baseUrl;
        this.uploadBaseUrl = uploadBaseUrl == null ? this.baseUrl + "/upload" : uploadBaseUrl;
        this.apiKey = apiKey == null ? "" : apiKey;
        this.model = model == null ? "gemini-2.0-flash" : model;
        this.connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
        this.readTimeout = readTimeout == null ? Duration.ofSeconds(120) : readTimeout;
        this.filePollAttempts = filePollAttempts == null ? 30 : filePollAttempts;
        this.filePollInterval = filePollInterval == null ? Duration.ofSeconds(2) : filePollInterval;
        this.groundingEnabled = groundingEnabled == null || groundingEnabled;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getUploadBaseUrl() {
        return uploadBaseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public boolean isConfigured() {
        return !apiKey.isBlank();
    }

    public String getModel() {
        return model;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public int getFilePollAttempts() {
        return filePollAttempts;
    }

    public Duration getFilePollInterval() {
        return filePollInterval;
    }

    public boolean isGroundingEnabled() {
        return groundingEnabled;
    }
}
