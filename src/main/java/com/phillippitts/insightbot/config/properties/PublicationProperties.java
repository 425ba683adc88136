package com.phillippitts.insightbot.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for posting reports to the messaging channel.
 */
@Validated
@ConfigurationProperties(prefix = "insightbot.publication")
public class PublicationProperties {

    @NotBlank
    private final String baseUrl;

    private final String botToken;

    /** Largest text a single message may carry. */
    @Min(2)
    private final int messageLimit;

    /** Body chunk size used when header and body do not fit one message. */
    @Min(1)
    private final int chunkSize;

    @Min(60)
    private final int threadAutoArchiveMinutes;

    @ConstructorBinding
    public PublicationProperties(String baseUrl,
                                 String botToken,
                                 Integer messageLimit,
                                 Integer chunkSize,
                                 Integer threadAutoArchiveMinutes) {
        this.baseUrl = baseUrl == null ? "https://discord.com/api/v10" : baseUrl;
        this.botToken = botToken == null ? "" : botToken;
        this.messageLimit = messageLimit == null ? 2000 : messageLimit;
        this.chunkSize = chunkSize == null ? 1900 : chunkSize;
        this.threadAutoArchiveMinutes = threadAutoArchiveMinutes == null ? 60 : threadAutoArchiveMinutes;
        if (this.chunkSize >= this.messageLimit) {
            throw new IllegalArgumentException("insightbot.publication.chunk-size (" + this.chunkSize
                    + ") must be below message-limit (" + this.messageLimit + ")");
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getBotToken() {
        return botToken;
    }

    public int getMessageLimit() {
        return messageLimit;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getThreadAutoArchiveMinutes() {
        return threadAutoArchiveMinutes;
    }
}
