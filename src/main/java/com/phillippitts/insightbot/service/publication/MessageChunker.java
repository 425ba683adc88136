package com.phillippitts.insightbot.service.publication;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits report text into messages that fit the platform's size limit.
 *
 * <p>Chunks are cut at fixed offsets without regard for words or lines, except that a cut
 * never falls between the two halves of a surrogate pair. Concatenating the chunks yields the
 * original text exactly.
 *
 * <p>Thread-safe: All methods are static and stateless.
 */
public final class MessageChunker {

    private MessageChunker() {
    }

    /**
     * Splits text into chunks of at most {@code chunkSize} chars.
     *
     * @return chunks in order; empty for empty text
     */
    public static List<String> chunk(String text, int chunkSize) {
        Objects.requireNonNull(text, "text must not be null");
        if (chunkSize < 2) {
            throw new IllegalArgumentException("chunkSize must be at least 2, got: " + chunkSize);
        }
        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(start + chunkSize, text.length());
            if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))
                    && Character.isLowSurrogate(text.charAt(end))) {
                end--;
            }
            chunks.add(text.substring(start, end));
            start = end;
        }
        return chunks;
    }

    /**
     * Lays out a header and body as the messages to send.
     *
     * <p>If header and body together fit one message they are sent as one. Otherwise the header
     * is sent alone, followed by the body in chunks of {@code chunkSize}.
     *
     * @param header       leading text, sent first
     * @param body         report body
     * @param messageLimit platform single-message limit
     * @param chunkSize    body chunk size, below {@code messageLimit}
     * @return messages in send order
     */
    public static List<String> layout(String header, String body, int messageLimit, int chunkSize) {
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(body, "body must not be null");
        if (chunkSize >= messageLimit) {
            throw new IllegalArgumentException("chunkSize (" + chunkSize + ") must be below messageLimit ("
                    + messageLimit + ")");
        }
        if (header.length() + body.length() <= messageLimit) {
            return List.of(header + body);
        }
        List<String> messages = new ArrayList<>();
        messages.add(header);
        messages.addAll(chunk(body, chunkSize));
        return messages;
    }
}
