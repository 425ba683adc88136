package com.phillippitts.insightbot.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateHandlesNullAndShortInput() {
        assertThat(LogSanitizer.truncate(null, 5)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 5)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("abc", 0)).isEmpty();
    }

    @Test
    void previewFlattensNewlines() {
        assertThat(LogSanitizer.preview("line1\nline2")).isEqualTo("line1 line2");
    }

    @Test
    void previewOfLongTextReportsLength() {
        String preview = LogSanitizer.preview("x".repeat(200));

        assertThat(preview).startsWith("x".repeat(80)).endsWith("(200 chars)");
    }

    @Test
    void reportTimestampIsUtcMinutes() {
        assertThat(TimeUtils.reportTimestamp(Instant.parse("2024-12-31T23:59:59Z"))).isEqualTo("2024-12-31 23:59");
    }

    @Test
    void elapsedMillisIsNonNegative() {
        assertThat(TimeUtils.elapsedMillis(System.nanoTime())).isGreaterThanOrEqualTo(0);
    }
}
