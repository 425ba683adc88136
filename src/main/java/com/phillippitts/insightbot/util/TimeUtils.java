package com.phillippitts.insightbot.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Time helpers for elapsed-time logging and report timestamps.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    /** Minute-resolution UTC timestamp used in report titles. */
    private static final DateTimeFormatter REPORT_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private TimeUtils() {
    }

    /**
     * Calculates elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    public static String reportTimestamp(Instant instant) {
        return REPORT_TIMESTAMP.format(instant);
    }
}
