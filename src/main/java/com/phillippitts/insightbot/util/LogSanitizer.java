package com.phillippitts.insightbot.util;

/** Utility for privacy-safe logging of report and name previews. */
public final class LogSanitizer {

    private static final int DEFAULT_PREVIEW_CHARS = 80;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview of a report for log output: newlines are flattened and the text
     * is cut to a short prefix followed by the original length.
     */
    public static String preview(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        String flat = truncate(s, DEFAULT_PREVIEW_CHARS).replace('\n', ' ').replace('\r', ' ');
        return s.length() <= DEFAULT_PREVIEW_CHARS ? flat : flat + "... (" + s.length() + " chars)";
    }
}
