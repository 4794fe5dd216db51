package com.phillippitts.ttsbatch.util;

/** Utility for privacy-safe logging of text previews. */
public final class LogSanitizer {

    /** Preview length used when logging request text. */
    public static final int TEXT_PREVIEW_CHARS = 50;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Request-text preview with line breaks flattened so one request stays on one log line.
     */
    public static String preview(String text) {
        return truncate(text, TEXT_PREVIEW_CHARS).replace('\n', ' ').replace('\r', ' ');
    }
}
