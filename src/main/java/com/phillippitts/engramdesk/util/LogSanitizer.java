package com.phillippitts.engramdesk.util;

/** Utility for bounded logging of worker output. */
public final class LogSanitizer {
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
     * Trims trailing whitespace (including a stray carriage return) and truncates to max characters.
     */
    public static String line(String s, int max) {
        if (s == null) {
            return "";
        }
        return truncate(s.stripTrailing(), max);
    }
}
