package com.phillippitts.interviewpilot.util;

import java.util.regex.Pattern;

/** Utility for privacy-safe logging of candidate and question text. */
public final class LogSanitizer {

    private static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@[\\w-]+(\\.[\\w-]+)+");
    private static final Pattern DIGITS = Pattern.compile("\\d{4,}");

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
     * Masks e-mail addresses and long digit runs, then truncates. For DEBUG previews only.
     */
    public static String preview(String s, int max) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        String masked = DIGITS.matcher(EMAIL.matcher(s).replaceAll("<email>")).replaceAll("<number>");
        return truncate(masked, max);
    }
}
