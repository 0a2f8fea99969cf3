package com.phillippitts.voiceforge.util;

/** Utility for privacy-safe logging of transcript and reply previews. */
public final class LogSanitizer {

    private static final int DEFAULT_PREVIEW_CHARS = 40;

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
     * Short single-line preview with the original length, e.g. {@code "hello wor…" (27 chars)}.
     */
    public static String preview(String s) {
        if (s == null) {
            return "\"\" (0 chars)";
        }
        String oneLine = s.replace('\n', ' ').replace('\r', ' ');
        String head = truncate(oneLine, DEFAULT_PREVIEW_CHARS);
        String suffix = oneLine.length() > DEFAULT_PREVIEW_CHARS ? "…" : "";
        return "\"" + head + suffix + "\" (" + s.length() + " chars)";
    }
}
