package com.modsearch.common.util;

import java.util.Locale;

/**
 * Formatting helpers for the console listings.
 */
public final class TextUtils {
    public static final String ELLIPSIS = "…";

    private TextUtils() {
    }

    /**
     * Cuts text to {@code width} characters, marking the cut with an ellipsis.
     * Shorter text is right-padded with spaces when {@code pad} is set.
     */
    public static String truncate(String text, int width, boolean pad) {
        if (text == null) text = "";
        if (width <= 0) return "";
        if (text.length() <= width) {
            return pad ? String.format("%-" + width + "s", text) : text;
        }
        return text.substring(0, width - 1) + ELLIPSIS;
    }

    public static String truncate(String text, int width) {
        return truncate(text, width, true);
    }

    public static String capitalize(String text) {
        if (text == null || text.isEmpty()) return "";
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    public static String formatCount(long value) {
        return String.format(Locale.ROOT, "%,d", value);
    }

    public static String formatBytes(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format(Locale.ROOT, "%.1f KiB", bytes / 1024.0);
        return String.format(Locale.ROOT, "%.1f MiB", bytes / (1024.0 * 1024.0));
    }
}
