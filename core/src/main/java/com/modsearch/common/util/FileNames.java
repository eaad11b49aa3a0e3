package com.modsearch.common.util;

/**
 * Helpers for turning server-provided names into safe local file names.
 */
public final class FileNames {

    private FileNames() {
    }

    /**
     * Strips every directory component ({@code /} or {@code \}) and returns the last one.
     */
    public static String basename(String name) {
        if (name == null) return "";
        String trimmed = name.strip();
        int cut = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        String base = cut >= 0 ? trimmed.substring(cut + 1) : trimmed;
        if (base.equals(".") || base.equals("..")) return "";
        return base;
    }

    /**
     * Makes a slug usable as a single directory name.
     */
    public static String sanitize(String name) {
        String cleaned = name.replaceAll("[^a-zA-Z0-9._-]", "_");
        if (cleaned.isEmpty() || cleaned.equals(".") || cleaned.equals("..")) return "_";
        return cleaned;
    }
}
