package com.modsearch.core.release;

import com.modsearch.core.query.FilterVocabulary;

import java.util.Optional;

/**
 * A shorthand such as {@code "1.20.1 fabric"}, {@code "v1.21"} or {@code "neoforge"} that selects a
 * release by constraint instead of by index.
 * <p>
 * A version word either starts with {@code v} followed by a digit (the {@code v} is dropped) or starts with
 * a digit and is not a plain number, so that {@code "3"} stays a list index. A loader word is an exact loader
 * name. At most one of each is allowed and at least one must be present.
 */
public record QuickDownloadRequest(String version, String loader) {

    public static final char VERSION_PREFIX = 'v';

    public QuickDownloadRequest {
        if (version == null && loader == null) {
            throw new IllegalArgumentException("version or loader required");
        }
    }

    public static Optional<QuickDownloadRequest> parse(String input) {
        if (input == null || input.isBlank()) return Optional.empty();

        String version = null;
        String loader = null;
        for (String word : input.strip().split("\\s+")) {
            if (FilterVocabulary.isLoader(word)) {
                if (loader != null) return Optional.empty();
                loader = word;
                continue;
            }
            String parsedVersion = versionOf(word);
            if (parsedVersion == null || version != null) return Optional.empty();
            version = parsedVersion;
        }
        return Optional.of(new QuickDownloadRequest(version, loader));
    }

    private static String versionOf(String word) {
        if (word.length() > 1 && word.charAt(0) == VERSION_PREFIX && Character.isDigit(word.charAt(1))) {
            return word.substring(1);
        }
        if (Character.isDigit(word.charAt(0)) && !word.chars().allMatch(Character::isDigit)) {
            return word;
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (version != null) sb.append(version);
        if (loader != null) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(loader);
        }
        return sb.toString();
    }
}
