package com.modsearch.common.model;

/**
 * Release stability, ordered from least to most mature.
 */
public enum Maturity {
    DRAFT("alpha"),
    BETA("beta"),
    STABLE("release");

    private final String wireName;

    Maturity(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isHigherThan(Maturity other) {
        return compareTo(other) > 0;
    }

    /**
     * Maps the API's {@code version_type} value.
     *
     * @throws IllegalArgumentException for an unknown value
     */
    public static Maturity fromWireName(String value) {
        for (Maturity m : values()) {
            if (m.wireName.equals(value)) return m;
        }
        throw new IllegalArgumentException("Unknown release type: " + value);
    }
}
