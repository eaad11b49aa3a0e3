package com.modsearch.core.query;

/**
 * A filter word after it was resolved against the vocabulary.
 *
 * @param raw       the word as typed, sign included
 * @param inclusive true for {@code +}, false for {@code -}
 * @param attribute the word minus its sign, or the single type character for parametric filters
 * @param argument  the suffix of a parametric filter, null for exact filters
 * @param clause    the clause string sent to the API
 */
public record FilterToken(
    String raw,
    boolean inclusive,
    String attribute,
    String argument,
    String clause
) {
    public boolean isParametric() {
        return argument != null;
    }
}
