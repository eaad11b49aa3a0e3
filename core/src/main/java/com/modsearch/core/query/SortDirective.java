package com.modsearch.core.query;

import com.modsearch.core.error.ModSearchException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Sort rules accepted after a {@code /}. Results are always sorted in descending order.
 */
public enum SortDirective {
    RELEVANCE("relevance"),
    DOWNLOADS("downloads"),
    FOLLOWS("follows"),
    NEWEST("newest"),
    UPDATED("updated");

    private final String indexName;

    SortDirective(String indexName) {
        this.indexName = indexName;
    }

    /**
     * Value of the {@code index} request parameter.
     */
    public String getIndexName() {
        return indexName;
    }

    public static SortDirective fromName(String name) throws ModSearchException {
        for (SortDirective sort : values()) {
            if (sort.indexName.equals(name)) return sort;
        }
        throw ModSearchException.userInput("Invalid sorting rule \"" + name + "\"!\nValid rules: " + validNames());
    }

    public static String validNames() {
        return Arrays.stream(values()).map(SortDirective::getIndexName).collect(Collectors.joining(", "));
    }
}
