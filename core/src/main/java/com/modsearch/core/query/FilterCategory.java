package com.modsearch.core.query;

/**
 * Buckets that group related filter clauses. Declaration order is the order in which
 * category groups are sent to the API.
 */
public enum FilterCategory {
    PROJECT_KIND,
    LOADER,
    PLATFORM,
    VERSION,
    TAG
}
