package com.modsearch.core.query;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A query ready to be sent: free text, clause groups, optional sort rule and the page to fetch.
 * <p>
 * The outer list of {@code clauseGroups} is AND-ed, each inner list is OR-ed. No group is empty.
 */
public record CompiledQuery(
    String term,
    List<List<String>> clauseGroups,
    SortDirective sort,     // null when the query carried no sort word
    int pageIndex,
    int pageSize
) {
    private static final Gson FACET_GSON = new GsonBuilder().disableHtmlEscaping().create();

    public CompiledQuery {
        List<List<String>> groups = new ArrayList<>(clauseGroups.size());
        for (List<String> group : clauseGroups) {
            if (group.isEmpty()) {
                throw new IllegalArgumentException("Clause groups must not be empty");
            }
            groups.add(List.copyOf(group));
        }
        clauseGroups = List.copyOf(groups);
        if (pageIndex < 0) throw new IllegalArgumentException("pageIndex must be >= 0");
        if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be > 0");
    }

    public int offset() {
        return pageIndex * pageSize;
    }

    public Optional<SortDirective> sortDirective() {
        return Optional.ofNullable(sort);
    }

    /**
     * JSON array-of-arrays for the {@code facets} parameter, or empty when there are no clauses.
     */
    public Optional<String> facetsJson() {
        if (clauseGroups.isEmpty()) return Optional.empty();
        return Optional.of(FACET_GSON.toJson(clauseGroups));
    }

    /**
     * Same free text, clauses and sort rule for another page.
     */
    public CompiledQuery atPage(int newPageIndex) {
        return new CompiledQuery(term, clauseGroups, sort, newPageIndex, pageSize);
    }
}
