package com.modsearch.core.query;

import com.modsearch.core.error.ModSearchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Translates a typed query such as {@code "trajectory +neoforge +mod +v1.21.1 -serversupported /follows"}
 * into a {@link CompiledQuery}.
 * <p>
 * Words starting with {@code +} or {@code -} are filters, a word starting with {@code /} is the sort rule,
 * everything else is free text. Inclusive filters of one category are OR-ed together; every exclusive filter
 * becomes its own AND group.
 */
public class QueryCompiler {
    private static final Logger logger = LoggerFactory.getLogger(QueryCompiler.class);

    private final int pageSize;

    public QueryCompiler(int pageSize) {
        if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be > 0");
        this.pageSize = pageSize;
    }

    public int getPageSize() {
        return pageSize;
    }

    public CompiledQuery compile(String rawQuery, int pageIndex) throws ModSearchException {
        try {
            return doCompile(rawQuery == null ? "" : rawQuery, pageIndex);
        } catch (ModSearchException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected failure compiling query '{}'", rawQuery, e);
            throw ModSearchException.internal("Failed to compile query: " + e.getMessage(), e);
        }
    }

    private CompiledQuery doCompile(String rawQuery, int pageIndex) throws ModSearchException {
        List<String> textWords = new ArrayList<>();
        List<String> filterWords = new ArrayList<>();
        List<String> sortWords = new ArrayList<>();

        for (String word : rawQuery.strip().split("\\s+")) {
            if (word.isEmpty()) continue;
            if (word.startsWith("+") || word.startsWith("-")) {
                filterWords.add(word);
            } else if (word.startsWith("/")) {
                sortWords.add(word);
            } else {
                textWords.add(word);
            }
        }

        if (sortWords.size() > 1) {
            throw ModSearchException.userInput("More than 1 sorting rule found: " + String.join(" ", sortWords));
        }
        SortDirective sort = sortWords.isEmpty() ? null : SortDirective.fromName(sortWords.get(0).substring(1));

        Map<FilterCategory, List<String>> orGroups = new EnumMap<>(FilterCategory.class);
        for (FilterCategory category : FilterCategory.values()) {
            orGroups.put(category, new ArrayList<>());
        }
        List<List<String>> exclusions = new ArrayList<>();

        for (String word : filterWords) {
            FilterToken token = FilterVocabulary.resolve(word);
            FilterCategory category = FilterVocabulary.categoryOf(token);
            if (token.inclusive()) {
                orGroups.get(category).add(token.clause());
            } else {
                exclusions.add(List.of(token.clause()));
            }
        }

        List<List<String>> groups = new ArrayList<>();
        for (List<String> group : orGroups.values()) {
            if (!group.isEmpty()) groups.add(group);
        }
        groups.addAll(exclusions);

        CompiledQuery query = new CompiledQuery(String.join(" ", textWords), groups, sort, pageIndex, pageSize);
        logger.debug("Compiled '{}' -> term='{}', groups={}, sort={}, offset={}",
                rawQuery, query.term(), query.clauseGroups(), sort, query.offset());
        return query;
    }
}
