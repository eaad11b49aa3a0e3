package com.modsearch.core.query;

import com.modsearch.core.error.ModSearchException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Static tables mapping filter words to API clause strings.
 * <p>
 * Exact filters are looked up verbatim (case-sensitive). Parametric filters are recognised by their
 * two-character prefix ({@code +v}, {@code -v}, {@code +t}, {@code -t}); the rest of the word is the argument.
 */
public final class FilterVocabulary {

    public static final int PARAMETRIC_PREFIX_LENGTH = 2;

    public static final List<String> LOADERS = List.of(
            "bukkit", "bungeecord", "canvas", "fabric", "folia", "forge", "iris", "liteloader", "modloader",
            "neoforge", "optifine", "paper", "purpur", "quilt", "rift", "spigot", "sponge",
            "vanilla", // shaders
            "velocity", "waterfall");

    private static final Map<String, String> PROJECT_KINDS = orderedMap(
            "mod", "mod",
            "resourcepack", "resourcepack",
            "rp", "resourcepack",
            "datapack", "datapack",
            "dp", "datapack",
            "modpack", "modpack",
            "mp", "modpack",
            "plugin", "plugin",
            "shader", "shader");

    private static final Map<String, String> EXACT;
    private static final Map<String, UnaryOperator<String>> PARAMETRIC;
    private static final Map<FilterCategory, Set<String>> MEMBERS;

    static {
        Map<String, String> exact = new LinkedHashMap<>();
        PROJECT_KINDS.forEach((alias, kind) -> {
            exact.put("+" + alias, "project_type:" + kind);
            exact.put("-" + alias, "project_type!=" + kind);
        });
        for (String loader : LOADERS) {
            exact.put("+" + loader, "categories:" + loader);
            exact.put("-" + loader, "categories!=" + loader);
        }
        exact.put("+server", "client_side!=required");
        exact.put("-server", "client_side:required");
        exact.put("+client", "server_side!=required");
        exact.put("-client", "server_side:required");
        exact.put("+serverside", "client_side!=required");
        exact.put("-serverside", "client_side:required");
        exact.put("+clientside", "server_side!=required");
        exact.put("-clientside", "server_side:required");
        exact.put("+serversupported", "server_side!=unsupported");
        exact.put("-serversupported", "server_side:unsupported");
        exact.put("+clientsupported", "client_side!=unsupported");
        exact.put("-clientsupported", "client_side:unsupported");
        EXACT = Collections.unmodifiableMap(exact);

        Map<String, UnaryOperator<String>> parametric = new LinkedHashMap<>();
        parametric.put("+v", version -> "versions:" + version);
        parametric.put("-v", version -> "versions!=" + version);
        parametric.put("+t", tag -> "categories:" + tag);
        parametric.put("-t", tag -> "categories!=" + tag);
        PARAMETRIC = Collections.unmodifiableMap(parametric);

        Map<FilterCategory, Set<String>> members = new EnumMap<>(FilterCategory.class);
        members.put(FilterCategory.PROJECT_KIND, Collections.unmodifiableSet(new LinkedHashSet<>(PROJECT_KINDS.keySet())));
        members.put(FilterCategory.LOADER, Set.copyOf(LOADERS));
        members.put(FilterCategory.PLATFORM, Set.of("server", "client", "serverside", "clientside",
                "serversupported", "clientsupported"));
        members.put(FilterCategory.VERSION, Set.of("v"));
        members.put(FilterCategory.TAG, Set.of("t"));
        MEMBERS = Collections.unmodifiableMap(members);
    }

    private FilterVocabulary() {
    }

    /**
     * Resolves a filter word: exact match first, then parametric prefix.
     *
     * @throws ModSearchException {@code USER_INPUT} naming the word if neither matches
     */
    public static FilterToken resolve(String word) throws ModSearchException {
        boolean inclusive = word.startsWith("+");
        String exactClause = EXACT.get(word);
        if (exactClause != null) {
            return new FilterToken(word, inclusive, word.substring(1), null, exactClause);
        }

        if (word.length() > PARAMETRIC_PREFIX_LENGTH) {
            String prefix = word.substring(0, PARAMETRIC_PREFIX_LENGTH);
            UnaryOperator<String> formatter = PARAMETRIC.get(prefix);
            if (formatter != null) {
                String argument = word.substring(PARAMETRIC_PREFIX_LENGTH);
                return new FilterToken(word, inclusive, prefix.substring(1), argument, formatter.apply(argument));
            }
        }

        throw ModSearchException.userInput("Invalid search filter \"" + word + "\"!");
    }

    /**
     * Finds the category a resolved token belongs to.
     *
     * @throws ModSearchException {@code INTERNAL} if the tables are inconsistent
     */
    public static FilterCategory categoryOf(FilterToken token) throws ModSearchException {
        for (FilterCategory category : FilterCategory.values()) {
            if (MEMBERS.get(category).contains(token.attribute())) {
                return category;
            }
        }
        throw ModSearchException.internal("Internal Error: Invalid search filter \"" + token.raw() + "\"!");
    }

    public static boolean isLoader(String name) {
        return MEMBERS.get(FilterCategory.LOADER).contains(name);
    }

    public static Set<String> exactFilters() {
        return EXACT.keySet();
    }

    private static Map<String, String> orderedMap(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
