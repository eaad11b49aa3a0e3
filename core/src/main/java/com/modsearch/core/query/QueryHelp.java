package com.modsearch.core.query;

/**
 * Help text for the query language, shown on the search screen.
 */
public final class QueryHelp {

    private QueryHelp() {
    }

    public static String text() {
        return """
                QUERY FORMAT

                Write your search words normally. Add a word starting with "+" to filter for an attribute
                or with "-" to filter against it.

                Project type   mod, resourcepack (rp), datapack (dp), modpack (mp), plugin, shader
                Loader         %s
                Platform       server (serverside), client (clientside), serversupported, clientsupported
                Version        "v" + version, e.g. +v1.20.1
                Tag            "t" + tag, e.g. +tadventure -tcursed

                Results match ANY "+" attribute of each category AND NONE of the "-" attributes.

                SORTING
                Add one word starting with "/" to sort in descending order: %s (default: relevance)

                EXAMPLES
                  +forge +mod +rp -dp -mp -quilt
                  trajectory -serversupported +neoforge +mod +v1.21.1 /follows
                  teleport +server

                NAVIGATION
                  <number>  open an entry         <  >  previous / next page
                  p<N>      jump to page N        q     go back (quit on the search screen)
                  On a release list, "1.20.1 fabric" picks the best matching release.
                  On a release, ENTER downloads the primary file and "all" downloads every file.
                """.formatted(String.join(", ", FilterVocabulary.LOADERS), SortDirective.validNames());
    }
}
