package com.modsearch.core.query;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompiledQueryTest {

    @Test
    void testFacetsJsonIsNotHtmlEscaped() {
        CompiledQuery query = new CompiledQuery("", List.of(
                List.of("project_type:mod", "project_type:resourcepack"),
                List.of("project_type!=datapack")), null, 0, 20);

        assertEquals("[[\"project_type:mod\",\"project_type:resourcepack\"],[\"project_type!=datapack\"]]",
                query.facetsJson().orElseThrow());
    }

    @Test
    void testEmptyGroupRejected() {
        List<List<String>> groups = List.of(List.of());
        assertThrows(IllegalArgumentException.class, () -> new CompiledQuery("x", groups, null, 0, 20));
    }

    @Test
    void testAtPageKeepsEverythingElse() {
        CompiledQuery first = new CompiledQuery("foo", List.of(List.of("categories:fabric")),
                SortDirective.NEWEST, 0, 20);

        CompiledQuery third = first.atPage(2);

        assertEquals(40, third.offset());
        assertEquals(first.term(), third.term());
        assertEquals(first.clauseGroups(), third.clauseGroups());
        assertEquals(SortDirective.NEWEST, third.sort());
        assertEquals(0, first.pageIndex(), "The original query is untouched");
    }
}
