package com.modsearch.common.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultPageTest {

    @Test
    void testZeroHitsIsOnePage() {
        assertEquals(1, ResultPage.computePageCount(0, 20));
    }

    @Test
    void testCeilingDivision() {
        assertEquals(1, ResultPage.computePageCount(1, 20));
        assertEquals(1, ResultPage.computePageCount(20, 20));
        assertEquals(2, ResultPage.computePageCount(21, 20));
        assertEquals(50, ResultPage.computePageCount(1000, 20));
    }

    @Test
    void testPageCountMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new ResultPage<>(List.of(), 0, 0, 0, Duration.ZERO));
    }

    @Test
    void testItemsAreCopied() {
        List<String> source = new java.util.ArrayList<>(List.of("a"));
        ResultPage<String> page = new ResultPage<>(source, 0, 1, 1, Duration.ZERO);
        source.add("b");

        assertEquals(List.of("a"), page.items());
    }
}
