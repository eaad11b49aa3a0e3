package com.modsearch.common.model;

import java.time.Duration;
import java.util.List;

/**
 * One page of results. Never mutated: moving to another page produces a new instance.
 *
 * @param items      items on this page, in API order
 * @param pageIndex  0-based index of this page
 * @param pageCount  total number of pages, always at least 1
 * @param totalHits  total number of matching entries
 * @param latency    round-trip time of the network call that produced the page
 */
public record ResultPage<T>(
    List<T> items,
    int pageIndex,
    int pageCount,
    long totalHits,
    Duration latency
) {
    public ResultPage {
        items = List.copyOf(items);
        if (pageCount < 1) {
            throw new IllegalArgumentException("pageCount must be >= 1 but was " + pageCount);
        }
    }

    /**
     * {@code max(1, ceil(totalHits / pageSize))}: an empty result still has one page.
     */
    public static int computePageCount(long totalHits, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        long pages = (totalHits + pageSize - 1) / pageSize;
        return (int) Math.max(1, pages);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
