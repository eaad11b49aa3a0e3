package com.modsearch.core.navigation;

import com.modsearch.common.model.Item;
import com.modsearch.common.model.Release;
import com.modsearch.common.model.ResultPage;
import com.modsearch.core.error.ModSearchException;
import com.modsearch.core.query.CompiledQuery;

import java.util.List;

/**
 * One state of the interactive client. Every variant carries exactly what it needs to be rendered and
 * to handle the next input; screens are immutable and "changing page" creates a new screen.
 */
public interface Screen {

    /**
     * Waiting for a query.
     */
    record Search() implements Screen {
    }

    /**
     * One page of search results for {@code query}.
     */
    record Results(CompiledQuery query, ResultPage<Item> page) implements Screen {
    }

    /**
     * An item with its full release list, shown {@code releasePageSize} releases at a time.
     */
    record ItemDetail(Item item, List<Release> releases, int releasePage, int releasePageSize, Results parent)
            implements Screen {

        public ItemDetail {
            releases = List.copyOf(releases);
            if (releasePageSize <= 0) throw new IllegalArgumentException("releasePageSize must be > 0");
        }

        public int releasePageCount() {
            return ResultPage.computePageCount(releases.size(), releasePageSize);
        }

        public List<Release> releasesOnPage() {
            int from = Math.min(releasePage * releasePageSize, releases.size());
            int to = Math.min(from + releasePageSize, releases.size());
            return releases.subList(from, to);
        }

        public ItemDetail atReleasePage(int page) {
            return new ItemDetail(item, releases, page, releasePageSize, parent);
        }
    }

    /**
     * A single release, ready to be downloaded.
     */
    record ReleaseDetail(Release release, Screen parent, String itemSlug) implements Screen {
    }

    /**
     * Informational text; any input returns to {@code parent}.
     */
    record Message(String text, Screen parent) implements Screen {
    }

    /**
     * A failed operation; any input returns to {@code parent}. Nothing is retried automatically.
     */
    record Failure(ModSearchException error, Screen parent) implements Screen {
    }

    /**
     * Terminal state.
     */
    record Quit() implements Screen {
    }
}
