package com.modsearch.core.navigation;

import com.modsearch.api.ContentGateway;
import com.modsearch.common.model.Item;
import com.modsearch.common.model.Release;
import com.modsearch.common.model.ResultPage;
import com.modsearch.core.download.DownloadProgressListener;
import com.modsearch.core.download.DownloadService;
import com.modsearch.core.error.ModSearchException;
import com.modsearch.core.navigation.Screen.Failure;
import com.modsearch.core.navigation.Screen.ItemDetail;
import com.modsearch.core.navigation.Screen.Message;
import com.modsearch.core.navigation.Screen.Quit;
import com.modsearch.core.navigation.Screen.ReleaseDetail;
import com.modsearch.core.navigation.Screen.Results;
import com.modsearch.core.navigation.Screen.Search;
import com.modsearch.core.query.CompiledQuery;
import com.modsearch.core.query.QueryCompiler;
import com.modsearch.core.query.QueryHelp;
import com.modsearch.core.release.DependencyResolver;
import com.modsearch.core.release.QuickDownloadRequest;
import com.modsearch.core.release.ReleaseMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Transition function of the interactive client: given the current screen and one line of input,
 * performs at most one remote operation and returns the next screen.
 * <p>
 * Failures never escape; they become a {@link Failure} screen whose parent is the screen to return to.
 */
public class Navigator {
    private static final Logger logger = LoggerFactory.getLogger(Navigator.class);

    private static final Set<String> HELP_WORDS = Set.of("?", "help");
    public static final String DOWNLOAD_ALL = "all";

    private final ContentGateway gateway;
    private final QueryCompiler compiler;
    private final DownloadService downloads;
    private final DependencyResolver dependencies;
    private final DownloadProgressListener progress;
    private final int releasePageSize;

    public Navigator(ContentGateway gateway, QueryCompiler compiler, DownloadService downloads,
                     DownloadProgressListener progress) {
        this.gateway = gateway;
        this.compiler = compiler;
        this.downloads = downloads;
        this.dependencies = new DependencyResolver(gateway);
        this.progress = progress;
        this.releasePageSize = compiler.getPageSize();
    }

    public Screen start() {
        return new Search();
    }

    public Screen next(Screen current, String input) {
        String line = input == null ? "" : input.strip();
        try {
            if (current instanceof Search) return onSearch(line);
            if (current instanceof Results results) return onResults(results, line);
            if (current instanceof ItemDetail detail) return onItemDetail(detail, line);
            if (current instanceof ReleaseDetail release) return onReleaseDetail(release, line);
            if (current instanceof Message message) return message.parent();
            if (current instanceof Failure failure) return failure.parent();
            if (current instanceof Quit) return current;
            throw new IllegalStateException("Unknown screen " + current.getClass().getName());
        } catch (RuntimeException e) {
            logger.error("Unexpected failure handling '{}' on {}", line, current.getClass().getSimpleName(), e);
            return new Failure(ModSearchException.internal("Unexpected error: " + e, e), current);
        }
    }

    // --- Search ---

    private Screen onSearch(String line) {
        if (NavigationCommand.isQuit(line)) return new Quit();
        if (HELP_WORDS.contains(line)) return new Message(QueryHelp.text(), new Search());

        Search search = new Search();
        try {
            CompiledQuery query = compiler.compile(line, 0);
            return new Results(query, gateway.search(query));
        } catch (ModSearchException e) {
            return failure(e, search);
        }
    }

    // --- Results ---

    private Screen onResults(Results results, String line) {
        NavigationCommand command;
        try {
            command = NavigationCommand.parse(line);
        } catch (ModSearchException e) {
            return failure(e, results);
        }

        ResultPage<Item> page = results.page();
        if (command.type() == NavigationCommand.Type.QUIT) return new Search();

        if (command.isPaging()) {
            int target = command.targetPage(page.pageIndex(), page.pageCount());
            try {
                CompiledQuery query = results.query().atPage(target);
                return new Results(query, gateway.search(query));
            } catch (ModSearchException e) {
                return failure(e, results);
            }
        }

        int index = command.value();
        if (index < 0 || index >= page.items().size()) {
            return failure(outOfRange(index, page.items().size()), results);
        }

        Item item = page.items().get(index);
        try {
            List<Release> releases = gateway.listReleases(item.getId());
            return new ItemDetail(item, releases, 0, releasePageSize, results);
        } catch (ModSearchException e) {
            return failure(e, results);
        }
    }

    // --- Item detail ---

    private Screen onItemDetail(ItemDetail detail, String line) {
        Optional<QuickDownloadRequest> quick = QuickDownloadRequest.parse(line);
        if (quick.isPresent()) {
            return quickDownload(detail, quick.get());
        }

        NavigationCommand command;
        try {
            command = NavigationCommand.parse(line);
        } catch (ModSearchException e) {
            return failure(e, detail);
        }

        if (command.type() == NavigationCommand.Type.QUIT) return detail.parent();

        if (command.isPaging()) {
            // releases were fetched once, paging stays local
            return detail.atReleasePage(command.targetPage(detail.releasePage(), detail.releasePageCount()));
        }

        List<Release> onPage = detail.releasesOnPage();
        int index = command.value();
        if (index < 0 || index >= onPage.size()) {
            return failure(outOfRange(index, onPage.size()), detail);
        }
        return new ReleaseDetail(onPage.get(index), detail, detail.item().getSlug());
    }

    private Screen quickDownload(ItemDetail detail, QuickDownloadRequest request) {
        Optional<Release> match = ReleaseMatcher.findBest(detail.releases(), request);
        if (match.isEmpty()) {
            return new Message("No release of " + detail.item().getTitle() + " matches \"" + request + "\".", detail);
        }
        logger.info("Quick match for '{}' on {}: {}", request, detail.item().getSlug(), match.get().getVersionNumber());
        return new ReleaseDetail(match.get(), detail, detail.item().getSlug());
    }

    // --- Release detail ---

    private Screen onReleaseDetail(ReleaseDetail detail, String line) {
        boolean all;
        if (line.isEmpty()) {
            all = false;
        } else if (line.equalsIgnoreCase(DOWNLOAD_ALL)) {
            all = true;
        } else {
            // "q" and anything unrecognised go back
            return detail.parent();
        }

        Release release = detail.release();
        List<Item> required;
        try {
            required = release.hasRequiredDependencies() ? dependencies.resolve(release) : List.of();
        } catch (ModSearchException e) {
            // keep the user's place in the release list
            return failure(e, detail.parent());
        }

        try {
            List<Path> written = all
                    ? downloads.downloadAll(detail.itemSlug(), release, progress)
                    : List.of(downloads.downloadPrimary(detail.itemSlug(), release, progress));
            return new Message(downloadReport(release, written, required), detail);
        } catch (ModSearchException e) {
            return failure(e, detail);
        }
    }

    private static String downloadReport(Release release, List<Path> written, List<Item> required) {
        StringBuilder sb = new StringBuilder();
        sb.append("Downloaded ").append(release.getVersionNumber()).append(':');
        for (Path path : written) {
            sb.append("\n  ").append(path);
        }
        if (!required.isEmpty()) {
            sb.append("\n\nRequired dependencies:");
            for (Item item : required) {
                sb.append("\n  ").append(item.getTitle()).append(" (").append(item.getSlug()).append(')');
            }
        }
        return sb.toString();
    }

    // --- Helpers ---

    private static ModSearchException outOfRange(int index, int size) {
        if (size == 0) {
            return ModSearchException.userInput("There is nothing to select on this page.");
        }
        return ModSearchException.userInput("Index " + (index + 1) + " is out of range (1-" + size + ").");
    }

    private static Failure failure(ModSearchException e, Screen parent) {
        switch (e.getKind()) {
            case USER_INPUT, REMOTE_APPLICATION -> logger.info("{}: {}", e.getKind(), e.getMessage());
            default -> logger.error("{}: {}", e.getKind(), e.getMessage(), e);
        }
        return new Failure(e, parent);
    }
}
