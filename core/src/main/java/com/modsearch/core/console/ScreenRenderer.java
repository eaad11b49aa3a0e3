package com.modsearch.core.console;

import com.modsearch.common.model.Item;
import com.modsearch.common.model.Release;
import com.modsearch.common.model.ReleaseFile;
import com.modsearch.common.model.ResultPage;
import com.modsearch.common.util.TextUtils;
import com.modsearch.core.error.ErrorKind;
import com.modsearch.core.error.ModSearchException;
import com.modsearch.core.navigation.Screen;

import java.io.PrintWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.IntSupplier;
import java.util.stream.Collectors;

import static com.modsearch.common.util.TextUtils.capitalize;
import static com.modsearch.common.util.TextUtils.formatBytes;
import static com.modsearch.common.util.TextUtils.formatCount;
import static com.modsearch.common.util.TextUtils.truncate;

/**
 * Prints screens as plain text tables.
 */
public class ScreenRenderer {
    private static final String SITE_URL = "https://modrinth.com";
    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy").withZone(ZoneId.systemDefault());
    private static final int MAX_VERSIONS_SHOWN = 40;
    private static final int MIN_WIDTH = 80;

    private final PrintWriter out;
    private final IntSupplier terminalWidth;

    public ScreenRenderer(PrintWriter out, IntSupplier terminalWidth) {
        this.out = out;
        this.terminalWidth = terminalWidth;
    }

    public void render(Screen screen) {
        if (screen instanceof Screen.Search) {
            out.println();
            out.println("Enter a search query (\"?\" for help, \"q\" to quit).");
        } else if (screen instanceof Screen.Results results) {
            renderResults(results);
        } else if (screen instanceof Screen.ItemDetail detail) {
            renderItem(detail.item());
            out.println();
            renderReleases(detail);
        } else if (screen instanceof Screen.ReleaseDetail detail) {
            renderRelease(detail.release());
        } else if (screen instanceof Screen.Message message) {
            out.println();
            out.println(message.text());
        } else if (screen instanceof Screen.Failure failure) {
            renderFailure(failure.error());
        }
        out.flush();
    }

    public String prompt(Screen screen) {
        if (screen instanceof Screen.Search) return "search> ";
        if (screen instanceof Screen.Results) return "results (#, <, >, p<N>, q)> ";
        if (screen instanceof Screen.ItemDetail) return "releases (#, <, >, p<N>, <version> <loader>, q)> ";
        if (screen instanceof Screen.ReleaseDetail) return "download (ENTER = primary, all, q)> ";
        return "press ENTER to continue> ";
    }

    // --- Results ---

    void renderResults(Screen.Results results) {
        ResultPage<Item> page = results.page();
        int loaderWidth = Math.max(10, width() - 108);
        out.println();
        out.println("  #  ID       TYPE         NAME                           AUTHOR               "
                + "DOWNLOADS    FOLLOWS  LOADERS");
        int row = 1;
        for (Item item : page.items()) {
            out.println(String.format("%3d", row++) + "  " + formatItemRow(item, loaderWidth));
        }
        if (page.isEmpty()) {
            out.println("  (no results)");
        }
        out.println(String.format(Locale.ROOT, "Page %d/%d @ %d items/page - %s results - Fetched in %,d ms",
                page.pageIndex() + 1, page.pageCount(), results.query().pageSize(),
                formatCount(page.totalHits()), page.latency().toMillis()));
    }

    static String formatItemRow(Item item, int loaderWidth) {
        String loaders = item.getLoaders().stream()
                .map(TextUtils::capitalize)
                .collect(Collectors.joining(" "));
        return truncate(item.getId(), 8)
                + " " + truncate(capitalize(item.getKind()), 12)
                + " " + truncate(item.getTitle(), 30)
                + " " + truncate(item.getAuthor(), 20)
                + " ⤓" + truncate(formatCount(item.getDownloads()), 11)
                + " ♥" + truncate(formatCount(item.getFollows()), 7)
                + " " + truncate(loaders, loaderWidth, false);
    }

    // --- Item ---

    void renderItem(Item item) {
        out.println();
        out.println(item.getTitle() + "     ⤓" + formatCount(item.getDownloads()) + " ♥" + formatCount(item.getFollows()));
        if (!item.getAuthor().isEmpty()) {
            out.println("  by " + item.getAuthor());
        }
        out.println();
        out.println(item.getDescription());
        out.println();
        out.println("ID: " + item.getId());
        out.println("Slug: " + item.getSlug());
        out.println("URL: " + SITE_URL + "/" + item.getKind() + "/" + item.getSlug());
        out.println("Short URL: " + SITE_URL + "/" + item.getKind() + "/" + item.getId());
        out.println("Date Created: " + formatDate(item.getCreatedAt()));
        out.println("Date Modified: " + formatDate(item.getModifiedAt()));
        out.println("Project Type: " + item.getKind());
        out.println("Client support: " + item.getClientSupport());
        out.println("Server support: " + item.getServerSupport());
        out.println("License: " + item.getLicense());
        out.println();
        out.println("Loaders: " + capitalizeAll(item.getLoaders()));
        out.println("Tags: " + capitalizeAll(item.getTopics()));
        out.println("MC Versions: " + newestVersions(item.getVersions()));
    }

    static String newestVersions(List<String> versions) {
        List<String> newestFirst = new ArrayList<>(versions);
        Collections.reverse(newestFirst);
        String shown = String.join(" ", newestFirst.subList(0, Math.min(MAX_VERSIONS_SHOWN, newestFirst.size())));
        return versions.size() > MAX_VERSIONS_SHOWN ? shown + "…" : shown;
    }

    // --- Releases ---

    void renderReleases(Screen.ItemDetail detail) {
        out.println("  #  TYPE     VERSION              NAME                           "
                + "DOWNLOADS    LOADERS              GAME VERSIONS");
        int row = 1;
        for (Release release : detail.releasesOnPage()) {
            out.println(String.format("%3d", row++) + "  " + formatReleaseRow(release, Math.max(10, width() - 106)));
        }
        if (detail.releases().isEmpty()) {
            out.println("  (no releases)");
        }
        out.println(String.format("Page %d/%d @ %d releases/page - %d releases",
                detail.releasePage() + 1, detail.releasePageCount(), detail.releasePageSize(),
                detail.releases().size()));
    }

    static String formatReleaseRow(Release release, int versionsWidth) {
        return truncate(capitalize(release.getMaturity().getWireName()), 8)
                + " " + truncate(release.getVersionNumber(), 20)
                + " " + truncate(release.getName(), 30)
                + " ⤓" + truncate(formatCount(release.getDownloads()), 11)
                + " " + truncate(capitalizeAll(release.getLoaders()), 20)
                + " " + truncate(newestVersions(release.getTargetVersions()), versionsWidth, false);
    }

    void renderRelease(Release release) {
        out.println();
        out.println(release.getName() + " (" + release.getVersionNumber() + ")     ⤓" + formatCount(release.getDownloads()));
        out.println("Type: " + capitalize(release.getMaturity().getWireName()));
        out.println("Loaders: " + capitalizeAll(release.getLoaders()));
        out.println("MC Versions: " + newestVersions(release.getTargetVersions()));
        out.println("Required dependencies: " + release.getRequiredDependencyIds().size());
        out.println();
        out.println("Files:");
        for (ReleaseFile file : release.getFiles()) {
            out.println((file.primary() ? "  * " : "    ") + file.filename() + "  (" + formatBytes(file.size()) + ")");
        }
    }

    // --- Failure ---

    void renderFailure(ModSearchException error) {
        out.println();
        out.println(error.getKind().getLabel().toUpperCase() + ":");
        out.println();
        out.println(error.getMessage());
        if (error.getDetail() != null && error.getKind() != ErrorKind.USER_INPUT) {
            String rule = "=".repeat(40);
            out.println(rule);
            out.print(error.getDetail());
            out.println(rule);
        }
    }

    /**
     * Progress line for a running download, redrawn in place with a carriage return.
     */
    public void renderProgress(ReleaseFile file, long bytesWritten, long expectedBytes) {
        String percent = expectedBytes > 0 ? String.format("%3d%%", bytesWritten * 100 / expectedBytes) : "  ?%";
        out.print("\r" + truncate(file.filename(), 40) + " " + percent + "  "
                + formatBytes(bytesWritten) + " / " + formatBytes(expectedBytes));
        if (expectedBytes > 0 && bytesWritten >= expectedBytes) {
            out.println();
        }
        out.flush();
    }

    private int width() {
        return Math.max(MIN_WIDTH, terminalWidth.getAsInt());
    }

    private static String capitalizeAll(List<String> words) {
        return words.stream().map(TextUtils::capitalize).collect(Collectors.joining(" "));
    }

    private static String formatDate(Instant instant) {
        return instant == null ? "unknown" : DATE_FORMAT.format(instant);
    }
}
