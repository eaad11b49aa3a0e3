package com.modsearch.core.navigation;

import com.modsearch.common.model.Item;
import com.modsearch.common.model.Maturity;
import com.modsearch.common.model.Release;
import com.modsearch.common.model.ReleaseFile;
import com.modsearch.common.model.ResultPage;
import com.modsearch.common.util.HttpUtils;
import com.modsearch.core.download.DownloadProgressListener;
import com.modsearch.core.download.DownloadService;
import com.modsearch.core.download.FileDownloader;
import com.modsearch.core.error.ErrorKind;
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
import com.modsearch.test.FakeGateway;
import com.modsearch.test.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.modsearch.test.Releases.release;
import static com.modsearch.test.Releases.withFiles;
import static org.junit.jupiter.api.Assertions.*;

class NavigatorTest {
    private static final int PAGE_SIZE = 20;

    @TempDir
    Path downloadRoot;

    private FakeGateway gateway;
    private StubHttpServer server;
    private Navigator navigator;

    @BeforeEach
    void setUp() throws Exception {
        gateway = new FakeGateway().withItems(45);
        server = new StubHttpServer();
        FileDownloader downloader = new FileDownloader(new HttpUtils.Options("test", 2000, 2000), 4);
        navigator = new Navigator(gateway, new QueryCompiler(PAGE_SIZE),
                new DownloadService(downloader, downloadRoot), DownloadProgressListener.NONE);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private Results search(String query) {
        Screen screen = navigator.next(navigator.start(), query);
        return assertInstanceOf(Results.class, screen);
    }

    private ItemDetail openFirstItem(List<Release> releases) {
        gateway.withReleases("id1", releases);
        return assertInstanceOf(ItemDetail.class, navigator.next(search("sodium"), "1"));
    }

    // --- Search ---

    @Test
    void testQuitOnSearchEndsSession() {
        assertInstanceOf(Quit.class, navigator.next(new Search(), "q"));
        assertInstanceOf(Quit.class, navigator.next(new Search(), " exit "));
    }

    @Test
    void testHelpReturnsToSearch() {
        Message message = assertInstanceOf(Message.class, navigator.next(new Search(), "?"));

        assertTrue(message.text().contains("QUERY FORMAT"));
        assertInstanceOf(Search.class, message.parent());
        assertTrue(gateway.searches.isEmpty());
    }

    @Test
    void testSearchShowsFirstPage() {
        Results results = search("sodium +fabric /downloads");

        assertEquals(1, gateway.searches.size());
        assertEquals("sodium", results.query().term());
        assertEquals(0, results.page().pageIndex());
        assertEquals(3, results.page().pageCount());
        assertEquals(PAGE_SIZE, results.page().items().size());
    }

    @Test
    void testInvalidFilterNeverReachesGateway() {
        Failure failure = assertInstanceOf(Failure.class, navigator.next(new Search(), "sodium +fabrik"));

        assertEquals(ErrorKind.USER_INPUT, failure.error().getKind());
        assertInstanceOf(Search.class, failure.parent());
        assertTrue(gateway.searches.isEmpty());
    }

    @Test
    void testSearchFailureReturnsToSearch() {
        gateway.searchFailure = ModSearchException.transport("Connection refused", null);

        Failure failure = assertInstanceOf(Failure.class, navigator.next(new Search(), "sodium"));

        assertEquals(ErrorKind.TRANSPORT, failure.error().getKind());
        assertInstanceOf(Search.class, navigator.next(failure, ""));
    }

    // --- Results ---

    @Test
    void testNextPageFromLastPageWrapsToFirst() {
        Results first = search("sodium");
        Results last = assertInstanceOf(Results.class, navigator.next(first, "p3"));
        assertEquals(2, last.page().pageIndex());
        assertEquals(5, last.page().items().size());

        Results wrapped = assertInstanceOf(Results.class, navigator.next(last, ">"));

        assertEquals(0, wrapped.page().pageIndex());
        assertEquals(0, gateway.searches.get(gateway.searches.size() - 1).offset());
    }

    @Test
    void testPreviousPageFromFirstPageWrapsToLast() {
        Results wrapped = assertInstanceOf(Results.class, navigator.next(search("sodium"), "<"));

        assertEquals(2, wrapped.page().pageIndex());
        CompiledQuery issued = gateway.searches.get(gateway.searches.size() - 1);
        assertEquals(40, issued.offset());
        assertEquals("sodium", issued.term());
    }

    @Test
    void testQuitOnResultsReturnsToSearch() {
        assertInstanceOf(Search.class, navigator.next(search("sodium"), "q"));
    }

    @Test
    void testSelectingItemLoadsReleases() {
        Release release = release("r1", Maturity.STABLE, List.of("1.20.1"), List.of("fabric"));
        Results results = search("sodium");
        gateway.withReleases("id2", List.of(release));

        ItemDetail detail = assertInstanceOf(ItemDetail.class, navigator.next(results, "2"));

        assertEquals("id2", detail.item().getId());
        assertEquals(List.of("id2"), gateway.releaseRequests);
        assertEquals(List.of(release), detail.releases());
        assertSame(results, detail.parent());
    }

    @Test
    void testIndexOutOfRangeStaysOnResults() {
        Results results = search("sodium");

        Failure failure = assertInstanceOf(Failure.class, navigator.next(results, "21"));

        assertEquals(ErrorKind.USER_INPUT, failure.error().getKind());
        assertSame(results, failure.parent());
        assertTrue(gateway.releaseRequests.isEmpty());
    }

    @Test
    void testEmptyInputOnResultsIsAnError() {
        Results results = search("sodium");

        Failure failure = assertInstanceOf(Failure.class, navigator.next(results, ""));
        assertSame(results, failure.parent());
    }

    @Test
    void testReleaseListFailureReturnsToResults() {
        Results results = search("sodium");
        gateway.releaseFailure = ModSearchException.remote("not_found", "The requested project was not found");

        Failure failure = assertInstanceOf(Failure.class, navigator.next(results, "1"));

        assertEquals(ErrorKind.REMOTE_APPLICATION, failure.error().getKind());
        assertEquals("not_found: The requested project was not found", failure.error().getMessage());
        assertSame(results, failure.parent());
    }

    @Test
    void testPagingEmptyResultsStaysOnSinglePage() {
        gateway = new FakeGateway();
        navigator = new Navigator(gateway, new QueryCompiler(PAGE_SIZE),
                new DownloadService(new FileDownloader(new HttpUtils.Options("test", 1000, 1000), 4), downloadRoot),
                DownloadProgressListener.NONE);

        Results empty = search("nothing");
        assertEquals(1, empty.page().pageCount());

        Results next = assertInstanceOf(Results.class, navigator.next(empty, ">"));
        assertEquals(0, next.page().pageIndex());
    }

    // --- Item detail ---

    @Test
    void testReleasePagingIsLocal() {
        List<Release> releases = new ArrayList<>();
        for (int i = 0; i < 45; i++) {
            releases.add(release("r" + i, Maturity.STABLE, List.of("1.20.1"), List.of("fabric")));
        }
        ItemDetail detail = openFirstItem(releases);
        assertEquals(3, detail.releasePageCount());

        ItemDetail last = assertInstanceOf(ItemDetail.class, navigator.next(detail, "<"));
        assertEquals(2, last.releasePage());
        assertEquals(5, last.releasesOnPage().size());

        ItemDetail first = assertInstanceOf(ItemDetail.class, navigator.next(last, ">"));
        assertEquals(0, first.releasePage());

        assertEquals(1, gateway.releaseRequests.size(), "Paging releases must not hit the network");
    }

    @Test
    void testSelectingReleaseOnLaterPage() {
        List<Release> releases = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            releases.add(release("r" + i, Maturity.STABLE, List.of("1.20.1"), List.of("fabric")));
        }
        ItemDetail page2 = assertInstanceOf(ItemDetail.class, navigator.next(openFirstItem(releases), "p2"));

        ReleaseDetail detail = assertInstanceOf(ReleaseDetail.class, navigator.next(page2, "3"));

        assertEquals("r22", detail.release().getId());
        assertSame(page2, detail.parent());
        assertEquals("item-1", detail.itemSlug());
    }

    @Test
    void testQuitOnItemDetailReturnsToResults() {
        ItemDetail detail = openFirstItem(List.of());

        assertSame(detail.parent(), navigator.next(detail, "q"));
    }

    @Test
    void testQuickDownloadPicksMostMatureRelease() {
        Release beta = release("beta", Maturity.BETA, List.of("1.20.1"), List.of("fabric"));
        Release stable = release("stable", Maturity.STABLE, List.of("1.20.1"), List.of("fabric"));
        Release forge = release("forge", Maturity.STABLE, List.of("1.20.1"), List.of("forge"));
        ItemDetail detail = openFirstItem(List.of(beta, forge, stable));

        ReleaseDetail picked = assertInstanceOf(ReleaseDetail.class, navigator.next(detail, "1.20.1 fabric"));

        assertSame(stable, picked.release());
        assertSame(detail, picked.parent());
    }

    @Test
    void testQuickDownloadWithoutMatchShowsMessage() {
        ItemDetail detail = openFirstItem(List.of(release("r", Maturity.STABLE, List.of("1.20.1"), List.of("fabric"))));

        Message message = assertInstanceOf(Message.class, navigator.next(detail, "v1.8.9"));

        assertTrue(message.text().contains("1.8.9"));
        assertSame(detail, message.parent());
    }

    // --- Release detail ---

    @Test
    void testDownloadPrimaryFile() throws Exception {
        server.serve("/files/main.jar", 200, "main-bytes".getBytes(StandardCharsets.UTF_8));
        server.serve("/files/sources.jar", 200, "src".getBytes(StandardCharsets.UTF_8));
        Release release = withFiles("r1", List.of(
                new ReleaseFile(server.url("/files/sources.jar"), "sources.jar", 3, false),
                new ReleaseFile(server.url("/files/main.jar"), "main.jar", 10, true)), List.of());
        ReleaseDetail detail = new ReleaseDetail(release, openFirstItem(List.of(release)), "item-1");

        Message message = assertInstanceOf(Message.class, navigator.next(detail, ""));

        Path written = downloadRoot.resolve("item-1").resolve("main.jar");
        assertEquals("main-bytes", Files.readString(written));
        assertFalse(Files.exists(downloadRoot.resolve("item-1").resolve("sources.jar")));
        assertTrue(message.text().contains(written.toString()));
        assertSame(detail, message.parent());
    }

    @Test
    void testDownloadAllFiles() {
        server.serve("/a.jar", 200, "a".getBytes(StandardCharsets.UTF_8));
        server.serve("/b.jar", 200, "b".getBytes(StandardCharsets.UTF_8));
        Release release = withFiles("r1", List.of(
                new ReleaseFile(server.url("/a.jar"), "a.jar", 1, true),
                new ReleaseFile(server.url("/b.jar"), "b.jar", 1, false)), List.of());
        ReleaseDetail detail = new ReleaseDetail(release, openFirstItem(List.of(release)), "item-1");

        assertInstanceOf(Message.class, navigator.next(detail, "ALL"));

        assertTrue(Files.exists(downloadRoot.resolve("item-1").resolve("a.jar")));
        assertTrue(Files.exists(downloadRoot.resolve("item-1").resolve("b.jar")));
    }

    @Test
    void testDownloadReportListsRequiredDependencies() {
        server.serve("/a.jar", 200, "a".getBytes(StandardCharsets.UTF_8));
        gateway.withLookup(Item.builder("dep1", "fabric-api").title("Fabric API").build());
        Release release = withFiles("r1", List.of(new ReleaseFile(server.url("/a.jar"), "a.jar", 1, true)),
                List.of("dep1"));
        ReleaseDetail detail = new ReleaseDetail(release, openFirstItem(List.of(release)), "item-1");

        Message message = assertInstanceOf(Message.class, navigator.next(detail, ""));

        assertTrue(message.text().contains("Fabric API (fabric-api)"));
        assertEquals(List.of("dep1"), gateway.itemRequests);

        navigator.next(detail, "");
        assertEquals(1, gateway.itemRequests.size(), "Resolved dependencies are cached on the release");
    }

    @Test
    void testDependencyFailureReturnsToReleaseList() {
        gateway.lookupFailure = ModSearchException.transport("timeout", null);
        Release release = withFiles("r1", List.of(new ReleaseFile(server.url("/a.jar"), "a.jar", 1, true)),
                List.of("dep1"));
        ItemDetail itemDetail = openFirstItem(List.of(release));
        ReleaseDetail detail = new ReleaseDetail(release, itemDetail, "item-1");

        Failure failure = assertInstanceOf(Failure.class, navigator.next(detail, ""));

        assertEquals(ErrorKind.TRANSPORT, failure.error().getKind());
        assertSame(itemDetail, failure.parent());
        assertTrue(server.requests().isEmpty(), "Nothing is downloaded when dependencies cannot be resolved");
    }

    @Test
    void testMissingFileIsTransportFailure() {
        server.serve("/gone.jar", 404, new byte[0]);
        Release release = withFiles("r1", List.of(new ReleaseFile(server.url("/gone.jar"), "gone.jar", 1, true)),
                List.of());
        ReleaseDetail detail = new ReleaseDetail(release, openFirstItem(List.of(release)), "item-1");

        Failure failure = assertInstanceOf(Failure.class, navigator.next(detail, ""));

        assertEquals(ErrorKind.TRANSPORT, failure.error().getKind());
        assertSame(detail, failure.parent());
    }

    @Test
    void testMalformedFileUrlIsTransportFailure() {
        Release release = withFiles("r1", List.of(new ReleaseFile("ftp://example.com/a.jar", "a.jar", 1, true)),
                List.of());
        ReleaseDetail detail = new ReleaseDetail(release, openFirstItem(List.of(release)), "item-1");

        Failure failure = assertInstanceOf(Failure.class, navigator.next(detail, ""));

        assertEquals(ErrorKind.TRANSPORT, failure.error().getKind());
        assertSame(detail, failure.parent());
    }

    @Test
    void testOtherInputLeavesReleaseDetail() {
        Release release = release("r1", Maturity.STABLE, List.of("1.20.1"), List.of("fabric"));
        ItemDetail itemDetail = openFirstItem(List.of(release));
        ReleaseDetail detail = new ReleaseDetail(release, itemDetail, "item-1");

        assertSame(itemDetail, navigator.next(detail, "q"));
        assertSame(itemDetail, navigator.next(detail, "nope"));
    }

    // --- Message, failure, unexpected errors ---

    @Test
    void testMessageReturnsToParent() {
        Results results = search("sodium");

        assertSame(results, navigator.next(new Message("hi", results), "anything"));
    }

    @Test
    void testUnexpectedExceptionBecomesInternalFailure() {
        FakeGateway broken = new FakeGateway() {
            @Override
            public ResultPage<Item> search(CompiledQuery query) {
                throw new IllegalStateException("boom");
            }
        };
        Navigator nav = new Navigator(broken, new QueryCompiler(PAGE_SIZE),
                new DownloadService(new FileDownloader(new HttpUtils.Options("test", 1000, 1000), 4), downloadRoot),
                DownloadProgressListener.NONE);

        Search search = new Search();
        Failure failure = assertInstanceOf(Failure.class, nav.next(search, "sodium"));

        assertEquals(ErrorKind.INTERNAL, failure.error().getKind());
        assertSame(search, failure.parent());
    }
}
