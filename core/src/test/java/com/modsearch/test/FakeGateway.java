package com.modsearch.test;

import com.modsearch.api.ContentGateway;
import com.modsearch.common.model.Item;
import com.modsearch.common.model.Release;
import com.modsearch.common.model.ResultPage;
import com.modsearch.core.error.ModSearchException;
import com.modsearch.core.query.CompiledQuery;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory gateway serving a fixed item list, paginated like the real API.
 */
public class FakeGateway implements ContentGateway {
    private final List<Item> items = new ArrayList<>();
    private final Map<String, List<Release>> releases = new HashMap<>();
    private final Map<String, Item> lookups = new HashMap<>();

    public final List<CompiledQuery> searches = new ArrayList<>();
    public final List<String> releaseRequests = new ArrayList<>();
    public final List<String> itemRequests = new ArrayList<>();

    public ModSearchException searchFailure;
    public ModSearchException releaseFailure;
    public ModSearchException lookupFailure;

    public FakeGateway withItems(int count) {
        for (int i = 1; i <= count; i++) {
            items.add(Item.builder("id" + i, "item-" + i).title("Item " + i).kind("mod").build());
        }
        return this;
    }

    public FakeGateway withReleases(String itemId, List<Release> list) {
        releases.put(itemId, list);
        return this;
    }

    public FakeGateway withLookup(Item item) {
        lookups.put(item.getId(), item);
        return this;
    }

    @Override
    public String getName() {
        return "fake";
    }

    @Override
    public String getDisplayName() {
        return "Fake";
    }

    @Override
    public ResultPage<Item> search(CompiledQuery query) throws ModSearchException {
        searches.add(query);
        if (searchFailure != null) throw searchFailure;
        int from = Math.min(query.offset(), items.size());
        int to = Math.min(from + query.pageSize(), items.size());
        return new ResultPage<>(items.subList(from, to), query.pageIndex(),
                ResultPage.computePageCount(items.size(), query.pageSize()), items.size(), Duration.ofMillis(5));
    }

    @Override
    public List<Release> listReleases(String itemId) throws ModSearchException {
        releaseRequests.add(itemId);
        if (releaseFailure != null) throw releaseFailure;
        return releases.getOrDefault(itemId, List.of());
    }

    @Override
    public Item getItem(String idOrSlug) throws ModSearchException {
        itemRequests.add(idOrSlug);
        if (lookupFailure != null) throw lookupFailure;
        Item item = lookups.get(idOrSlug);
        if (item == null) throw ModSearchException.remote("not_found", "The requested project was not found");
        return item;
    }
}
