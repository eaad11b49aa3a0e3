package com.modsearch.plugins.modrinth.internal;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.modsearch.api.ContentGateway;
import com.modsearch.common.model.Item;
import com.modsearch.common.model.Release;
import com.modsearch.common.model.ResultPage;
import com.modsearch.common.util.HttpUtils;
import com.modsearch.core.error.ModSearchException;
import com.modsearch.core.query.CompiledQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Modrinth API v2 client.
 * Docs: https://docs.modrinth.com/api/
 */
public class ModrinthGateway implements ContentGateway {
    private static final Logger logger = LoggerFactory.getLogger(ModrinthGateway.class);

    private final String baseUrl;
    private final HttpUtils.Options httpOptions;

    public ModrinthGateway(String baseUrl, HttpUtils.Options httpOptions) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpOptions = httpOptions;
    }

    @Override
    public String getName() {
        return "modrinth";
    }

    @Override
    public String getDisplayName() {
        return "Modrinth";
    }

    @Override
    public ResultPage<Item> search(CompiledQuery query) throws ModSearchException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query.term());
        params.put("offset", String.valueOf(query.offset()));
        params.put("limit", String.valueOf(query.pageSize()));
        query.sortDirective().ifPresent(sort -> params.put("index", sort.getIndexName()));
        query.facetsJson().ifPresent(facets -> params.put("facets", facets));
        String url = HttpUtils.withQuery(baseUrl + "/search", params);

        long start = System.nanoTime();
        HttpUtils.Response response = send(url);
        Duration latency = Duration.ofNanos(System.nanoTime() - start);

        JsonObject data = asObject(parse(response, url), url);
        try {
            List<Item> items = new ArrayList<>();
            for (JsonElement hit : data.getAsJsonArray("hits")) {
                items.add(ModrinthJsonMapper.itemFromSearchHit(hit.getAsJsonObject()));
            }
            long totalHits = data.get("total_hits").getAsLong();
            int pageCount = ResultPage.computePageCount(totalHits, query.pageSize());
            logger.debug("Search '{}' page {} -> {} hits in {} ms", query.term(), query.pageIndex(), totalHits,
                    latency.toMillis());
            return new ResultPage<>(items, query.pageIndex(), pageCount, totalHits, latency);
        } catch (RuntimeException e) {
            throw malformed(url, e);
        }
    }

    @Override
    public List<Release> listReleases(String itemId) throws ModSearchException {
        String url = baseUrl + "/project/" + HttpUtils.encodePathSegment(itemId) + "/version";
        JsonElement data = parse(send(url), url);
        try {
            JsonArray array = data.getAsJsonArray();
            List<Release> releases = new ArrayList<>(array.size());
            for (JsonElement element : array) {
                releases.add(ModrinthJsonMapper.release(element.getAsJsonObject()));
            }
            logger.debug("Fetched {} releases for {}", releases.size(), itemId);
            return releases;
        } catch (RuntimeException e) {
            throw malformed(url, e);
        }
    }

    @Override
    public Item getItem(String idOrSlug) throws ModSearchException {
        String url = baseUrl + "/project/" + HttpUtils.encodePathSegment(idOrSlug);
        JsonObject data = asObject(parse(send(url), url), url);
        try {
            return ModrinthJsonMapper.itemFromProject(data);
        } catch (RuntimeException e) {
            throw malformed(url, e);
        }
    }

    // --- Internal Helpers ---

    private HttpUtils.Response send(String url) throws ModSearchException {
        try {
            return HttpUtils.get(url, httpOptions);
        } catch (IOException e) {
            logger.error("HTTP GET failed: {}", url, e);
            throw ModSearchException.transport("Request to " + url + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Parses the body. An {@code {"error": ..., "description": ...}} payload is an application error,
     * anything else that is not a 2xx JSON answer is a transport error.
     */
    private JsonElement parse(HttpUtils.Response response, String url) throws ModSearchException {
        JsonElement element;
        try {
            element = JsonParser.parseString(response.body());
        } catch (JsonParseException e) {
            if (!response.isSuccess()) {
                throw ModSearchException.transport("HTTP " + response.status() + " from " + url, e);
            }
            throw malformed(url, e);
        }

        if (element.isJsonObject() && element.getAsJsonObject().has("error")) {
            JsonObject error = element.getAsJsonObject();
            String code = ModrinthJsonMapper.string(error, "error", "unknown_error");
            String description = ModrinthJsonMapper.string(error, "description", "");
            logger.warn("Modrinth API error {} ({}): {}", code, response.status(), description);
            throw ModSearchException.remote(code, description);
        }
        if (!response.isSuccess()) {
            throw ModSearchException.transport("HTTP " + response.status() + " from " + url, null);
        }
        return element;
    }

    private ModSearchException malformed(String url, Exception cause) {
        logger.error("Malformed response from {}", url, cause);
        return ModSearchException.transport("Malformed response from " + url, cause);
    }

    private JsonObject asObject(JsonElement element, String url) throws ModSearchException {
        if (!element.isJsonObject()) {
            throw malformed(url, new IllegalStateException("Expected a JSON object but got " + element));
        }
        return element.getAsJsonObject();
    }
}
