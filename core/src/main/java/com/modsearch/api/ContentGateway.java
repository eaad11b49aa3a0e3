package com.modsearch.api;

import com.modsearch.common.model.Item;
import com.modsearch.common.model.Release;
import com.modsearch.common.model.ResultPage;
import com.modsearch.core.error.ModSearchException;
import com.modsearch.core.query.CompiledQuery;

import java.util.List;

/**
 * Access to a remote content-search API.
 * Plugins register an implementation in the kernel's service registry.
 */
public interface ContentGateway {

    /**
     * Provider identifier (e.g. "modrinth").
     */
    String getName();

    /**
     * Human-readable display name (e.g. "Modrinth").
     */
    String getDisplayName();

    /**
     * Runs a compiled search and returns the requested page.
     *
     * @throws ModSearchException {@code REMOTE_APPLICATION} if the API reports an error,
     *                            {@code TRANSPORT} on network failures or malformed responses
     */
    ResultPage<Item> search(CompiledQuery query) throws ModSearchException;

    /**
     * Lists every release of an item, newest first as delivered by the API. Not paginated.
     *
     * @param itemId Provider-specific item ID
     */
    List<Release> listReleases(String itemId) throws ModSearchException;

    /**
     * Fetches a single item.
     *
     * @param idOrSlug item ID or slug
     */
    Item getItem(String idOrSlug) throws ModSearchException;
}
