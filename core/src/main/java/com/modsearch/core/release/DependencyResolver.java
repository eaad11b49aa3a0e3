package com.modsearch.core.release;

import com.modsearch.api.ContentGateway;
import com.modsearch.common.model.Item;
import com.modsearch.common.model.Release;
import com.modsearch.core.error.ModSearchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Looks up the items a release requires, one request per dependency, and caches them on the release.
 */
public class DependencyResolver {
    private static final Logger logger = LoggerFactory.getLogger(DependencyResolver.class);

    private final ContentGateway gateway;

    public DependencyResolver(ContentGateway gateway) {
        this.gateway = gateway;
    }

    public List<Item> resolve(Release release) throws ModSearchException {
        List<Item> cached = release.getResolvedDependencies();
        if (cached != null) return cached;

        List<Item> items = new ArrayList<>();
        for (String dependencyId : release.getRequiredDependencyIds()) {
            items.add(gateway.getItem(dependencyId));
        }
        release.setResolvedDependencies(items);
        logger.debug("Resolved {} dependencies for release {}", items.size(), release.getId());
        return release.getResolvedDependencies();
    }
}
