package com.modsearch.core.release;

import com.modsearch.common.model.Release;

import java.util.List;
import java.util.Optional;

/**
 * Picks a release for "quick download": the most mature release that supports the requested
 * target version and/or loader.
 * <p>
 * Only maturity is compared. Among releases of equal maturity the first one in list order wins.
 */
public final class ReleaseMatcher {

    private ReleaseMatcher() {
    }

    /**
     * @param releases all releases of one item, in API order
     * @param version  required target version, or null
     * @param loader   required loader, or null
     * @return the selected release, or empty if nothing qualifies
     * @throws IllegalArgumentException if both constraints are null
     */
    public static Optional<Release> findBest(List<Release> releases, String version, String loader) {
        if (version == null && loader == null) {
            throw new IllegalArgumentException("At least one of version or loader is required");
        }

        Release best = null;
        for (Release release : releases) {
            if (version != null && !release.getTargetVersions().contains(version)) continue;
            if (loader != null && !release.getLoaders().contains(loader)) continue;

            if (best == null || release.getMaturity().isHigherThan(best.getMaturity())) {
                best = release;
            }
        }
        return Optional.ofNullable(best);
    }

    public static Optional<Release> findBest(List<Release> releases, QuickDownloadRequest request) {
        return findBest(releases, request.version(), request.loader());
    }
}
