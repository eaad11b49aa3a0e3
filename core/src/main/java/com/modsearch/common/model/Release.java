package com.modsearch.common.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One published version of an item, with its files and required dependencies.
 * Dependency items are resolved on demand and cached on the instance.
 */
public final class Release {
    private final String id;
    private final Maturity maturity;
    private final String versionNumber;
    private final String name;
    private final long downloads;
    private final List<String> targetVersions;
    private final List<String> loaders;
    private final List<ReleaseFile> files;
    private final List<String> requiredDependencyIds;

    private List<Item> resolvedDependencies;

    public Release(String id, Maturity maturity, String versionNumber, String name, long downloads,
                   List<String> targetVersions, List<String> loaders, List<ReleaseFile> files,
                   List<String> requiredDependencyIds) {
        this.id = id;
        this.maturity = maturity;
        this.versionNumber = versionNumber;
        this.name = name;
        this.downloads = downloads;
        this.targetVersions = List.copyOf(targetVersions);
        this.loaders = List.copyOf(loaders);
        this.files = markPrimary(files);
        this.requiredDependencyIds = List.copyOf(requiredDependencyIds);
    }

    // Exactly one file ends up primary; the first one wins when the source marks none.
    private static List<ReleaseFile> markPrimary(List<ReleaseFile> source) {
        List<ReleaseFile> result = new ArrayList<>(source.size());
        boolean seenPrimary = false;
        for (ReleaseFile file : source) {
            if (file.primary() && !seenPrimary) {
                seenPrimary = true;
                result.add(file);
            } else if (file.primary()) {
                result.add(new ReleaseFile(file.url(), file.filename(), file.size(), false));
            } else {
                result.add(file);
            }
        }
        if (!seenPrimary && !result.isEmpty()) {
            result.set(0, result.get(0).asPrimary());
        }
        return Collections.unmodifiableList(result);
    }

    public String getId() {
        return id;
    }

    public Maturity getMaturity() {
        return maturity;
    }

    public String getVersionNumber() {
        return versionNumber;
    }

    public String getName() {
        return name;
    }

    public long getDownloads() {
        return downloads;
    }

    public List<String> getTargetVersions() {
        return targetVersions;
    }

    public List<String> getLoaders() {
        return loaders;
    }

    public List<ReleaseFile> getFiles() {
        return files;
    }

    /**
     * The primary file, or null if the release has no files at all.
     */
    public ReleaseFile getPrimaryFile() {
        for (ReleaseFile file : files) {
            if (file.primary()) return file;
        }
        return null;
    }

    public List<String> getRequiredDependencyIds() {
        return requiredDependencyIds;
    }

    public boolean hasRequiredDependencies() {
        return !requiredDependencyIds.isEmpty();
    }

    /**
     * Cached dependency items, or null if they were not resolved yet.
     */
    public synchronized List<Item> getResolvedDependencies() {
        return resolvedDependencies;
    }

    public synchronized void setResolvedDependencies(List<Item> items) {
        this.resolvedDependencies = List.copyOf(items);
    }

    @Override
    public String toString() {
        return "Release(" + id + ", " + maturity + ", " + versionNumber + ", " + name + ", ...)";
    }
}
