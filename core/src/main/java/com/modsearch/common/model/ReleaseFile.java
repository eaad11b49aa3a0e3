package com.modsearch.common.model;

import com.modsearch.common.util.FileNames;

/**
 * A downloadable file attached to a release.
 */
public record ReleaseFile(
    String url,
    String filename,    // Basename only, never contains directory components
    long size,          // Expected size in bytes
    boolean primary
) {
    public ReleaseFile {
        filename = FileNames.basename(filename);
    }

    public ReleaseFile asPrimary() {
        return primary ? this : new ReleaseFile(url, filename, size, true);
    }
}
