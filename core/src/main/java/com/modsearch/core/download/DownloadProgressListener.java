package com.modsearch.core.download;

import com.modsearch.common.model.ReleaseFile;

/**
 * Receives the running byte count of a download after every chunk.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    DownloadProgressListener NONE = (file, bytesWritten, expectedBytes) -> { };

    void onProgress(ReleaseFile file, long bytesWritten, long expectedBytes);
}
