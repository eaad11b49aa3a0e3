package com.modsearch.core.download;

import com.modsearch.common.model.Release;
import com.modsearch.common.model.ReleaseFile;
import com.modsearch.common.util.FileNames;
import com.modsearch.core.error.ModSearchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Downloads the files of a release into {@code <downloadRoot>/<itemSlug>/}.
 * Files are fetched one after another; the first failure aborts the batch and already written files stay.
 */
public class DownloadService {
    private static final Logger logger = LoggerFactory.getLogger(DownloadService.class);

    private final FileDownloader downloader;
    private final Path downloadRoot;

    public DownloadService(FileDownloader downloader, Path downloadRoot) {
        this.downloader = downloader;
        this.downloadRoot = downloadRoot;
    }

    public Path getDownloadRoot() {
        return downloadRoot;
    }

    public Path targetDirectory(String itemSlug) {
        return downloadRoot.resolve(FileNames.sanitize(itemSlug));
    }

    public Path downloadPrimary(String itemSlug, Release release, DownloadProgressListener listener)
            throws ModSearchException {
        ReleaseFile primary = release.getPrimaryFile();
        if (primary == null) {
            throw ModSearchException.userInput("Release " + release.getVersionNumber() + " has no files");
        }
        return downloader.download(primary, targetDirectory(itemSlug), listener);
    }

    public List<Path> downloadAll(String itemSlug, Release release, DownloadProgressListener listener)
            throws ModSearchException {
        if (release.getFiles().isEmpty()) {
            throw ModSearchException.userInput("Release " + release.getVersionNumber() + " has no files");
        }
        Path dir = targetDirectory(itemSlug);
        List<Path> written = new ArrayList<>();
        for (ReleaseFile file : release.getFiles()) {
            try {
                written.add(downloader.download(file, dir, listener));
            } catch (ModSearchException e) {
                logger.warn("Batch download of {} aborted at {} after {} file(s)",
                        release.getVersionNumber(), file.filename(), written.size());
                throw e;
            }
        }
        return written;
    }
}
