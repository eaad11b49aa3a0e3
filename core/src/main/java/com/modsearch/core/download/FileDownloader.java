package com.modsearch.core.download;

import com.modsearch.common.model.ReleaseFile;
import com.modsearch.common.util.HttpUtils;
import com.modsearch.core.error.ModSearchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Streams one remote file to disk in fixed-size chunks.
 * <p>
 * Read failures are {@code TRANSPORT} errors, write failures {@code RESOURCE} errors.
 * A partially written file is left in place.
 */
public class FileDownloader {
    private static final Logger logger = LoggerFactory.getLogger(FileDownloader.class);

    private final HttpUtils.Options httpOptions;
    private final int chunkSize;

    public FileDownloader(HttpUtils.Options httpOptions, int chunkSize) {
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be > 0");
        this.httpOptions = httpOptions;
        this.chunkSize = chunkSize;
    }

    /**
     * Downloads {@code file} into {@code targetDir}, creating the directory if needed.
     *
     * @return the written file
     */
    public Path download(ReleaseFile file, Path targetDir, DownloadProgressListener listener) throws ModSearchException {
        if (file.filename().isEmpty()) {
            throw ModSearchException.resource("Refusing to write a file without a name from " + file.url(), null);
        }
        Path target = targetDir.resolve(file.filename());
        try {
            Files.createDirectories(targetDir);
        } catch (IOException e) {
            throw ModSearchException.resource("Cannot create directory " + targetDir, e);
        }

        logger.info("Starting download: {} | URL: {}", target, file.url());

        HttpURLConnection conn;
        InputStream in;
        try {
            conn = HttpUtils.open(file.url(), httpOptions);
            int status = conn.getResponseCode();
            if (status < 200 || status >= 300) {
                conn.disconnect();
                logger.error("Download HTTP error: {} | URL: {}", status, file.url());
                throw ModSearchException.transport("HTTP " + status + " while downloading " + file.url(), null);
            }
            in = conn.getInputStream();
        } catch (MalformedURLException | IllegalArgumentException e) {
            logger.error("Malformed download URL: {}", file.url());
            throw ModSearchException.transport("Malformed download URL " + file.url(), e);
        } catch (IOException e) {
            throw ModSearchException.transport("Could not connect to " + file.url(), e);
        }

        long written = 0;
        try (InputStream body = in; OutputStream out = openOutput(target)) {
            byte[] buffer = new byte[chunkSize];
            while (true) {
                int count = readChunk(body, buffer, file);
                if (count == -1) break;
                writeChunk(out, buffer, count, target);
                written += count;
                listener.onProgress(file, written, file.size());
            }
        } catch (IOException e) {
            // only close() can end up here
            throw ModSearchException.resource("Failed to finish writing " + target, e);
        } finally {
            conn.disconnect();
        }

        if (file.size() > 0 && written != file.size()) {
            logger.warn("Size mismatch for {}: expected {} bytes, got {}", target, file.size(), written);
        }
        logger.info("Finished download: {} ({} bytes)", target, written);
        return target;
    }

    private OutputStream openOutput(Path target) throws ModSearchException {
        try {
            return Files.newOutputStream(target);
        } catch (IOException e) {
            throw ModSearchException.resource("Cannot open " + target + " for writing", e);
        }
    }

    private int readChunk(InputStream in, byte[] buffer, ReleaseFile file) throws ModSearchException {
        try {
            return in.read(buffer);
        } catch (IOException e) {
            throw ModSearchException.transport("Connection lost while downloading " + file.url(), e);
        }
    }

    private void writeChunk(OutputStream out, byte[] buffer, int count, Path target) throws ModSearchException {
        try {
            out.write(buffer, 0, count);
        } catch (IOException e) {
            throw ModSearchException.resource("Failed to write " + target, e);
        }
    }
}
