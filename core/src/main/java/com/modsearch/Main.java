package com.modsearch;

import ch.qos.logback.classic.Level;
import com.modsearch.api.ContentGateway;
import com.modsearch.core.Kernel;
import com.modsearch.core.config.Configuration;
import com.modsearch.core.console.ConsoleSession;
import com.modsearch.core.download.DownloadService;
import com.modsearch.core.download.FileDownloader;
import com.modsearch.core.navigation.Navigator;
import com.modsearch.core.query.QueryCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        logger.info("Starting ModSearch Client...");
        Kernel kernel = Kernel.getInstance();

        ContentGateway gateway;
        try {
            kernel.start();
            gateway = kernel.requireGateway();
        } catch (IllegalStateException e) {
            logger.error("CRITICAL FAILURE during startup", e);
            System.err.println("Startup failed: " + e.getMessage());
            System.exit(1);
            return;
        }

        Configuration config = kernel.getConfig();
        if (config.debugMode) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.modsearch")).setLevel(Level.DEBUG);
            logger.debug("Debug logging enabled.");
        }
        DownloadService downloads = new DownloadService(
                new FileDownloader(config.httpOptions(), config.downloadChunkSize),
                Path.of(config.downloadPath));
        logger.info("Using {} with page size {}, downloads go to {}",
                gateway.getDisplayName(), config.pageSize, downloads.getDownloadRoot().toAbsolutePath());

        try (ConsoleSession session = new ConsoleSession()) {
            Navigator navigator = new Navigator(gateway, new QueryCompiler(config.pageSize), downloads,
                    session.getRenderer()::renderProgress);
            session.run(navigator);
        } catch (IOException e) {
            logger.error("Terminal failure", e);
            System.err.println("Could not open the terminal: " + e.getMessage());
        } finally {
            kernel.shutdown();
        }
    }
}
