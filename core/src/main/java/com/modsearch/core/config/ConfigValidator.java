package com.modsearch.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates configuration on startup so that bad settings fail early instead of mid-session.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    // Upper bound of the search endpoint's "limit" parameter
    public static final int MAX_PAGE_SIZE = 100;

    public static class ValidationError {
        public final String message;
        public final String severity; // ERROR, WARNING

        public ValidationError(String message, String severity) {
            this.message = message;
            this.severity = severity;
        }

        public boolean isError() {
            return "ERROR".equals(severity);
        }

        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }
    }

    public List<ValidationError> validate(Configuration config) {
        List<ValidationError> errors = new ArrayList<>();

        validateDirectories(config, errors);
        validatePaging(config, errors);
        validateHttp(config, errors);
        validatePluginUrls(config, errors);
        validateDiskSpace(config, errors);

        return errors;
    }

    private void validateDirectories(Configuration config, List<ValidationError> errors) {
        if (config.downloadPath == null || config.downloadPath.isBlank()) {
            errors.add(new ValidationError("downloadPath must not be empty", "ERROR"));
            return;
        }
        File dlPath = new File(config.downloadPath);
        if (!dlPath.exists()) {
            if (!dlPath.mkdirs()) {
                errors.add(new ValidationError("Cannot create download directory: " + config.downloadPath, "ERROR"));
            } else {
                logger.info("Created download directory: {}", config.downloadPath);
            }
        } else if (!dlPath.isDirectory()) {
            errors.add(new ValidationError("Download path is not a directory: " + config.downloadPath, "ERROR"));
        }
    }

    private void validatePaging(Configuration config, List<ValidationError> errors) {
        if (config.pageSize < 1 || config.pageSize > MAX_PAGE_SIZE) {
            errors.add(new ValidationError(
                    "pageSize must be between 1 and " + MAX_PAGE_SIZE + " but was " + config.pageSize, "ERROR"));
        }
    }

    private void validateHttp(Configuration config, List<ValidationError> errors) {
        if (config.connectTimeoutMs <= 0 || config.readTimeoutMs <= 0) {
            errors.add(new ValidationError("HTTP timeouts must be positive", "ERROR"));
        }
        if (config.downloadChunkSize <= 0) {
            errors.add(new ValidationError("downloadChunkSize must be positive", "ERROR"));
        }
        if (config.userAgent == null || config.userAgent.isBlank()) {
            errors.add(new ValidationError("No userAgent configured - the API may reject requests", "WARNING"));
        }
    }

    // Every plugin setting ending in "_url" must be an absolute http(s) URL
    private void validatePluginUrls(Configuration config, List<ValidationError> errors) {
        if (config.pluginConfigs == null) return;
        for (Map.Entry<String, Map<String, String>> plugin : config.pluginConfigs.entrySet()) {
            for (Map.Entry<String, String> setting : plugin.getValue().entrySet()) {
                if (!setting.getKey().endsWith("_url")) continue;
                if (!isHttpUrl(setting.getValue())) {
                    errors.add(new ValidationError(String.format("%s.%s is not a valid http(s) URL: %s",
                            plugin.getKey(), setting.getKey(), setting.getValue()), "ERROR"));
                }
            }
        }
    }

    private static boolean isHttpUrl(String value) {
        if (value == null) return false;
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            return uri.getHost() != null && ("http".equals(scheme) || "https".equals(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private void validateDiskSpace(Configuration config, List<ValidationError> errors) {
        File root = new File(config.downloadPath == null ? "." : config.downloadPath);
        if (!root.exists()) return;
        long freeMB = root.getUsableSpace() / 1024 / 1024;

        if (freeMB < 512) {
            errors.add(new ValidationError(
                    String.format("Low disk space: only %d MB free in %s", freeMB, root.getPath()),
                    "WARNING"));
        }
    }

    /**
     * Validate and report to the log.
     *
     * @throws IllegalStateException if any ERROR was found
     */
    public void validateAndReport(Configuration config) {
        List<ValidationError> errors = validate(config);

        int errorCount = 0;
        int warningCount = 0;

        for (ValidationError error : errors) {
            if (error.isError()) {
                logger.error("Config Error: {}", error.message);
                errorCount++;
            } else {
                logger.warn("Config Warning: {}", error.message);
                warningCount++;
            }
        }

        if (errorCount > 0 || warningCount > 0) {
            logger.warn("Configuration validation: {} errors, {} warnings", errorCount, warningCount);
        } else {
            logger.info("Configuration validation passed");
        }

        if (errorCount > 0) {
            List<String> messages = new ArrayList<>();
            for (ValidationError error : errors) {
                if (error.isError()) messages.add(error.message);
            }
            throw new IllegalStateException(String.format(
                    "Configuration validation failed with %d error(s): %s", errorCount, String.join("; ", messages)));
        }
    }
}
