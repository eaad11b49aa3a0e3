package com.modsearch.plugins.modrinth;

import com.modsearch.api.ContentGateway;
import com.modsearch.api.ModSearchPlugin;
import com.modsearch.core.Kernel;
import com.modsearch.core.config.Configuration;
import com.modsearch.plugins.modrinth.internal.ModrinthGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Modrinth plugin: registers a {@link ContentGateway} backed by the Modrinth API v2.
 */
public class ModrinthPlugin implements ModSearchPlugin {
    private static final Logger logger = LoggerFactory.getLogger(ModrinthPlugin.class);

    public static final String NAME = "Modrinth";
    public static final String SETTING_API_BASE_URL = "api_base_url";
    public static final String DEFAULT_API_BASE_URL = "https://api.modrinth.com/v2";

    private Kernel kernel;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public void onEnable(Kernel kernel) {
        this.kernel = kernel;
        Configuration config = kernel.getConfig();
        setupDefaultSettings(config);

        String baseUrl = config.getPluginSetting(NAME, SETTING_API_BASE_URL, DEFAULT_API_BASE_URL);
        ContentGateway gateway = new ModrinthGateway(baseUrl, config.httpOptions());
        kernel.registerService(ContentGateway.class, gateway);

        logger.info("Modrinth plugin enabled (v{}) against {}", getVersion(), baseUrl);
    }

    @Override
    public void onDisable() {
        if (kernel != null) {
            kernel.unregisterService(ContentGateway.class);
        }
        logger.info("Modrinth plugin disabled");
    }

    private void setupDefaultSettings(Configuration config) {
        if (config.getPluginSetting(NAME, SETTING_API_BASE_URL, null) == null) {
            config.setPluginSetting(NAME, SETTING_API_BASE_URL, DEFAULT_API_BASE_URL);
        }
    }
}
