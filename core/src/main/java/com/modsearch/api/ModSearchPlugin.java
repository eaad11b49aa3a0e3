package com.modsearch.api;

import com.modsearch.core.Kernel;

/**
 * Extension point discovered through {@link java.util.ServiceLoader}.
 */
public interface ModSearchPlugin {
    // Plugin name, also the key under "plugins" and "pluginConfigs" in config.json
    String getName();

    String getVersion();

    // Called on startup. Register services (e.g. a ContentGateway) here.
    void onEnable(Kernel kernel);

    // Called on shutdown.
    void onDisable();
}
