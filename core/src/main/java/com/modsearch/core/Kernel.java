package com.modsearch.core;

import com.modsearch.api.ContentGateway;
import com.modsearch.core.config.ConfigManager;
import com.modsearch.core.config.ConfigValidator;
import com.modsearch.core.config.Configuration;
import com.modsearch.core.plugin.PluginLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the configuration, the plugins and the service registry plugins publish into.
 */
public class Kernel {
    private static final Logger logger = LoggerFactory.getLogger(Kernel.class);
    private static Kernel instance;

    private final File baseDir;
    private final ConfigManager configManager;
    private final PluginLoader pluginLoader;
    private final AtomicBoolean running = new AtomicBoolean(false);

    // Plugins put their instances here (e.g. the ContentGateway)
    private final Map<Class<?>, Object> services = new ConcurrentHashMap<>();

    public Kernel(File baseDir) {
        this.baseDir = baseDir;
        this.configManager = new ConfigManager(new File(baseDir, "config"));
        this.pluginLoader = new PluginLoader(this, new File(baseDir, "plugins"));
    }

    public static synchronized Kernel getInstance() {
        if (instance == null)
            instance = new Kernel(new File("."));
        return instance;
    }

    /**
     * Validates the configuration and enables all plugins.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void start() {
        if (running.get())
            return;
        logger.info("Kernel booting from {}", baseDir.getAbsolutePath());

        new ConfigValidator().validateAndReport(getConfig());
        pluginLoader.loadPlugins();
        running.set(true);

        logger.info("Kernel active with {} plugin(s).", pluginLoader.getPlugins().size());
    }

    public void shutdown() {
        if (!running.getAndSet(false))
            return;
        pluginLoader.disableAll();
        services.clear();
        logger.info("Kernel stopped.");
    }

    // --- SERVICE API ---

    public <T> void registerService(Class<T> clazz, T service) {
        services.put(clazz, service);
        logger.info("Service registered: {} -> {}", clazz.getSimpleName(), service.getClass().getSimpleName());
    }

    public <T> void unregisterService(Class<T> clazz) {
        services.remove(clazz);
        logger.info("Service unregistered: {}", clazz.getSimpleName());
    }

    public <T> T getService(Class<T> clazz) {
        return clazz.cast(services.get(clazz));
    }

    /**
     * @throws IllegalStateException if no plugin registered a gateway
     */
    public ContentGateway requireGateway() {
        ContentGateway gateway = getService(ContentGateway.class);
        if (gateway == null) {
            throw new IllegalStateException("No ContentGateway registered. Is a gateway plugin on the classpath?");
        }
        return gateway;
    }

    // --- Getters ---

    public ConfigManager getConfigManager() {
        return configManager;
    }

    public Configuration getConfig() {
        return configManager.getConfig();
    }

    public PluginLoader getPluginLoader() {
        return pluginLoader;
    }

    public boolean isRunning() {
        return running.get();
    }
}
