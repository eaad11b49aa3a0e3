package com.modsearch.core.plugin;

import com.modsearch.api.ModSearchPlugin;
import com.modsearch.core.Kernel;
import com.modsearch.core.config.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Discovers {@link ModSearchPlugin}s on the application classpath and in {@code *.jar} files of the
 * plugin directory, and enables those not switched off in the configuration.
 */
public class PluginLoader {
    private static final Logger logger = LoggerFactory.getLogger(PluginLoader.class);

    private final Kernel kernel;
    private final File pluginDir;

    private final Map<String, ModSearchPlugin> activePlugins = new ConcurrentHashMap<>();
    private final Map<String, URLClassLoader> pluginClassLoaders = new ConcurrentHashMap<>();

    public PluginLoader(Kernel kernel, File pluginDir) {
        this.kernel = kernel;
        this.pluginDir = pluginDir;
    }

    public void loadPlugins() {
        Configuration config = kernel.getConfig();

        // 1. Classpath plugins
        try {
            for (ModSearchPlugin plugin : ServiceLoader.load(ModSearchPlugin.class, getClass().getClassLoader())) {
                loadPluginSafe(plugin, config);
            }
        } catch (ServiceConfigurationError e) {
            logger.error("Broken plugin registration on classpath", e);
        }

        // 2. External plugin jars
        File[] jars = pluginDir.isDirectory() ? pluginDir.listFiles((dir, name) -> name.endsWith(".jar")) : null;
        if (jars != null && jars.length > 0) {
            Arrays.sort(jars, Comparator.comparing(File::getName));
            for (File jar : jars) {
                try {
                    loadPluginFromFile(jar, config);
                } catch (IOException | ServiceConfigurationError e) {
                    logger.error("Failed to load plugin jar: {}", jar.getName(), e);
                }
            }
        }

        kernel.getConfigManager().saveConfig();
    }

    public boolean loadPluginFromFile(File jarFile, Configuration config) throws IOException {
        URL[] urls = new URL[] { jarFile.toURI().toURL() };
        URLClassLoader ucl = new URLClassLoader(urls, getClass().getClassLoader());

        boolean anyLoaded = false;
        for (ModSearchPlugin plugin : ServiceLoader.load(ModSearchPlugin.class, ucl)) {
            if (loadPluginSafe(plugin, config)) {
                pluginClassLoaders.put(plugin.getName(), ucl);
                anyLoaded = true;
            }
        }
        if (!anyLoaded) {
            ucl.close();
        }
        return anyLoaded;
    }

    public void unloadPlugin(String name) {
        ModSearchPlugin plugin = activePlugins.remove(name);
        if (plugin == null) {
            logger.warn("Cannot unload unknown plugin: {}", name);
            return;
        }

        try {
            logger.info("Disabling plugin: {}", name);
            plugin.onDisable();
        } catch (RuntimeException e) {
            logger.error("Error during onDisable for {}", name, e);
        }

        URLClassLoader ucl = pluginClassLoaders.remove(name);
        if (ucl != null) {
            try {
                ucl.close();
            } catch (IOException e) {
                logger.warn("Failed to close ClassLoader for {}", name, e);
            }
        }
        logger.info("Plugin {} unloaded.", name);
    }

    private boolean loadPluginSafe(ModSearchPlugin plugin, Configuration config) {
        String name = plugin.getName();

        if (activePlugins.containsKey(name)) {
            logger.warn("Plugin {} is already loaded. Skipping duplicate.", name);
            return false;
        }

        if (!config.plugins.containsKey(name)) {
            logger.info("New plugin discovered: {}", name);
            config.plugins.put(name, true);
        }

        if (!config.isPluginEnabled(name)) {
            logger.info("Plugin {} is disabled in config.", name);
            return false;
        }

        try {
            logger.info("Loading plugin: {} v{}", name, plugin.getVersion());
            plugin.onEnable(kernel);
            activePlugins.put(name, plugin);
            return true;
        } catch (RuntimeException e) {
            logger.error("Failed to enable plugin: {}", name, e);
            return false;
        }
    }

    public void disableAll() {
        for (String name : new ArrayList<>(activePlugins.keySet())) {
            unloadPlugin(name);
        }
    }

    public Collection<ModSearchPlugin> getPlugins() {
        return List.copyOf(activePlugins.values());
    }
}
