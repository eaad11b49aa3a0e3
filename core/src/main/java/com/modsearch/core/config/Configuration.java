package com.modsearch.core.config;

import com.modsearch.common.util.HttpUtils;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

public class Configuration {
    // --- Main settings ---
    public boolean debugMode = false;
    public String downloadPath = "downloads";
    public int pageSize = 20;

    // --- HTTP ---
    public String userAgent = "ModSearchClient/1.0";
    public int connectTimeoutMs = 10000;
    public int readTimeoutMs = 30000;
    public int downloadChunkSize = 8192;

    // --- Plugin control ---
    // Key = plugin name, Value = enabled
    public Map<String, Boolean> plugins = new LinkedHashMap<>();

    // Key = plugin name, Value = settings map (e.g. "api_base_url" -> "https://...")
    public Map<String, Map<String, String>> pluginConfigs = new HashMap<>();

    public String getPluginSetting(String pluginName, String key, String defaultValue) {
        if (pluginConfigs == null || !pluginConfigs.containsKey(pluginName))
            return defaultValue;
        return pluginConfigs.get(pluginName).getOrDefault(key, defaultValue);
    }

    public void setPluginSetting(String pluginName, String key, String value) {
        if (pluginConfigs == null) pluginConfigs = new HashMap<>();
        pluginConfigs.computeIfAbsent(pluginName, k -> new HashMap<>()).put(key, value);
    }

    public HttpUtils.Options httpOptions() {
        return new HttpUtils.Options(userAgent, connectTimeoutMs, readTimeoutMs);
    }

    public boolean isPluginEnabled(String pluginName) {
        return plugins == null || plugins.getOrDefault(pluginName, true);
    }
}
