package com.tyron.nsedit.core.settings;

import com.tyron.nsedit.api.settings.Configuration;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link Configuration} backed by a map. Setting a null value removes the key.
 */
public class MapConfiguration implements Configuration {

    private final Map<String, String> properties = new ConcurrentHashMap<>();

    @Override
    public String getProperty(String key) {
        return properties.get(key);
    }

    @Override
    public String getProperty(String key, String defaultValue) {
        return properties.getOrDefault(key, defaultValue);
    }

    @Override
    public void setProperty(String key, String value) {
        if (value == null) {
            properties.remove(key);
        } else {
            properties.put(key, value);
        }
    }

    public Map<String, String> asMap() {
        return Map.copyOf(properties);
    }
}
