package com.tyron.nsedit.api.settings;

/**
 * Generic configuration wrapper (Key-Value store).
 */
public interface Configuration {
    String getProperty(String key);
    String getProperty(String key, String defaultValue);

    void setProperty(String key, String value);
}
