package com.tyron.nsedit.api.settings;

import java.util.Objects;

/**
 * Language-scoped options view backed by a {@link Configuration}.
 */
public final class LanguageOptions {

    public static final String PREFIX = "nsedit.language.";
    public static final String OPTIONS_SEGMENT = ".option.";

    private final Configuration configuration;
    private final String languageId;

    public LanguageOptions(Configuration configuration, String languageId) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        if (languageId == null || languageId.isBlank()) {
            throw new IllegalArgumentException("languageId is blank");
        }
        this.languageId = languageId.trim();
    }

    public static String keyOf(String languageId, String key) {
        return PREFIX + languageId.trim() + OPTIONS_SEGMENT + key.trim();
    }

    public String getLanguageId() {
        return languageId;
    }

    public String get(String key) {
        return configuration.getProperty(toKey(key));
    }

    public String get(String key, String defaultValue) {
        return configuration.getProperty(toKey(key), defaultValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        return Boolean.parseBoolean(v.trim());
    }

    /**
     * @throws NumberFormatException if the stored value is not an integer
     */
    public int getInt(String key, int defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        return Integer.parseInt(v.trim());
    }

    public void set(String key, String value) {
        configuration.setProperty(toKey(key), value);
    }

    private String toKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key is blank");
        }
        return keyOf(languageId, key);
    }
}
