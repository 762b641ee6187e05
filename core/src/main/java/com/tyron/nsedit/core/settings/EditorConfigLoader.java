package com.tyron.nsedit.core.settings;

import com.tyron.nsedit.api.settings.Configuration;
import com.tyron.nsedit.api.settings.LanguageOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads editor configuration (nsedit.yaml / nsedit.yml) into a {@link Configuration}.
 * <p>
 * Recognized layout:
 * <pre>
 * properties:
 *   key: value
 * languages:
 *   newspeak:
 *     indentUnit: 4
 * </pre>
 * Language entries become {@link LanguageOptions} keys. Unknown top-level keys are ignored.
 */
public final class EditorConfigLoader {

    private static final Logger LOG = Logger.getLogger(EditorConfigLoader.class.getName());

    public static final String PROPERTIES_PREFIX = "nsedit.properties.";

    private final Configuration configuration;

    public EditorConfigLoader(Configuration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    /**
     * Loads {@code nsedit.yaml} (or {@code nsedit.yml}) from the given directory if present.
     *
     * @return true if a file was found and parsed
     */
    public boolean loadFromDirectory(Path directory) {
        Path config = directory.resolve("nsedit.yaml");
        if (!Files.isRegularFile(config)) {
            config = directory.resolve("nsedit.yml");
        }
        if (!Files.isRegularFile(config)) return false;

        try (InputStream in = Files.newInputStream(config)) {
            return load(in);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "config action=skip reason=unreadable file=" + config, e);
            return false;
        }
    }

    /**
     * @return true if the stream held a YAML mapping
     */
    public boolean load(InputStream in) {
        Object doc;
        try {
            doc = new Yaml().load(in);
        } catch (YAMLException e) {
            LOG.log(Level.WARNING, "config action=skip reason=malformedYaml", e);
            return false;
        }
        if (!(doc instanceof Map<?, ?> map)) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("config action=skip reason=notAMapping");
            }
            return false;
        }

        // properties: {k: v}
        Object props = map.get("properties");
        if (props instanceof Map<?, ?> propsMap) {
            for (Map.Entry<?, ?> e : propsMap.entrySet()) {
                if (e.getKey() == null) continue;
                configuration.setProperty(PROPERTIES_PREFIX + e.getKey(), stringValue(e.getValue()));
            }
        }

        // languages: {id: {k: v}}
        Object languages = map.get("languages");
        if (languages instanceof Map<?, ?> languagesMap) {
            for (Map.Entry<?, ?> language : languagesMap.entrySet()) {
                if (language.getKey() == null) continue;
                String id = String.valueOf(language.getKey());
                if (id.isBlank() || !(language.getValue() instanceof Map<?, ?> options)) continue;

                for (Map.Entry<?, ?> option : options.entrySet()) {
                    if (option.getKey() == null) continue;
                    String key = String.valueOf(option.getKey());
                    if (key.isBlank()) continue;
                    configuration.setProperty(LanguageOptions.keyOf(id, key), stringValue(option.getValue()));
                }
            }
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("config action=load keys=" + map.keySet());
        }
        return true;
    }

    private static String stringValue(Object value) {
        return value != null ? String.valueOf(value) : "";
    }
}
