package com.raditha.approx.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads the YAML configuration into a map. An explicit file wins over the bundled
 * {@code explorer.yml}.
 */
public final class SettingsLoader {

    private static final Logger logger = LoggerFactory.getLogger(SettingsLoader.class);

    public static final String DEFAULT_RESOURCE = "explorer.yml";

    private static final YAMLMapper mapper = new YAMLMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private SettingsLoader() {
    }

    /**
     * @param file configuration file, or null for the bundled default
     */
    public static Map<String, Object> load(Path file) throws IOException {
        if (file == null) {
            return loadDefault();
        }
        if (!Files.isRegularFile(file)) {
            throw new IOException("Configuration file not found: " + file);
        }
        logger.debug("Loading configuration from {}", file);
        String content = Files.readString(file, StandardCharsets.UTF_8);
        if (content.isBlank()) {
            return Map.of();
        }
        Map<String, Object> root = mapper.readValue(content, MAP_TYPE);
        return root == null ? Map.of() : root;
    }

    public static Map<String, Object> loadDefault() throws IOException {
        try (InputStream in = SettingsLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.warn("No {} on the classpath, using built-in defaults", DEFAULT_RESOURCE);
                return Map.of();
            }
            Map<String, Object> root = mapper.readValue(in, MAP_TYPE);
            return root == null ? Map.of() : root;
        }
    }
}
