package com.raditha.approx.config;

import com.raditha.approx.generation.GenerationStrategy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds validated configuration records from the YAML map with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > YAML > defaults
 */
public final class ExplorerSettings {

    private static final String EXPLORER_KEY = "explorer";
    private static final String APPLICATIONS_KEY = "applications";

    private ExplorerSettings() {
    }

    /**
     * Values given on the command line. A null field means "not given".
     */
    public record Overrides(
            Integer workers,
            GenerationStrategy strategy,
            Integer variantLimit,
            Double threshold,
            Double alpha,
            Integer timeoutSeconds,
            Path storageRoot) {

        public static Overrides none() {
            return new Overrides(null, null, null, null, null, null, null);
        }
    }

    public static ExplorerConfig loadConfig(Map<String, Object> root, Overrides cli) {
        ExplorerConfig defaults = ExplorerConfig.defaults();
        Map<String, Object> config = getMap(root, EXPLORER_KEY);
        Overrides overrides = cli == null ? Overrides.none() : cli;

        int workers = overrides.workers() != null ? overrides.workers()
                : getInt(config, "workers", defaults.workers());
        GenerationStrategy strategy = overrides.strategy() != null ? overrides.strategy()
                : GenerationStrategy.fromString(getString(config, "strategy", defaults.strategy().toCliString()));
        int limit = overrides.variantLimit() != null ? overrides.variantLimit()
                : getInt(config, "variant_limit", defaults.variantLimit());
        double threshold = overrides.threshold() != null ? overrides.threshold()
                : getDouble(config, "threshold", defaults.threshold());
        double alpha = overrides.alpha() != null ? overrides.alpha()
                : getDouble(config, "alpha", defaults.alpha());
        int timeout = overrides.timeoutSeconds() != null ? overrides.timeoutSeconds()
                : getInt(config, "timeout_seconds", defaults.timeoutSeconds());
        Path storageRoot = overrides.storageRoot() != null ? overrides.storageRoot()
                : Path.of(getString(config, "storage_root", defaults.storageRoot().toString()));

        return new ExplorerConfig(
                workers,
                strategy,
                limit,
                threshold,
                alpha,
                getInt(config, "checkpoint_interval", defaults.checkpointInterval()),
                timeout,
                storageRoot,
                getString(config, "annotation_marker", defaults.annotationMarker()),
                buildToolchain(config));
    }

    /**
     * Load one application. Relative paths resolve against {@code baseDir}.
     *
     * @throws IllegalArgumentException if the application is unknown or its source is missing
     */
    public static ApplicationConfig loadApplication(Map<String, Object> root, String name, Path baseDir) {
        Map<String, Object> applications = getMap(root, APPLICATIONS_KEY);
        Object raw = applications.get(name);
        if (!(raw instanceof Map)) {
            throw new IllegalArgumentException("Unknown application: " + name
                    + ". Available: " + String.join(", ", applicationNames(root)));
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> app = (Map<String, Object>) raw;

        String source = getString(app, "source_file", null);
        if (source == null) {
            throw new IllegalArgumentException("source_file is required for application " + name);
        }
        Path sourceFile = resolve(baseDir, source);
        if (!Files.isRegularFile(sourceFile)) {
            throw new IllegalArgumentException("Source file for " + name + " not found: " + sourceFile);
        }

        return new ApplicationConfig(
                name,
                sourceFile,
                getStringMap(app, "operators"),
                resolveAll(baseDir, getListString(app, "additional_sources")),
                resolveAll(baseDir, getListString(app, "include_dirs")),
                getString(app, "optimization_level", "-O"),
                getString(app, "input_data", ""),
                getString(app, "output_suffix", ".data"),
                getString(app, "exe_prefix", ""),
                optionalPath(baseDir, getString(app, "approx_header", null)),
                optionalPath(baseDir, getString(app, "energy_model", null)));
    }

    public static List<String> applicationNames(Map<String, Object> root) {
        return new ArrayList<>(getMap(root, APPLICATIONS_KEY).keySet());
    }

    private static ToolchainConfig buildToolchain(Map<String, Object> config) {
        Map<String, Object> toolchain = getMap(config, "toolchain");
        if (toolchain.isEmpty()) {
            return ToolchainConfig.riscv();
        }
        ToolchainConfig defaults = ToolchainConfig.riscv();
        List<String> flags = getListString(toolchain, "compiler_flags");
        List<String> libraries = getListString(toolchain, "libraries");
        List<String> simulator = getListString(toolchain, "simulator");
        return new ToolchainConfig(
                getString(toolchain, "compiler", defaults.compiler()),
                toolchain.containsKey("compiler_flags") ? flags : defaults.compilerFlags(),
                toolchain.containsKey("libraries") ? libraries : defaults.libraries(),
                simulator.isEmpty() ? defaults.simulatorCommand() : simulator);
    }

    private static Path resolve(Path baseDir, String value) {
        Path path = Path.of(value);
        return path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path).normalize();
    }

    private static Path optionalPath(Path baseDir, String value) {
        return value == null || value.isBlank() ? null : resolve(baseDir, value);
    }

    private static List<Path> resolveAll(Path baseDir, List<String> values) {
        return values.stream().map(v -> resolve(baseDir, v)).toList();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map == null ? null : map.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    private static Map<String, String> getStringMap(Map<String, Object> map, String key) {
        Map<String, String> result = new LinkedHashMap<>();
        getMap(map, key).forEach((k, v) -> result.put(k, v == null ? null : v.toString()));
        return result;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
