package io.herald.core.config;

import java.nio.file.Path;

public final class ConfigPaths {
    public static final String CONFIG_ENV = "HERALD_CONFIG";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        String override = System.getenv(CONFIG_ENV);
        if (override != null && !override.isBlank()) {
            return resolve(override.trim());
        }
        return Path.of(System.getProperty("user.home"), ".herald", "config.json");
    }

    public static Path resolveStore(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".herald", "tasks.db");
        }
        return resolve(rawPath);
    }

    private static Path resolve(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
