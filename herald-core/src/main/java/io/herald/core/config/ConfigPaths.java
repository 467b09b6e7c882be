package io.herald.core.config;

import java.nio.file.Path;

public final class ConfigPaths {
    private static final String DATA_DIR = ".herald";

    private ConfigPaths() {
    }

    public static Path dataDirectory() {
        return Path.of(System.getProperty("user.home"), DATA_DIR);
    }

    public static Path defaultConfigPath() {
        return dataDirectory().resolve("config.json");
    }

    /**
     * Expands a leading {@code ~/}; a blank value means {@code ~/.herald/schedules.db}.
     */
    public static Path resolveDatabase(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return dataDirectory().resolve("schedules.db");
        }
        String trimmed = rawPath.trim();
        if (trimmed.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(trimmed.substring(2));
        }
        return Path.of(trimmed);
    }
}
