package io.herald.core.config;

import java.nio.file.Path;

public record OnboardResult(
    Path configPath,
    Path databasePath,
    boolean createdConfig,
    boolean overwrittenConfig
) {
}
