package io.herald.cli;

import io.herald.core.config.ConfigService;
import java.nio.file.Path;
import java.util.Map;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Map<String, String> environment,
    ServeRunner serveRunner
) {
    public CliContext(ConfigService configService, Path configPath, Map<String, String> environment) {
        this(configService, configPath, environment, userOverride -> {
            throw new UnsupportedOperationException("serve runner is not configured");
        });
    }
}
