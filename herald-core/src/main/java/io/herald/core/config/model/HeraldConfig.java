package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HeraldConfig(
    EngineConfig engine,
    StorageConfig storage,
    DiscordConfig discord,
    ConsoleConfig console,
    List<String> admins,
    boolean debug
) {
    public HeraldConfig {
        admins = admins == null ? List.of() : List.copyOf(admins);
    }

    public static HeraldConfig defaults() {
        return new HeraldConfig(
            EngineConfig.defaults(),
            StorageConfig.defaults(),
            DiscordConfig.defaults(),
            ConsoleConfig.defaults(),
            List.of(),
            false
        );
    }
}
