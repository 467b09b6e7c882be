package io.herald.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.herald.core.config.model.DiscordConfig;
import io.herald.core.config.model.EngineConfig;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.config.model.StorageConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public HeraldConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return HeraldConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(HeraldConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, HeraldConfig.class);
    }

    /**
     * Loads the file and then lets environment variables override it:
     * {@code TZ}, {@code DISCORD_TOKEN}, {@code ADMIN_IDS}, {@code DEBUG} and {@code HERALD_DB_PATH}.
     */
    public HeraldConfig loadEffective(Path configPath, Map<String, String> env) throws IOException {
        return applyEnvironment(load(configPath), env);
    }

    public HeraldConfig applyEnvironment(HeraldConfig config, Map<String, String> env) {
        EngineConfig engine = config.engine();
        String tz = env.get("TZ");
        if (!isBlank(tz)) {
            engine = new EngineConfig(tz.trim(), engine.defaultTimezone(), engine.timerThreads());
        }

        StorageConfig storage = config.storage();
        String dbPath = env.get("HERALD_DB_PATH");
        if (!isBlank(dbPath)) {
            storage = new StorageConfig(dbPath.trim());
        }

        DiscordConfig discord = config.discord();
        String token = env.get("DISCORD_TOKEN");
        if (!isBlank(token)) {
            discord = new DiscordConfig(token.trim(), discord.apiBase());
        }

        List<String> admins = config.admins();
        String adminIds = env.get("ADMIN_IDS");
        if (!isBlank(adminIds)) {
            admins = Arrays.stream(adminIds.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .toList();
        }

        boolean debug = config.debug();
        String rawDebug = env.get("DEBUG");
        if (!isBlank(rawDebug)) {
            debug = "true".equalsIgnoreCase(rawDebug.trim());
        }

        return new HeraldConfig(engine, storage, discord, config.console(), admins, debug);
    }

    public void save(Path configPath, HeraldConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        HeraldConfig config;
        if (created || overwrite) {
            config = HeraldConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path database = ConfigPaths.resolveDatabase(config.storage().databasePath());
        Files.createDirectories(database.toAbsolutePath().getParent());
        return new OnboardResult(configPath, database, created, overwritten);
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
