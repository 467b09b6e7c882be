package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(String databasePath) {

    public static StorageConfig defaults() {
        return new StorageConfig("~/.herald/schedules.db");
    }
}
