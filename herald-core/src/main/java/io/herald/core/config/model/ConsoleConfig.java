package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConsoleConfig(String userId) {

    public static ConsoleConfig defaults() {
        return new ConsoleConfig("console");
    }
}
