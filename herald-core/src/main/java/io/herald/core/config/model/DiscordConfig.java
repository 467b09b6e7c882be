package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DiscordConfig(String botToken, String apiBase) {

    public static DiscordConfig defaults() {
        return new DiscordConfig("", "https://discord.com/api/v10");
    }

    public boolean configured() {
        return botToken != null && !botToken.isBlank();
    }
}
