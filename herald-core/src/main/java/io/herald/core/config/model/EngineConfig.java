package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    String executionTimezone,
    String defaultTimezone,
    int timerThreads
) {
    public static final int DEFAULT_TIMER_THREADS = 4;

    public EngineConfig {
        // zero or negative pool sizes fall back to the default
        if (timerThreads <= 0) {
            timerThreads = DEFAULT_TIMER_THREADS;
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig("", "Asia/Kolkata", DEFAULT_TIMER_THREADS);
    }
}
