package io.herald.core.schedule;

import java.util.Locale;
import java.util.Optional;

public enum RepeatType {
    NONE,
    INTERVAL,
    WEEKLY;

    public static Optional<RepeatType> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "none" -> Optional.of(NONE);
            case "interval" -> Optional.of(INTERVAL);
            case "weekly" -> Optional.of(WEEKLY);
            default -> Optional.empty();
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
