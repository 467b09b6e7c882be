package io.herald.core.engine;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Timezones {
    private static final Logger LOG = LoggerFactory.getLogger(Timezones.class);

    private Timezones() {
    }

    public static ZoneId resolve(String name) {
        if (name == null || name.isBlank()) {
            throw new ScheduleSpecException(ScheduleSpecException.Field.TIMEZONE, "timezone is required");
        }
        try {
            return ZoneId.of(name.trim());
        } catch (DateTimeException e) {
            throw new ScheduleSpecException(
                ScheduleSpecException.Field.TIMEZONE,
                "Invalid timezone '" + name.trim() + "'. Use IANA timezone format (e.g., Asia/Kolkata)"
            );
        }
    }

    /**
     * Resolves the process execution timezone: the configured value, then {@code TZ}, then UTC.
     * An unloadable name falls back to UTC.
     */
    public static ZoneId resolveExecutionZone(String configured, String tzEnv) {
        String candidate = configured;
        if (candidate == null || candidate.isBlank()) {
            candidate = tzEnv;
        }
        if (candidate == null || candidate.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(candidate.trim());
        } catch (DateTimeException e) {
            LOG.warn("Failed to load timezone {}, using UTC: {}", candidate, e.getMessage());
            return ZoneOffset.UTC;
        }
    }
}
