package io.herald.core.engine;

/**
 * Raised when a repeat specification, timezone or schedule field cannot be turned into a trigger.
 * Nothing is persisted or registered when this is thrown.
 */
public final class ScheduleSpecException extends IllegalArgumentException {
    public enum Field {
        TIMEZONE,
        REPEAT_TYPE,
        REPEAT_VALUE,
        DURATION,
        DAY,
        TIME,
        PAST_INSTANT,
        TITLE,
        MESSAGE,
        CHANNEL
    }

    private final Field field;

    public ScheduleSpecException(Field field, String message) {
        super(message);
        this.field = field;
    }

    public Field field() {
        return field;
    }
}
