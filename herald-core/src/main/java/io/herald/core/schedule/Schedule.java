package io.herald.core.schedule;

public record Schedule(
    long id,
    String ownerId,
    String title,
    String message,
    String channel,
    RepeatType repeatType,
    String repeatValue,
    boolean active,
    String ownerTimezone
) {
    public Schedule {
        repeatValue = repeatValue == null ? "" : repeatValue;
    }

    public Schedule withActive(boolean value) {
        return new Schedule(id, ownerId, title, message, channel, repeatType, repeatValue, value, ownerTimezone);
    }
}
