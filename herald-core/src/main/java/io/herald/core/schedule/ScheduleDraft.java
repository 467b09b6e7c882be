package io.herald.core.schedule;

/**
 * User-supplied fields of a create or edit command, before validation.
 * {@code repeatType} is kept as raw text so that an unknown type can be reported as a validation error.
 */
public record ScheduleDraft(
    String title,
    String message,
    String channel,
    String repeatType,
    String repeatValue
) {
    public ScheduleDraft {
        title = title == null ? "" : title.trim();
        message = message == null ? "" : message;
        channel = channel == null ? "" : channel.trim();
        repeatType = repeatType == null ? "" : repeatType.trim();
        repeatValue = repeatValue == null ? "" : repeatValue.trim();
    }
}
