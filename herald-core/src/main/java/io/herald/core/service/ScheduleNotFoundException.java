package io.herald.core.service;

public final class ScheduleNotFoundException extends RuntimeException {
    private final long scheduleId;

    public ScheduleNotFoundException(long scheduleId) {
        super("Schedule " + scheduleId + " not found or you don't have permission");
        this.scheduleId = scheduleId;
    }

    public long scheduleId() {
        return scheduleId;
    }
}
