package io.herald.cli.console;

import io.herald.core.schedule.RepeatType;
import io.herald.core.schedule.Schedule;

final class ScheduleFormatter {
    private ScheduleFormatter() {
    }

    static String summary(Schedule schedule) {
        return "ID " + schedule.id() + ": " + schedule.title()
            + " | " + (schedule.active() ? "Active" : "Paused")
            + " | " + repeat(schedule)
            + " | Channel: " + schedule.channel();
    }

    static String adminSummary(Schedule schedule) {
        return summary(schedule) + " | User: " + schedule.ownerId();
    }

    static String repeat(Schedule schedule) {
        if (schedule.repeatType() == RepeatType.NONE && schedule.repeatValue().isBlank()) {
            return "none (immediate)";
        }
        return schedule.repeatType().label() + " " + schedule.repeatValue();
    }
}
