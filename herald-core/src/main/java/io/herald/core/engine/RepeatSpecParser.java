package io.herald.core.engine;

import io.herald.core.schedule.RepeatType;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class RepeatSpecParser {
    private static final DateTimeFormatter DATE_TIME_SPACE = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm");
    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{1,2}):(\\d{2})$");
    private static final Map<String, DayOfWeek> DAYS = Map.of(
        "sun", DayOfWeek.SUNDAY,
        "mon", DayOfWeek.MONDAY,
        "tue", DayOfWeek.TUESDAY,
        "wed", DayOfWeek.WEDNESDAY,
        "thu", DayOfWeek.THURSDAY,
        "fri", DayOfWeek.FRIDAY,
        "sat", DayOfWeek.SATURDAY
    );
    private static final Duration MIN_INTERVAL = Duration.ofSeconds(1);

    public RepeatSpec parse(RepeatType type, String rawValue) {
        if (type == null) {
            throw new ScheduleSpecException(
                ScheduleSpecException.Field.REPEAT_TYPE,
                "Invalid repeat type. Use: none, interval, or weekly"
            );
        }
        String value = rawValue == null ? "" : rawValue.trim();
        return switch (type) {
            case NONE -> parseOnce(value);
            case INTERVAL -> parseInterval(value);
            case WEEKLY -> parseWeekly(value);
        };
    }

    public RepeatSpec parse(String rawType, String rawValue) {
        RepeatType type = RepeatType.parse(rawType).orElseThrow(() -> new ScheduleSpecException(
            ScheduleSpecException.Field.REPEAT_TYPE,
            "Invalid repeat type '" + rawType + "'. Use: none, interval, or weekly"
        ));
        return parse(type, rawValue);
    }

    private RepeatSpec parseOnce(String value) {
        if (value.isEmpty()) {
            return RepeatSpec.Once.immediately();
        }
        try {
            return RepeatSpec.Once.at(LocalDateTime.parse(value, DATE_TIME_SPACE));
        } catch (DateTimeParseException e) {
            throw new ScheduleSpecException(
                ScheduleSpecException.Field.REPEAT_VALUE,
                "Invalid time format '" + value + "'. Use YYYY-MM-DD HH:MM"
            );
        }
    }

    private RepeatSpec parseInterval(String value) {
        Duration period = DurationParser.parse(value);
        if (period.isZero() || period.isNegative()) {
            throw new ScheduleSpecException(
                ScheduleSpecException.Field.DURATION,
                "Interval must be positive: " + value
            );
        }
        if (period.compareTo(MIN_INTERVAL) < 0) {
            period = MIN_INTERVAL;
        }
        return new RepeatSpec.Every(period);
    }

    private RepeatSpec parseWeekly(String value) {
        String[] parts = value.split("\\s+");
        if (parts.length != 2) {
            throw new ScheduleSpecException(
                ScheduleSpecException.Field.REPEAT_VALUE,
                "Invalid weekly format '" + value + "'. Use days and time, e.g. Mon,Wed,Fri 09:00"
            );
        }

        List<DayOfWeek> days = new ArrayList<>();
        for (String token : parts[0].split(",")) {
            String key = token.trim().toLowerCase(Locale.ROOT);
            DayOfWeek day = DAYS.get(key);
            if (day == null) {
                throw new ScheduleSpecException(
                    ScheduleSpecException.Field.DAY,
                    "Invalid day '" + token.trim() + "'. Use Mon, Tue, Wed, Thu, Fri, Sat, Sun"
                );
            }
            if (!days.contains(day)) {
                days.add(day);
            }
        }
        if (days.isEmpty()) {
            throw new ScheduleSpecException(ScheduleSpecException.Field.DAY, "No valid days in '" + value + "'");
        }

        return new RepeatSpec.Weekly(days, parseTime(parts[1]));
    }

    private LocalTime parseTime(String token) {
        Matcher matcher = TIME_PATTERN.matcher(token);
        if (!matcher.matches()) {
            throw invalidTime(token);
        }
        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        if (hour > 23 || minute > 59) {
            throw invalidTime(token);
        }
        return LocalTime.of(hour, minute);
    }

    private ScheduleSpecException invalidTime(String token) {
        return new ScheduleSpecException(
            ScheduleSpecException.Field.TIME,
            "Invalid time '" + token + "'. Use 24-hour HH:MM"
        );
    }
}
