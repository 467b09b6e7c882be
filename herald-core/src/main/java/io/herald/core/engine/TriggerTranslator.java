package io.herald.core.engine;

import io.herald.core.engine.timer.Recurrences;
import io.herald.core.schedule.RepeatType;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a repeat specification authored in an owner's timezone into a {@link Trigger} in the
 * execution timezone. Conversion happens once, here.
 */
public final class TriggerTranslator {
    private static final Logger LOG = LoggerFactory.getLogger(TriggerTranslator.class);

    private final ZoneId executionZone;
    private final Clock clock;
    private final RepeatSpecParser parser = new RepeatSpecParser();

    public TriggerTranslator(ZoneId executionZone, Clock clock) {
        this.executionZone = Objects.requireNonNull(executionZone, "executionZone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ZoneId executionZone() {
        return executionZone;
    }

    public Trigger translate(RepeatType type, String repeatValue, String ownerTimezone) {
        ZoneId ownerZone = Timezones.resolve(ownerTimezone);
        return translate(parser.parse(type, repeatValue), ownerZone);
    }

    public Trigger translate(RepeatSpec spec, ZoneId ownerZone) {
        if (spec instanceof RepeatSpec.Once once) {
            return translateOnce(once, ownerZone);
        }
        if (spec instanceof RepeatSpec.Every every) {
            return new Trigger.Recurring(Recurrences.every(every.period()), executionZone);
        }
        if (spec instanceof RepeatSpec.Weekly weekly) {
            return translateWeekly(weekly, ownerZone);
        }
        throw new IllegalArgumentException("Unsupported repeat spec: " + spec);
    }

    private Trigger translateOnce(RepeatSpec.Once once, ZoneId ownerZone) {
        Instant now = clock.instant();
        if (once.localDateTime().isEmpty()) {
            return new Trigger.OneShot(now);
        }

        LocalDateTime local = once.localDateTime().get();
        ZonedDateTime ownerTime = local.atZone(ownerZone);
        ZonedDateTime executionTime = ownerTime.withZoneSameInstant(executionZone);
        if (!executionTime.toInstant().isAfter(now)) {
            throw new ScheduleSpecException(
                ScheduleSpecException.Field.PAST_INSTANT,
                "Time is in the past: " + local.toLocalDate() + " " + local.toLocalTime() + " (" + ownerZone + ")"
            );
        }
        LOG.debug("One-time at {} ({}) -> {} ({})", local, ownerZone, executionTime.toLocalDateTime(), executionZone);
        return new Trigger.OneShot(executionTime.toInstant());
    }

    private Trigger translateWeekly(RepeatSpec.Weekly weekly, ZoneId ownerZone) {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(ownerZone));
        LocalTime time = weekly.time();

        TreeSet<Integer> cronDays = new TreeSet<>();
        ZonedDateTime reference = null;
        for (DayOfWeek day : weekly.days()) {
            ZonedDateTime executionTime = nextOccurrence(now, day, time).withZoneSameInstant(executionZone);
            cronDays.add(executionTime.getDayOfWeek().getValue() % 7);
            if (reference == null) {
                reference = executionTime;
            }
            LOG.debug(
                "{} {} {} -> {} {} {}",
                day, time, ownerZone, executionTime.getDayOfWeek(), executionTime.toLocalTime(), executionZone
            );
        }
        if (reference == null) {
            throw new ScheduleSpecException(ScheduleSpecException.Field.DAY, "No valid days");
        }

        StringJoiner days = new StringJoiner(",");
        cronDays.forEach(day -> days.add(String.valueOf(day)));
        String expression = reference.getMinute() + " " + reference.getHour() + " * * " + days;
        LOG.debug("Weekly cron spec: {} ({})", expression, executionZone);
        return new Trigger.Recurring(expression, executionZone);
    }

    private ZonedDateTime nextOccurrence(ZonedDateTime now, DayOfWeek day, LocalTime time) {
        int daysUntilNext = (day.getValue() - now.getDayOfWeek().getValue() + 7) % 7;
        if (daysUntilNext == 0) {
            ZonedDateTime today = now.toLocalDate().atTime(time).atZone(now.getZone());
            if (today.isBefore(now)) {
                daysUntilNext = 7;
            }
        }
        return now.toLocalDate().plusDays(daysUntilNext).atTime(time).atZone(now.getZone());
    }
}
