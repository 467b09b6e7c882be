package io.herald.core.engine.timer;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Recurrence expressions understood by the timer: {@code @every <ISO-8601 duration>} for fixed
 * periods and 5-field UNIX cron for calendar rules.
 */
public final class Recurrences {
    private static final String EVERY_PREFIX = "@every ";
    private static final CronParser CRON_PARSER =
        new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private Recurrences() {
    }

    public static String every(Duration period) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }
        return EVERY_PREFIX + period;
    }

    public static Optional<Duration> fixedPeriod(String expression) {
        if (expression == null || !expression.startsWith(EVERY_PREFIX)) {
            return Optional.empty();
        }
        try {
            Duration period = Duration.parse(expression.substring(EVERY_PREFIX.length()).trim());
            if (period.isZero() || period.isNegative()) {
                throw new IllegalArgumentException("period must be > 0: " + expression);
            }
            return Optional.of(period);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid @every expression: " + expression, e);
        }
    }

    public static ExecutionTime cron(String expression) {
        Cron cron = CRON_PARSER.parse(expression);
        return ExecutionTime.forCron(cron);
    }

    public static Optional<ZonedDateTime> nextExecution(String expression, ZonedDateTime from) {
        return cron(expression).nextExecution(from);
    }
}
