package io.herald.core.engine;

import io.herald.core.engine.timer.Recurrences;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * When a schedule should fire, always expressed in the engine's execution timezone.
 */
public interface Trigger {

    boolean oneShot();

    record OneShot(Instant fireAt) implements Trigger {
        @Override
        public boolean oneShot() {
            return true;
        }
    }

    /**
     * {@code expression} is either {@code @every <ISO-8601 duration>} or a 5-field UNIX cron
     * expression evaluated in {@code executionZone}.
     */
    record Recurring(String expression, ZoneId executionZone) implements Trigger {
        @Override
        public boolean oneShot() {
            return false;
        }

        public Optional<Duration> fixedPeriod() {
            return Recurrences.fixedPeriod(expression);
        }
    }
}
