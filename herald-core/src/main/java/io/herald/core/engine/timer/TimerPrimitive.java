package io.herald.core.engine.timer;

import java.time.Instant;
import java.time.ZoneId;

public interface TimerPrimitive {
    TimerHandle registerOnce(Instant fireAt, Runnable callback);

    /**
     * @param expression {@code @every <ISO-8601 duration>} or a 5-field UNIX cron expression
     * @param zone zone in which cron fields are evaluated
     */
    TimerHandle registerRecurring(String expression, ZoneId zone, Runnable callback);
}
