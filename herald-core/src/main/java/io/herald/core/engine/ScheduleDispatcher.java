package io.herald.core.engine;

import io.herald.core.schedule.Schedule;
import io.herald.core.schedule.ScheduleStore;
import io.herald.core.transport.DeliveryException;
import io.herald.core.transport.MessageTransport;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a fired trigger: re-checks the persisted active flag and delivers the payload. One-shot
 * schedules are retired through {@link #retire(long)} by the registry that owns the trigger.
 */
public final class ScheduleDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduleDispatcher.class);

    private final ScheduleStore store;
    private final MessageTransport transport;

    public ScheduleDispatcher(ScheduleStore store, MessageTransport transport) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
    }

    public DispatchOutcome dispatch(long scheduleId) {
        Optional<Schedule> current;
        try {
            current = store.find(scheduleId);
        } catch (IOException e) {
            LOG.error("Failed to read schedule {} at fire time, skipping", scheduleId, e);
            return DispatchOutcome.SKIPPED;
        }
        if (current.isEmpty() || !current.get().active()) {
            LOG.debug("Schedule {} is inactive or not found, skipping message", scheduleId);
            return DispatchOutcome.SKIPPED;
        }

        Schedule schedule = current.get();
        DispatchOutcome outcome;
        try {
            transport.send(schedule.channel(), schedule.message());
            LOG.info("Sent schedule {} ('{}') to channel {}", scheduleId, schedule.title(), schedule.channel());
            outcome = DispatchOutcome.DELIVERED;
        } catch (DeliveryException e) {
            LOG.warn("Failed to send schedule {} to channel {}: {}", scheduleId, schedule.channel(), e.getMessage());
            outcome = DispatchOutcome.FAILED;
        }
        return outcome;
    }

    /**
     * Marks a fired one-time schedule inactive, whether or not its delivery succeeded. There is no
     * retry.
     */
    public void retire(long scheduleId) {
        try {
            store.setActive(scheduleId, false);
            LOG.debug("One-time schedule {} completed and disabled", scheduleId);
        } catch (IOException e) {
            LOG.error("Failed to disable one-time schedule {}", scheduleId, e);
        }
    }
}
