package io.herald.core.engine;

import io.herald.core.engine.timer.TimerHandle;
import io.herald.core.engine.timer.TimerPrimitive;
import io.herald.core.schedule.Schedule;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live timers keyed by schedule id. Holds at most one handle per id; every read and write of the
 * map happens under {@link #lock}, so cancel-then-register for one id is never observed half done.
 * Retiring a fired one-shot takes the same lock and only touches the store while the fired
 * registration is still the live one.
 */
public final class JobRegistry {
    /** A store write that must land atomically with a registry change. */
    @FunctionalInterface
    public interface StoreWrite {
        void run() throws IOException;
    }

    private static final Logger LOG = LoggerFactory.getLogger(JobRegistry.class);

    private final TimerPrimitive timer;
    private final TriggerTranslator translator;
    private final ScheduleDispatcher dispatcher;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Registration> entries = new HashMap<>();

    public JobRegistry(TimerPrimitive timer, TriggerTranslator translator, ScheduleDispatcher dispatcher) {
        this.timer = Objects.requireNonNull(timer, "timer must not be null");
        this.translator = Objects.requireNonNull(translator, "translator must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    /**
     * @throws IllegalStateException if {@code scheduleId} already has a live handle
     */
    public TimerHandle register(long scheduleId, Trigger trigger) {
        Objects.requireNonNull(trigger, "trigger must not be null");
        lock.lock();
        try {
            if (entries.containsKey(scheduleId)) {
                throw new IllegalStateException("Schedule " + scheduleId + " already has a live trigger");
            }
            return registerLocked(scheduleId, trigger);
        } finally {
            lock.unlock();
        }
    }

    public boolean cancel(long scheduleId) {
        lock.lock();
        try {
            return cancelLocked(scheduleId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels whatever is live for {@code scheduleId} and registers {@code trigger} in one step.
     */
    public TimerHandle replace(long scheduleId, Trigger trigger) {
        Objects.requireNonNull(trigger, "trigger must not be null");
        lock.lock();
        try {
            cancelLocked(scheduleId);
            return registerLocked(scheduleId, trigger);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code write} and then swaps in {@code trigger}, both under the registry lock. Nothing
     * changes in the registry if the write fails.
     */
    public TimerHandle replace(long scheduleId, Trigger trigger, StoreWrite write) throws IOException {
        Objects.requireNonNull(trigger, "trigger must not be null");
        Objects.requireNonNull(write, "write must not be null");
        lock.lock();
        try {
            write.run();
            cancelLocked(scheduleId);
            return registerLocked(scheduleId, trigger);
        } finally {
            lock.unlock();
        }
    }

    public ReloadReport reload(List<Schedule> schedules) {
        int loaded = 0;
        List<Long> failed = new ArrayList<>();
        for (Schedule schedule : schedules) {
            if (!schedule.active()) {
                continue;
            }
            try {
                Trigger trigger = translator.translate(
                    schedule.repeatType(),
                    schedule.repeatValue(),
                    schedule.ownerTimezone()
                );
                replace(schedule.id(), trigger);
                loaded++;
            } catch (ScheduleSpecException e) {
                LOG.warn(
                    "Schedule {} could not be translated ({}): {}; it stays active without a trigger",
                    schedule.id(),
                    e.field(),
                    e.getMessage()
                );
                failed.add(schedule.id());
            }
        }
        return new ReloadReport(loaded, failed);
    }

    public boolean isScheduled(long scheduleId) {
        lock.lock();
        try {
            return entries.containsKey(scheduleId);
        } finally {
            lock.unlock();
        }
    }

    public Set<Long> scheduledIds() {
        lock.lock();
        try {
            return new TreeSet<>(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void cancelAll() {
        lock.lock();
        try {
            entries.values().forEach(registration -> registration.handle.cancel());
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    private TimerHandle registerLocked(long scheduleId, Trigger trigger) {
        Registration registration = new Registration(scheduleId, trigger);
        TimerHandle handle;
        if (trigger instanceof Trigger.OneShot oneShot) {
            handle = timer.registerOnce(oneShot.fireAt(), () -> fire(registration));
        } else if (trigger instanceof Trigger.Recurring recurring) {
            handle = timer.registerRecurring(recurring.expression(), recurring.executionZone(), () -> fire(registration));
        } else {
            throw new IllegalArgumentException("Unsupported trigger: " + trigger);
        }
        registration.handle = handle;
        entries.put(scheduleId, registration);
        LOG.debug("Scheduled job {} with {}", scheduleId, trigger);
        return handle;
    }

    private boolean cancelLocked(long scheduleId) {
        Registration removed = entries.remove(scheduleId);
        if (removed == null) {
            return false;
        }
        removed.handle.cancel();
        LOG.debug("Removed job for schedule {}", scheduleId);
        return true;
    }

    private void fire(Registration registration) {
        if (!isCurrent(registration)) {
            LOG.debug("Ignoring stale fire for schedule {}", registration.scheduleId);
            return;
        }
        DispatchOutcome outcome = dispatcher.dispatch(registration.scheduleId);
        if (registration.trigger.oneShot()) {
            retire(registration, outcome);
        }
    }

    private boolean isCurrent(Registration registration) {
        lock.lock();
        try {
            return entries.get(registration.scheduleId) == registration;
        } finally {
            lock.unlock();
        }
    }

    private void retire(Registration registration, DispatchOutcome outcome) {
        lock.lock();
        try {
            if (entries.get(registration.scheduleId) != registration) {
                // edited or resumed while sending; the row now belongs to the newer trigger
                LOG.debug("One-time job {} was replaced while firing, leaving it active", registration.scheduleId);
                return;
            }
            if (outcome != DispatchOutcome.SKIPPED) {
                dispatcher.retire(registration.scheduleId);
            }
            entries.remove(registration.scheduleId);
            LOG.debug("Released exhausted one-time job {}", registration.scheduleId);
        } finally {
            lock.unlock();
        }
    }

    private static final class Registration {
        private final long scheduleId;
        private final Trigger trigger;
        private TimerHandle handle;

        private Registration(long scheduleId, Trigger trigger) {
            this.scheduleId = scheduleId;
            this.trigger = trigger;
        }
    }
}
