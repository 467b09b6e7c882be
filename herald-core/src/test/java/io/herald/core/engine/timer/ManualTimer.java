package io.herald.core.engine.timer;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Records registrations; tests fire them by hand.
 */
public final class ManualTimer implements TimerPrimitive {
    public static final class Registration implements TimerHandle {
        private final Instant fireAt;
        private final String expression;
        private final ZoneId zone;
        private final Runnable callback;
        private boolean cancelled;

        Registration(Instant fireAt, String expression, ZoneId zone, Runnable callback) {
            this.fireAt = fireAt;
            this.expression = expression;
            this.zone = zone;
            this.callback = callback;
        }

        public Instant fireAt() {
            return fireAt;
        }

        public String expression() {
            return expression;
        }

        public ZoneId zone() {
            return zone;
        }

        /** Runs the callback the way a timer that lost the race with cancel would. */
        public void fire() {
            callback.run();
        }

        @Override
        public synchronized void cancel() {
            cancelled = true;
        }

        @Override
        public synchronized boolean isCancelled() {
            return cancelled;
        }
    }

    private final List<Registration> registrations = new ArrayList<>();

    @Override
    public synchronized TimerHandle registerOnce(Instant fireAt, Runnable callback) {
        Registration registration = new Registration(fireAt, null, null, callback);
        registrations.add(registration);
        return registration;
    }

    @Override
    public synchronized TimerHandle registerRecurring(String expression, ZoneId zone, Runnable callback) {
        Registration registration = new Registration(null, expression, zone, callback);
        registrations.add(registration);
        return registration;
    }

    public synchronized List<Registration> registrations() {
        return List.copyOf(registrations);
    }

    public synchronized List<Registration> live() {
        return registrations.stream().filter(registration -> !registration.isCancelled()).toList();
    }

    public synchronized Registration last() {
        return registrations.get(registrations.size() - 1);
    }
}
