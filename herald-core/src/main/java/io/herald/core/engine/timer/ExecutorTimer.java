package io.herald.core.engine.timer;

import com.cronutils.model.time.ExecutionTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TimerPrimitive} backed by a {@link ScheduledExecutorService}. Cron recurrences re-arm
 * themselves after every run; fixed periods run with a fixed delay between runs.
 */
public final class ExecutorTimer implements TimerPrimitive, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutorTimer.class);

    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    public ExecutorTimer(int threads, Clock clock) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "herald-timer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public TimerHandle registerOnce(Instant fireAt, Runnable callback) {
        long delayMs = Math.max(0L, Duration.between(clock.instant(), fireAt).toMillis());
        FutureHandle handle = new FutureHandle();
        handle.arm(scheduler.schedule(() -> runSafely(callback), delayMs, TimeUnit.MILLISECONDS));
        return handle;
    }

    @Override
    public TimerHandle registerRecurring(String expression, ZoneId zone, Runnable callback) {
        Optional<Duration> period = Recurrences.fixedPeriod(expression);
        FutureHandle handle = new FutureHandle();
        if (period.isPresent()) {
            long periodMs = period.get().toMillis();
            // one run per wake-up; periods missed during a stall are not caught up
            handle.arm(scheduler.scheduleWithFixedDelay(
                () -> runSafely(callback),
                periodMs,
                periodMs,
                TimeUnit.MILLISECONDS
            ));
            return handle;
        }

        CronTask task = new CronTask(Recurrences.cron(expression), zone, callback, handle);
        task.armNext();
        return handle;
    }

    @Override
    public void close() {
        int pending = scheduler.shutdownNow().size();
        LOG.debug("Timer shut down, {} pending tasks dropped", pending);
    }

    private void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.error("Timer callback failed", e);
        }
    }

    private final class CronTask implements Runnable {
        private final ExecutionTime executionTime;
        private final ZoneId zone;
        private final Runnable callback;
        private final FutureHandle handle;
        private ZonedDateTime lastTarget;

        CronTask(ExecutionTime executionTime, ZoneId zone, Runnable callback, FutureHandle handle) {
            this.executionTime = executionTime;
            this.zone = zone;
            this.callback = callback;
            this.handle = handle;
        }

        @Override
        public void run() {
            if (handle.isCancelled()) {
                return;
            }
            runSafely(callback);
            armNext();
        }

        void armNext() {
            if (handle.isCancelled() || scheduler.isShutdown()) {
                return;
            }
            ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
            // never re-fire the occurrence that just ran if the executor woke up a little early
            ZonedDateTime from = lastTarget != null && lastTarget.isAfter(now) ? lastTarget : now;
            Optional<ZonedDateTime> next = executionTime.nextExecution(from);
            if (next.isEmpty()) {
                LOG.warn("Recurrence has no further executions after {}", from);
                return;
            }
            lastTarget = next.get();
            long delayMs = Math.max(0L, Duration.between(now, lastTarget).toMillis());
            LOG.debug("Next execution time {}", lastTarget);
            handle.arm(scheduler.schedule(this, delayMs, TimeUnit.MILLISECONDS));
        }
    }

    private static final class FutureHandle implements TimerHandle {
        private ScheduledFuture<?> future;
        private boolean cancelled;

        synchronized void arm(ScheduledFuture<?> next) {
            if (cancelled) {
                next.cancel(false);
                return;
            }
            future = next;
        }

        @Override
        public synchronized void cancel() {
            cancelled = true;
            if (future != null) {
                future.cancel(false);
            }
        }

        @Override
        public synchronized boolean isCancelled() {
            return cancelled;
        }
    }
}
