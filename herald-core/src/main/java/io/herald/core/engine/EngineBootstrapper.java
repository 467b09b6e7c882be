package io.herald.core.engine;

import io.herald.core.schedule.Schedule;
import io.herald.core.schedule.ScheduleStore;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds the live triggers from the persisted active schedules. No timer state is persisted,
 * so this is the only recovery path after a restart.
 */
public final class EngineBootstrapper {
    private static final Logger LOG = LoggerFactory.getLogger(EngineBootstrapper.class);

    private final ScheduleStore store;
    private final JobRegistry registry;

    public EngineBootstrapper(ScheduleStore store, JobRegistry registry) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public ReloadReport start() throws IOException {
        List<Schedule> active = store.getActiveSchedules();
        ReloadReport report = registry.reload(active);
        LOG.info("Loaded {} active schedules ({} failed)", report.loaded(), report.failed());
        return report;
    }
}
