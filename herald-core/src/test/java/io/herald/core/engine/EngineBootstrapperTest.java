package io.herald.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.herald.core.engine.timer.ManualTimer;
import io.herald.core.schedule.InMemoryScheduleStore;
import io.herald.core.schedule.RepeatType;
import io.herald.core.schedule.Schedule;
import io.herald.core.transport.RecordingTransport;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class EngineBootstrapperTest {
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void shouldRegisterEveryActiveScheduleOnStart() throws Exception {
        InMemoryScheduleStore store = new InMemoryScheduleStore();
        store.put(new Schedule(1L, "u", "a", "m", "c", RepeatType.WEEKLY, "mon 23:30", true, "America/Bogota"));
        store.put(new Schedule(2L, "u", "b", "m", "c", RepeatType.INTERVAL, "2h", true, "Asia/Kolkata"));
        store.put(new Schedule(3L, "u", "c", "m", "c", RepeatType.INTERVAL, "2h", false, "Asia/Kolkata"));
        ManualTimer timer = new ManualTimer();
        JobRegistry registry = registry(store, timer);

        ReloadReport report = new EngineBootstrapper(store, registry).start();

        assertThat(report.loaded()).isEqualTo(2);
        assertThat(report.failed()).isZero();
        assertThat(registry.scheduledIds()).containsExactly(1L, 2L);
        assertThat(timer.registrations())
            .extracting(ManualTimer.Registration::expression)
            .containsExactlyInAnyOrder("30 4 * * 2", "@every PT2H");
    }

    @Test
    void shouldKeepUntranslatableRowsActiveButUnscheduled() throws Exception {
        InMemoryScheduleStore store = new InMemoryScheduleStore();
        store.put(new Schedule(1L, "u", "a", "m", "c", RepeatType.NONE, "2020-01-01 10:00", true, "UTC"));
        JobRegistry registry = registry(store, new ManualTimer());

        ReloadReport report = new EngineBootstrapper(store, registry).start();

        assertThat(report.failedIds()).containsExactly(1L);
        assertThat(registry.isScheduled(1L)).isFalse();
        assertThat(store.find(1L)).get().extracting(Schedule::active).isEqualTo(true);
    }

    @Test
    void shouldPropagateStoreFailure() {
        InMemoryScheduleStore store = new InMemoryScheduleStore();
        store.failReads(true);

        assertThatThrownBy(() -> new EngineBootstrapper(store, registry(store, new ManualTimer())).start())
            .isInstanceOf(IOException.class);
    }

    private JobRegistry registry(InMemoryScheduleStore store, ManualTimer timer) {
        ZoneId utc = ZoneOffset.UTC;
        TriggerTranslator translator = new TriggerTranslator(utc, Clock.fixed(NOW, utc));
        return new JobRegistry(timer, translator, new ScheduleDispatcher(store, new RecordingTransport()));
    }
}
