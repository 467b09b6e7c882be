package io.herald.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.herald.core.config.model.DiscordConfig;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.config.model.StorageConfig;
import io.herald.core.engine.ReloadReport;
import io.herald.core.schedule.Schedule;
import io.herald.core.schedule.ScheduleDraft;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HeraldRuntimeTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldRestoreSchedulesAfterRestart() throws Exception {
        HeraldConfig config = config(DiscordConfig.defaults());
        ByteArrayOutputStream echoed = new ByteArrayOutputStream();
        PrintStream echo = new PrintStream(echoed, true, StandardCharsets.UTF_8);

        long weeklyId;
        long pausedId;
        try (HeraldRuntime first = HeraldRuntime.open(config, null, echo)) {
            assertThat(first.transport().name()).isEqualTo("echo");
            assertThat(first.start().loaded()).isZero();
            weeklyId = first.service().create("alice", new ScheduleDraft("a", "m", "1", "weekly", "mon 09:00")).id();
            Schedule paused = first.service().create("alice", new ScheduleDraft("b", "m", "1", "interval", "1h"));
            first.service().pause("alice", paused.id());
            pausedId = paused.id();
        }

        try (HeraldRuntime second = HeraldRuntime.open(config, null, echo)) {
            ReloadReport report = second.start();

            assertThat(report.loaded()).isEqualTo(1);
            assertThat(second.registry().scheduledIds()).containsExactly(weeklyId);
            assertThat(second.service().isScheduled(pausedId)).isFalse();
        }
    }

    @Test
    void shouldDeliverImmediateScheduleThroughEchoTransport() throws Exception {
        ByteArrayOutputStream echoed = new ByteArrayOutputStream();
        PrintStream echo = new PrintStream(echoed, true, StandardCharsets.UTF_8);

        try (HeraldRuntime runtime = HeraldRuntime.open(config(DiscordConfig.defaults()), "UTC", echo)) {
            runtime.start();
            Schedule created = runtime.service().create("alice", new ScheduleDraft("now", "ping", "77", "none", ""));

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (runtime.service().isScheduled(created.id()) && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }

            assertThat(echoed.toString(StandardCharsets.UTF_8)).contains("[77] ping");
            assertThat(runtime.service().list("alice")).extracting(Schedule::active).containsExactly(false);
        }
    }

    @Test
    void shouldUseDiscordWhenTokenConfigured() throws Exception {
        HeraldConfig config = config(new DiscordConfig("token", "https://discord.example/api/v10"));

        try (HeraldRuntime runtime = HeraldRuntime.open(config, null, System.out)) {
            assertThat(runtime.transport().name()).isEqualTo("discord");
        }
    }

    private HeraldConfig config(DiscordConfig discord) {
        HeraldConfig defaults = HeraldConfig.defaults();
        return new HeraldConfig(
            defaults.engine(),
            new StorageConfig(tempDir.resolve("schedules.db").toString()),
            discord,
            defaults.console(),
            List.of("root"),
            false
        );
    }
}
