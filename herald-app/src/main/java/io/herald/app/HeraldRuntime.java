package io.herald.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.herald.core.config.ConfigPaths;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.engine.EngineBootstrapper;
import io.herald.core.engine.JobRegistry;
import io.herald.core.engine.ReloadReport;
import io.herald.core.engine.ScheduleDispatcher;
import io.herald.core.engine.Timezones;
import io.herald.core.engine.TriggerTranslator;
import io.herald.core.engine.timer.ExecutorTimer;
import io.herald.core.schedule.SqliteScheduleStore;
import io.herald.core.service.ScheduleService;
import io.herald.core.transport.DiscordTransport;
import io.herald.core.transport.EchoTransport;
import io.herald.core.transport.MessageTransport;
import java.io.IOException;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Set;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The wired engine: store, transport, timer, registry and service for one config.
 */
final class HeraldRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(HeraldRuntime.class);

    private final ExecutorTimer timer;
    private final JobRegistry registry;
    private final EngineBootstrapper bootstrapper;
    private final ScheduleService service;
    private final MessageTransport transport;

    private HeraldRuntime(
        ExecutorTimer timer,
        JobRegistry registry,
        EngineBootstrapper bootstrapper,
        ScheduleService service,
        MessageTransport transport
    ) {
        this.timer = timer;
        this.registry = registry;
        this.bootstrapper = bootstrapper;
        this.service = service;
        this.transport = transport;
    }

    static HeraldRuntime open(HeraldConfig config, String tzEnv, PrintStream echoOut) throws IOException {
        SqliteScheduleStore store = new SqliteScheduleStore(ConfigPaths.resolveDatabase(config.storage().databasePath()));
        MessageTransport transport = buildTransport(config, echoOut);
        ZoneId executionZone = Timezones.resolveExecutionZone(config.engine().executionTimezone(), tzEnv);
        Clock clock = Clock.systemUTC();

        ExecutorTimer timer = new ExecutorTimer(config.engine().timerThreads(), clock);
        TriggerTranslator translator = new TriggerTranslator(executionZone, clock);
        ScheduleDispatcher dispatcher = new ScheduleDispatcher(store, transport);
        JobRegistry registry = new JobRegistry(timer, translator, dispatcher);
        ScheduleService service = new ScheduleService(
            store,
            store,
            translator,
            registry,
            transport,
            Set.copyOf(config.admins()),
            config.engine().defaultTimezone()
        );
        LOG.info("Execution timezone {}, transport {}", executionZone, transport.name());
        return new HeraldRuntime(timer, registry, new EngineBootstrapper(store, registry), service, transport);
    }

    ReloadReport start() throws IOException {
        return bootstrapper.start();
    }

    ScheduleService service() {
        return service;
    }

    JobRegistry registry() {
        return registry;
    }

    MessageTransport transport() {
        return transport;
    }

    @Override
    public void close() {
        registry.cancelAll();
        timer.close();
    }

    private static MessageTransport buildTransport(HeraldConfig config, PrintStream echoOut) {
        if (config.discord().configured()) {
            OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .build();
            return new DiscordTransport(client, new ObjectMapper(), config.discord().apiBase(), config.discord().botToken());
        }
        LOG.warn("No Discord bot token configured; messages are echoed to the console");
        return new EchoTransport(echoOut);
    }
}
