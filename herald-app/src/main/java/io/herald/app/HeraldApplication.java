package io.herald.app;

import io.herald.cli.CliContext;
import io.herald.cli.HeraldCliCommand;
import io.herald.cli.OnboardCommand;
import io.herald.cli.ServeCommand;
import io.herald.cli.StatusCommand;
import io.herald.cli.console.ScheduleConsole;
import io.herald.core.config.ConfigPaths;
import io.herald.core.config.ConfigService;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.engine.ReloadReport;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class HeraldApplication {
    private static final Logger LOG = LoggerFactory.getLogger(HeraldApplication.class);

    private HeraldApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        Map<String, String> env = System.getenv();
        LoggingConfigurator.configure(loadConfig(configService, configPath, env).debug());

        CliContext context = new CliContext(
            configService,
            configPath,
            env,
            userOverride -> runServe(configService, configPath, env, userOverride)
        );

        CommandLine commandLine = new CommandLine(new HeraldCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static HeraldConfig loadConfig(ConfigService configService, Path configPath, Map<String, String> env) {
        try {
            return configService.loadEffective(configPath, env);
        } catch (Exception e) {
            LOG.warn("Failed to load config {}: {}; using defaults", configPath, e.getMessage());
            return configService.applyEnvironment(HeraldConfig.defaults(), env);
        }
    }

    private static int runServe(
        ConfigService configService,
        Path configPath,
        Map<String, String> env,
        String userOverride
    ) throws Exception {
        HeraldConfig config = configService.loadEffective(configPath, env);
        String userId = userOverride == null || userOverride.isBlank() ? config.console().userId() : userOverride.trim();

        try (HeraldRuntime runtime = HeraldRuntime.open(config, env.get("TZ"), System.out)) {
            Runtime.getRuntime().addShutdownHook(new Thread(runtime::close, "herald-shutdown"));
            ReloadReport report = runtime.start();
            System.out.println("Herald started: " + report.loaded() + " schedules loaded"
                + (report.failed() > 0 ? ", " + report.failed() + " failed " + report.failedIds() : ""));

            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
            new ScheduleConsole(runtime.service(), userId, in, out).run();
        }
        return 0;
    }
}
