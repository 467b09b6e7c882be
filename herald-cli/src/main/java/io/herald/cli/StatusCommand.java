package io.herald.cli;

import io.herald.core.config.ConfigPaths;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.engine.Timezones;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show runtime and configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            HeraldConfig config = context.configService().loadEffective(context.configPath(), context.environment());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Database: " + ConfigPaths.resolveDatabase(config.storage().databasePath()));
            System.out.println("Execution timezone: "
                + Timezones.resolveExecutionZone(config.engine().executionTimezone(), null));
            System.out.println("Default user timezone: " + config.engine().defaultTimezone());
            System.out.println("Discord configured: " + config.discord().configured());
            System.out.println("Admins: " + config.admins().size());
            System.out.println("Debug logging: " + config.debug());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
