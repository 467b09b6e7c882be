package io.herald.cli;

import io.herald.core.config.OnboardResult;
import io.herald.core.config.model.HeraldConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write the default config and prepare the database directory")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config with defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), overwrite);
            String action = result.createdConfig() ? "Created"
                : result.overwrittenConfig() ? "Reset to defaults" : "Refreshed";
            System.out.println(action + " config: " + result.configPath());
            System.out.println("Database: " + result.databasePath());

            HeraldConfig effective = context.configService().loadEffective(context.configPath(), context.environment());
            if (!effective.discord().configured()) {
                System.out.println("No Discord bot token yet: set discord.botToken or DISCORD_TOKEN, "
                    + "otherwise 'herald serve' echoes messages to the console.");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
    }
}
