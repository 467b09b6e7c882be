package io.herald.cli;

import picocli.CommandLine.Command;

@Command(
    name = "herald",
    mixinStandardHelpOptions = true,
    version = "herald 0.1.0",
    description = "Timezone-aware scheduled message dispatcher"
)
public final class HeraldCliCommand implements Runnable {

    @Override
    public void run() {
        // No subcommand: picocli prints usage via the help mixin.
    }
}
