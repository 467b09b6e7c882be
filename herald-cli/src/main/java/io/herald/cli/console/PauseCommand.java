package io.herald.cli.console;

import java.io.IOException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "pause", description = "Pause one of your schedules")
final class PauseCommand extends ConsoleCommand {
    @Parameters(index = "0", arity = "1")
    long id;

    PauseCommand(ConsoleSession session) {
        super(session);
    }

    @Override
    protected void execute() throws IOException {
        session.service().pause(session.userId(), id);
        println("Schedule " + id + " paused.");
    }
}
