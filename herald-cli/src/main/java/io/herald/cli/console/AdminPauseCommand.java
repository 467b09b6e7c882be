package io.herald.cli.console;

import java.io.IOException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "admin-pause", description = "Pause any schedule (admins only)")
final class AdminPauseCommand extends ConsoleCommand {
    @Parameters(index = "0", arity = "1")
    long id;

    AdminPauseCommand(ConsoleSession session) {
        super(session);
    }

    @Override
    protected void execute() throws IOException {
        session.service().adminPause(session.userId(), id);
        println("Schedule " + id + " paused by admin.");
    }
}
