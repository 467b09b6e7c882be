package io.herald.cli.console;

import java.io.IOException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "delete", description = "Delete one of your schedules")
final class DeleteCommand extends ConsoleCommand {
    @Parameters(index = "0", arity = "1")
    long id;

    DeleteCommand(ConsoleSession session) {
        super(session);
    }

    @Override
    protected void execute() throws IOException {
        session.service().delete(session.userId(), id);
        println("Schedule " + id + " deleted.");
    }
}
