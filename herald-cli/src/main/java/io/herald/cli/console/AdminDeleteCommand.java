package io.herald.cli.console;

import java.io.IOException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "admin-delete", description = "Delete any schedule (admins only)")
final class AdminDeleteCommand extends ConsoleCommand {
    @Parameters(index = "0", arity = "1")
    long id;

    AdminDeleteCommand(ConsoleSession session) {
        super(session);
    }

    @Override
    protected void execute() throws IOException {
        session.service().adminDelete(session.userId(), id);
        println("Schedule " + id + " deleted by admin.");
    }
}
