package io.herald.cli.console;

import java.io.IOException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "resume", description = "Resume one of your paused schedules")
final class ResumeCommand extends ConsoleCommand {
    @Parameters(index = "0", arity = "1")
    long id;

    ResumeCommand(ConsoleSession session) {
        super(session);
    }

    @Override
    protected void execute() throws IOException {
        session.service().resume(session.userId(), id);
        println("Schedule " + id + " resumed.");
    }
}
