package io.herald.cli.console;

import io.herald.core.transport.DeliveryException;
import java.io.IOException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "test", description = "Send a schedule's message right now")
final class TestCommand extends ConsoleCommand {
    @Parameters(index = "0", arity = "1")
    long id;

    TestCommand(ConsoleSession session) {
        super(session);
    }

    @Override
    protected void execute() throws IOException, DeliveryException {
        session.service().test(session.userId(), id);
        println("Test message sent for schedule " + id + ".");
    }
}
