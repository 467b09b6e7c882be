package io.herald.cli.console;

import java.io.IOException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "set-timezone", description = "Set your IANA timezone")
final class SetTimezoneCommand extends ConsoleCommand {
    @Parameters(index = "0", arity = "1", description = "IANA timezone, e.g. Asia/Kolkata")
    String timezone;

    SetTimezoneCommand(ConsoleSession session) {
        super(session);
    }

    @Override
    protected void execute() throws IOException {
        String zone = session.service().setTimezone(session.userId(), timezone);
        println("Timezone set to " + zone);
    }
}
