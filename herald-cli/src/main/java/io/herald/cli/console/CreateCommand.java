package io.herald.cli.console;

import io.herald.core.schedule.Schedule;
import io.herald.core.schedule.ScheduleDraft;
import java.io.IOException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "create", description = "Create a scheduled message")
final class CreateCommand extends ConsoleCommand {
    @Option(names = "--title", required = true)
    String title;

    @Option(names = "--message", required = true)
    String message;

    @Option(names = "--channel", required = true)
    String channel;

    @Option(names = "--repeat", required = true, description = "none, interval or weekly")
    String repeat;

    @Option(names = "--value", defaultValue = "")
    String value;

    CreateCommand(ConsoleSession session) {
        super(session);
    }

    @Override
    protected void execute() throws IOException {
        Schedule created = session.service().create(
            session.userId(),
            new ScheduleDraft(title, message, channel, repeat, value)
        );
        println("Schedule created! ID: " + created.id());
        println("Title: " + created.title());
        println("Repeat: " + ScheduleFormatter.repeat(created));
        println("Timezone: " + created.ownerTimezone());
    }
}
