package io.herald.cli.console;

import io.herald.core.schedule.Schedule;
import io.herald.core.schedule.ScheduleDraft;
import java.io.IOException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Options that are left out keep the schedule's current value.
 */
@Command(name = "edit", description = "Edit one of your schedules")
final class EditCommand extends ConsoleCommand {
    @Parameters(index = "0", arity = "1")
    long id;

    @Option(names = "--title")
    String title;

    @Option(names = "--message")
    String message;

    @Option(names = "--channel")
    String channel;

    @Option(names = "--repeat")
    String repeat;

    @Option(names = "--value")
    String value;

    EditCommand(ConsoleSession session) {
        super(session);
    }

    @Override
    protected void execute() throws IOException {
        Schedule current = session.service().get(session.userId(), id);
        ScheduleDraft draft = new ScheduleDraft(
            title != null ? title : current.title(),
            message != null ? message : current.message(),
            channel != null ? channel : current.channel(),
            repeat != null ? repeat : current.repeatType().label(),
            value != null ? value : current.repeatValue()
        );
        Schedule edited = session.service().edit(session.userId(), id, draft);
        println("Schedule " + edited.id() + " updated.");
        println(ScheduleFormatter.summary(edited));
    }
}
