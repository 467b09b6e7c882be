package io.herald.cli.console;

import io.herald.core.schedule.Schedule;
import java.io.IOException;
import java.util.List;
import picocli.CommandLine.Command;

@Command(name = "list", description = "List your schedules")
final class ListCommand extends ConsoleCommand {

    ListCommand(ConsoleSession session) {
        super(session);
    }

    @Override
    protected void execute() throws IOException {
        List<Schedule> schedules = session.service().list(session.userId());
        if (schedules.isEmpty()) {
            println("You have no schedules.");
            return;
        }
        schedules.forEach(schedule -> println(ScheduleFormatter.summary(schedule)));
    }
}
