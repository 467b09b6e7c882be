package io.herald.cli.console;

import io.herald.core.schedule.Schedule;
import java.io.IOException;
import java.util.List;
import picocli.CommandLine.Command;

@Command(name = "admin-list", description = "List every schedule (admins only)")
final class AdminListCommand extends ConsoleCommand {

    AdminListCommand(ConsoleSession session) {
        super(session);
    }

    @Override
    protected void execute() throws IOException {
        List<Schedule> schedules = session.service().adminListAll(session.userId());
        if (schedules.isEmpty()) {
            println("No schedules.");
            return;
        }
        schedules.forEach(schedule -> println(ScheduleFormatter.adminSummary(schedule)));
    }
}
