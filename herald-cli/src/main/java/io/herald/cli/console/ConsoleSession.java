package io.herald.cli.console;

import io.herald.core.service.ScheduleService;
import java.io.PrintWriter;

public record ConsoleSession(ScheduleService service, String userId, PrintWriter out) {
}
