package io.herald.cli.console;

import io.herald.core.service.ScheduleService;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Objects;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Line-oriented front end over {@link ScheduleService}. Each line is parsed by a fresh picocli tree
 * so options never leak between commands.
 */
public final class ScheduleConsole {
    private final ConsoleSession session;
    private final BufferedReader in;

    public ScheduleConsole(ScheduleService service, String userId, BufferedReader in, PrintWriter out) {
        this.session = new ConsoleSession(
            Objects.requireNonNull(service, "service must not be null"),
            Objects.requireNonNull(userId, "userId must not be null"),
            Objects.requireNonNull(out, "out must not be null")
        );
        this.in = Objects.requireNonNull(in, "in must not be null");
    }

    public void run() throws IOException {
        PrintWriter out = session.out();
        out.println("Herald console. Acting as '" + session.userId() + "'. Type 'help' for commands.");
        while (true) {
            out.print("> ");
            out.flush();
            String line = in.readLine();
            if (line == null) {
                break;
            }
            String trimmed = line.trim();
            if (trimmed.equals("quit") || trimmed.equals("exit")) {
                break;
            }
            execute(trimmed);
        }
        out.println("Bye.");
        out.flush();
    }

    /**
     * @return the command's exit code, 0 for blank lines
     */
    public int execute(String line) {
        List<String> args;
        try {
            args = CommandLineTokenizer.tokenize(line);
        } catch (IllegalArgumentException e) {
            session.out().println("Error: " + e.getMessage());
            session.out().flush();
            return 1;
        }
        if (args.isEmpty()) {
            return 0;
        }
        CommandLine commandLine = newCommandLine();
        int code = commandLine.execute(args.toArray(String[]::new));
        session.out().flush();
        return code;
    }

    private CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new ConsoleRoot());
        commandLine.addSubcommand("help", new HelpCommand(session));
        commandLine.addSubcommand("set-timezone", new SetTimezoneCommand(session));
        commandLine.addSubcommand("create", new CreateCommand(session));
        commandLine.addSubcommand("list", new ListCommand(session));
        commandLine.addSubcommand("edit", new EditCommand(session));
        commandLine.addSubcommand("pause", new PauseCommand(session));
        commandLine.addSubcommand("resume", new ResumeCommand(session));
        commandLine.addSubcommand("delete", new DeleteCommand(session));
        commandLine.addSubcommand("test", new TestCommand(session));
        commandLine.addSubcommand("admin-list", new AdminListCommand(session));
        commandLine.addSubcommand("admin-pause", new AdminPauseCommand(session));
        commandLine.addSubcommand("admin-delete", new AdminDeleteCommand(session));
        commandLine.setOut(session.out());
        commandLine.setErr(session.out());
        return commandLine;
    }

    @Command(name = "console", description = "Herald console")
    static final class ConsoleRoot implements Runnable {
        @Override
        public void run() {
            // Lines always name a subcommand.
        }
    }
}
