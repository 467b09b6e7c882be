package io.herald.cli.console;

import picocli.CommandLine.Command;

@Command(name = "help", description = "Show console commands")
final class HelpCommand extends ConsoleCommand {
    private static final String TEXT = """
        Schedule commands:
          create --title <t> --message <m> --channel <c> --repeat none|interval|weekly [--value <v>]
          list
          edit <id> [--title <t>] [--message <m>] [--channel <c>] [--repeat <type>] [--value <v>]
          pause <id>
          resume <id>
          delete <id>
          test <id>
          set-timezone <zone>
        Admin commands:
          admin-list
          admin-pause <id>
          admin-delete <id>
        Repeat values:
          none      empty to send now, or 'YYYY-MM-DD HH:MM' in your timezone
          interval  durations such as 30m, 2h or 1h30m
          weekly    days and time such as 'mon,wed,fri 09:00'
        Type 'quit' or 'exit' to leave.""";

    HelpCommand(ConsoleSession session) {
        super(session);
    }

    @Override
    protected void execute() {
        println(TEXT);
    }
}
