package io.herald.cli.console;

import io.herald.core.engine.ScheduleSpecException;
import io.herald.core.service.AccessDeniedException;
import io.herald.core.service.ScheduleNotFoundException;
import io.herald.core.transport.DeliveryException;
import java.io.IOException;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for console subcommands. Rejections from the service are printed as {@code Error: ...}
 * and turn into exit code 1.
 */
abstract class ConsoleCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(ConsoleCommand.class);

    protected final ConsoleSession session;

    ConsoleCommand(ConsoleSession session) {
        this.session = session;
    }

    protected abstract void execute() throws IOException, DeliveryException;

    @Override
    public final Integer call() {
        try {
            execute();
            return 0;
        } catch (ScheduleSpecException | ScheduleNotFoundException | AccessDeniedException e) {
            session.out().println("Error: " + e.getMessage());
            return 1;
        } catch (DeliveryException e) {
            session.out().println("Error: failed to send message: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.error("Console command failed for user {}", session.userId(), e);
            session.out().println("Error: " + e.getMessage());
            return 1;
        } finally {
            session.out().flush();
        }
    }

    protected void println(String line) {
        session.out().println(line);
    }
}
