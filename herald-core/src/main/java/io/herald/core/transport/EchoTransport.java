package io.herald.core.transport;

import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints messages instead of delivering them. Used when no bot token is configured.
 */
public final class EchoTransport implements MessageTransport {
    private static final Logger LOG = LoggerFactory.getLogger(EchoTransport.class);

    private final PrintStream out;

    public EchoTransport(PrintStream out) {
        this.out = out;
    }

    @Override
    public String name() {
        return "echo";
    }

    @Override
    public void send(String channel, String message) {
        LOG.debug("Echoing message for channel {}", channel);
        out.println("[" + channel + "] " + message);
    }
}
