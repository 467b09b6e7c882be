package io.herald.app;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/** Adjusts the Logback levels set up by {@code logback.xml} once the config is known. */
final class LoggingConfigurator {
    static final String HERALD_LOGGER = "io.herald";

    private LoggingConfigurator() {
    }

    static void configure(boolean debug) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            configure(context, debug);
        } else {
            LoggerFactory.getLogger(LoggingConfigurator.class)
                .debug("Skipping logback configuration; factory is {}", factory.getClass().getName());
        }
    }

    static void configure(LoggerContext context, boolean debug) {
        Logger herald = context.getLogger(HERALD_LOGGER);
        herald.setLevel(debug ? Level.DEBUG : Level.INFO);
    }
}
