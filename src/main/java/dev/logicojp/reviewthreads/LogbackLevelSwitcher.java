package dev.logicojp.reviewthreads;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Switches the Logback root and application loggers to DEBUG for `--verbose`.
final class LogbackLevelSwitcher {

    static final String APP_LOGGER = "dev.logicojp";

    private LogbackLevelSwitcher() {
    }

    /// @return {@code false} if SLF4J is not bound to Logback
    static boolean setDebug() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            return false;
        }
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
        context.getLogger(APP_LOGGER).setLevel(Level.DEBUG);
        return true;
    }
}
