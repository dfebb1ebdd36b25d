package com.diskwatcher.app.config;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/** Applies the user-facing log level names to the Logback root logger. */
public final class LoggingSetup {

    private LoggingSetup() {}

    /** Accepts debug, info, warning (or warn), error and critical. */
    public static Level apply(String levelName) {
        Level level = toLogback(UserSettings.normalizeLogLevel(levelName));
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx) {
            Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            root.setLevel(level);
        }
        return level;
    }

    static Level toLogback(String normalized) {
        return switch (normalized) {
            case "debug" -> Level.DEBUG;
            case "warning" -> Level.WARN;
            case "error", "critical" -> Level.ERROR;
            default -> Level.INFO;
        };
    }
}
