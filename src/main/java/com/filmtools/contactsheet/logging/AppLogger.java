package com.filmtools.contactsheet.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UnsupportedEncodingException;
import java.util.Locale;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides a shared logger configuration for the application.
 */
public final class AppLogger {
    static final String LOGGER_NAME = "com.filmtools.contactsheet";
    private static final String LEVEL_PROPERTY = "contactsheet.logLevel";

    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger(LOGGER_NAME);
        logger.setUseParentHandlers(false);
        Formatter formatter = new ConsoleFormatter();

        StreamHandler consoleHandler = new StreamHandler(System.err, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException("UTF-8 console encoding unavailable", e);
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(resolveLevel(System.getProperty(LEVEL_PROPERTY)));
        return logger;
    }

    /**
     * One line per record; a thrown exception follows with its full stack trace.
     */
    static final class ConsoleFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            String line = "%s %s%n".formatted(record.getLevel().getName(), formatMessage(record));
            if (record.getThrown() != null) {
                StringWriter trace = new StringWriter();
                try (PrintWriter writer = new PrintWriter(trace)) {
                    record.getThrown().printStackTrace(writer);
                }
                line += "    caused by " + trace;
            }
            return line;
        }
    }

    static Level resolveLevel(String configured) {
        if (configured == null || configured.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.parse(configured.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return Level.INFO;
        }
    }
}
