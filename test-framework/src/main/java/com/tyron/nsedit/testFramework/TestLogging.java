package com.tyron.nsedit.testFramework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Test-only logging setup.
 *
 * Controls java.util.logging output via system properties:
 * - nsedit.test.logLevel=INFO|FINE|FINER|FINEST|WARNING|SEVERE (root level)
 * - nsedit.test.engineLogLevel=... (level for com.tyron.nsedit only; defaults to the root level)
 */
public final class TestLogging {

    public static final String LOG_LEVEL_PROP = "nsedit.test.logLevel";
    public static final String ENGINE_LOG_LEVEL_PROP = "nsedit.test.engineLogLevel";

    private static volatile boolean configured;

    private TestLogging() {
    }

    public static synchronized void configureOnce() {
        if (configured) return;
        configured = true;

        Level rootLevel = parseLevel(System.getProperty(LOG_LEVEL_PROP), Level.INFO);
        Level engineLevel = parseLevel(System.getProperty(ENGINE_LOG_LEVEL_PROP), rootLevel);

        Logger root = Logger.getLogger("");
        root.setLevel(rootLevel);
        Logger.getLogger("com.tyron.nsedit").setLevel(engineLevel);

        Level handlerLevel = engineLevel.intValue() < rootLevel.intValue() ? engineLevel : rootLevel;
        Formatter formatter = new CompactTestLogFormatter();
        for (Handler h : root.getHandlers()) {
            h.setLevel(handlerLevel);
            if (h instanceof ConsoleHandler) {
                h.setFormatter(formatter);
            }
        }

        root.log(Level.INFO, "testLogging configured level=" + rootLevel.getName() + " engineLevel=" + engineLevel.getName());
    }

    static Level parseLevel(String raw, Level fallback) {
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            System.err.println("testLogging unknown level '" + raw + "', using " + fallback.getName());
            return fallback;
        }
    }

    private static final class CompactTestLogFormatter extends Formatter {

        private static final DateTimeFormatter TS = DateTimeFormatter
                .ofPattern("HH:mm:ss.SSS")
                .withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(128)
                    .append(TS.format(Instant.ofEpochMilli(record.getMillis()))).append(' ')
                    .append(String.format(Locale.ROOT, "%-7s", record.getLevel().getName())).append(' ')
                    .append(simpleName(record.getLoggerName())).append(" - ")
                    .append(formatMessage(record))
                    .append('\n');

            Throwable t = record.getThrown();
            if (t != null) {
                StringWriter sw = new StringWriter();
                t.printStackTrace(new PrintWriter(sw));
                out.append(sw);
            }
            return out.toString();
        }

        private static String simpleName(String loggerName) {
            if (loggerName == null || loggerName.isBlank()) return "root";
            return loggerName.substring(loggerName.lastIndexOf('.') + 1);
        }
    }
}
