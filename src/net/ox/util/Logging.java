package net.ox.util;

import java.io.OutputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;
import net.ox.util.config.Configuration;

public final class Logging {

    public static final String LEVEL_KEY = "ox.log.level";

    /* The components of this library log to loggers named after
     * themselves; they share this parent. */
    public static final String ROOT_LOGGER = "net.ox";

    private Logging() {}

    public static Logger getLogger(String component) {
        return Logger.getLogger(ROOT_LOGGER + "." + component);
    }

    public static void initFormat() {
        System.setProperty("java.util.logging.SimpleFormatter.format",
                           "[%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS.%1$tL " +
                           "%4$s %3$s] %5$s%6$s%n");
    }

    public static void redirectToStream(OutputStream os) {
        Logger rootLogger = Logger.getLogger("");
        Handler newhnd = new StreamHandler(os, new SimpleFormatter()) {
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        newhnd.setLevel(Level.ALL);
        for (Handler hnd : rootLogger.getHandlers()) {
            rootLogger.removeHandler(hnd);
        }
        rootLogger.addHandler(newhnd);
    }

    public static Level applyLevel(Configuration config) {
        String value = config.get(LEVEL_KEY);
        Level level;
        try {
            level = (value == null) ? Level.INFO : Level.parse(value.trim());
        } catch (IllegalArgumentException exc) {
            Logger.getLogger(ROOT_LOGGER).warning("Ignoring invalid " +
                LEVEL_KEY + " value " + Formats.formatString(value));
            level = Level.INFO;
        }
        Logger.getLogger(ROOT_LOGGER).setLevel(level);
        return level;
    }

}
