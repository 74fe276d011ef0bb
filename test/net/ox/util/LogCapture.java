package net.ox.util;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/* Collects the records logged to one of the library's loggers while it is
 * attached. */
public class LogCapture extends Handler {

    private final Logger logger;
    private final Level oldLevel;
    private final List<LogRecord> records;

    public LogCapture(String component, Level level) {
        this.logger = Logging.getLogger(component);
        this.oldLevel = logger.getLevel();
        this.records = new ArrayList<LogRecord>();
        setLevel(Level.ALL);
        logger.setLevel(level);
        logger.addHandler(this);
    }
    public LogCapture(String component) {
        this(component, Level.ALL);
    }

    public synchronized void publish(LogRecord record) {
        records.add(record);
    }

    public void flush() {}

    public void close() {
        logger.removeHandler(this);
        logger.setLevel(oldLevel);
    }

    public synchronized List<LogRecord> getRecords() {
        return new ArrayList<LogRecord>(records);
    }

    /**
     * Whether a record at the given level has a message containing text.
     */
    public synchronized boolean contains(Level level, String text) {
        for (LogRecord r : records) {
            if (r.getLevel().equals(level) && r.getMessage() != null &&
                    r.getMessage().contains(text))
                return true;
        }
        return false;
    }

}
