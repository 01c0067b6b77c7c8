package alpha.onionhttp.testutil;

import java.util.logging.LogRecord;

import static java.util.Objects.requireNonNull;

/**
 * Utils for JUL's {@link LogRecord}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class LogRecords {
    private LogRecords() {
        // Empty
    }
    
    /**
     * Renders the level, logger, message and throwable of a record.<p>
     * 
     * Used in assertion failure messages; {@code LogRecord} has no
     * {@code toString}.
     * 
     * @param rec log record
     * @return a one-line description
     */
    public static String describe(LogRecord rec) {
        var s = rec.getLevel() + " [" + rec.getLoggerName() + "] " + rec.getMessage();
        return rec.getThrown() == null ? s : s + " (" + rec.getThrown() + ")";
    }
    
    /**
     * Converts {@code System.Logger.Level} to {@code java.util.logging.Level},
     * the same way the JDK does when JUL backs {@code System.Logger}.
     *
     * @param level to convert
     * @return the JUL level
     * @throws NullPointerException if {@code level} is {@code null}
     */
    static java.util.logging.Level toJUL(System.Logger.Level level) {
        switch (requireNonNull(level)) {
            case ALL:     return java.util.logging.Level.ALL;
            case TRACE:   return java.util.logging.Level.FINER;
            case DEBUG:   return java.util.logging.Level.FINE;
            case INFO:    return java.util.logging.Level.INFO;
            case WARNING: return java.util.logging.Level.WARNING;
            case ERROR:   return java.util.logging.Level.SEVERE;
            case OFF:     return java.util.logging.Level.OFF;
            default: throw new IllegalArgumentException(
                    "No JUL match for this level: " + level);
        }
    }
}
