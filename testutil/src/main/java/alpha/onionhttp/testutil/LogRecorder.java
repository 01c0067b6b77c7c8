package alpha.onionhttp.testutil;

import org.assertj.core.api.AbstractThrowableAssert;

import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Predicate;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static alpha.onionhttp.testutil.LogRecords.toJUL;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

/**
 * Records the library's log records, for assertions.<p>
 * 
 * A record matched by an "assertRemove" method is removed, so that later
 * assertions only concern what is left. Typically, a test removes the records
 * it provoked and then asserts that nothing else went wrong:
 * 
 * <pre>{@code
 *     log.assertRemoveContaining(ERROR, "boom");
 *     log.assertNoProblem();
 * }</pre>
 * 
 * Recording must be stopped using {@link #stopRecording()}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class LogRecorder
{
    /**
     * Starts recording records from all of the library's loggers.
     * 
     * @return a new log recorder
     */
    public static LogRecorder startRecording() {
        var rec = new LogRecorder();
        rec.logger = Logging.addHandler(Logging.LIBRARY, rec.handler);
        return rec;
    }
    
    private final Deque<LogRecord> records;
    private final Handler handler;
    // Strong reference; JUL holds loggers weakly
    private Logger logger;
    
    private LogRecorder() {
        records = new ConcurrentLinkedDeque<>();
        handler = new Handler() {
            @Override
            public void publish(LogRecord r) {
                records.add(r);
            }
            
            @Override
            public void flush() {
                // Empty
            }
            
            @Override
            public void close() {
                // Empty
            }
        };
        handler.setLevel(java.util.logging.Level.ALL);
    }
    
    /**
     * Removes the earliest record with the given level whose message contains
     * the given text.
     * 
     * @param level of record
     * @param messageContains text
     * 
     * @return the message of the removed record
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws AssertionError if no record matched
     */
    public String assertRemoveContaining(
            System.Logger.Level level, String messageContains) {
        var jul = toJUL(level);
        requireNonNull(messageContains);
        return assertRemoveIf(r ->
                r.getLevel().equals(jul) &&
                r.getMessage().contains(messageContains)).getMessage();
    }
    
    /**
     * Removes the earliest record with the given level, a message starting
     * with the given text, and a throwable of the given type.
     * 
     * @param level of record
     * @param messageStartsWith text
     * @param thr type of the record's throwable
     * 
     * @return an assert object of the throwable
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws AssertionError if no record matched
     */
    public AbstractThrowableAssert<?, ? extends Throwable>
           assertRemove(System.Logger.Level level, String messageStartsWith,
           Class<? extends Throwable> thr)
    {
        var jul = toJUL(level);
        requireNonNull(messageStartsWith);
        requireNonNull(thr);
        var rec = assertRemoveIf(r ->
                r.getLevel().equals(jul) &&
                r.getMessage().startsWith(messageStartsWith) &&
                thr.isInstance(r.getThrown()));
        return assertThat(rec.getThrown());
    }
    
    /**
     * Asserts that no remaining record has a throwable or a level above
     * {@code INFO}.
     * 
     * @return this for chaining/fluency
     * 
     * @throws AssertionError if a problem was recorded
     */
    public LogRecorder assertNoProblem() {
        var info = java.util.logging.Level.INFO.intValue();
        var problems = records.stream()
                .filter(r -> r.getLevel().intValue() > info || r.getThrown() != null)
                .map(LogRecords::describe)
                .collect(joining("\n  "));
        if (!problems.isEmpty()) {
            fail("Unexpected log records:\n  " + problems);
        }
        return this;
    }
    
    /**
     * Stops recording.
     */
    public void stopRecording() {
        logger.removeHandler(handler);
    }
    
    private LogRecord assertRemoveIf(Predicate<LogRecord> test) {
        var it = records.iterator();
        while (it.hasNext()) {
            var r = it.next();
            if (test.test(r)) {
                it.remove();
                return r;
            }
        }
        throw new AssertionError("No matching record, saw: " + records.stream()
                .map(LogRecords::describe).collect(joining(", ", "[", "]")));
    }
}
