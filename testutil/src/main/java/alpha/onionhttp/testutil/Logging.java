package alpha.onionhttp.testutil;

import java.util.logging.Handler;
import java.util.logging.Logger;

import static java.util.Objects.requireNonNull;

/**
 * Attaches JUL handlers to the library's loggers.<p>
 * 
 * The library names each logger after the package of the logging class, so
 * all of them descend from {@value #LIBRARY}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Logging {
    /**
     * The name of the library's root logger.
     */
    public static final String LIBRARY = "alpha.onionhttp";
    
    private Logging() {
        // Empty
    }
    
    /**
     * Adds a handler to the named logger.<p>
     * 
     * JUL references loggers weakly. The caller must hold on to the returned
     * logger for as long as the handler should stay installed.
     * 
     * @param logger name
     * @param handler to add
     * 
     * @return the logger
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static Logger addHandler(String logger, Handler handler) {
        var l = Logger.getLogger(requireNonNull(logger));
        l.addHandler(requireNonNull(handler));
        return l;
    }
}
