package alpha.onionhttp.handler;

import alpha.onionhttp.context.Context;

/**
 * Adds {@link #status()} and {@link #expose()}.<p>
 * 
 * This interface is intended to be implemented by exception classes from
 * components aware of their HTTP environment. When such an exception reaches
 * {@link Context#onerror(Throwable)}, the status code of the error response is
 * taken from the exception instead of defaulting to 500 (Internal Server
 * Error).<p>
 * 
 * The library ships one implementation, {@link HttpException}, which should be
 * sufficient for most applications.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface HasStatus {
    /**
     * Returns the status code of the error response.<p>
     * 
     * A code outside the range 100 to 999 is ignored and replaced with 500
     * (Internal Server Error).
     * 
     * @return the status code
     */
    int status();
    
    /**
     * Returns whether the exception message is safe to show to the client.<p>
     * 
     * If {@code true}, the message is used as the body of the error response,
     * and the {@linkplain ErrorHandler#BASE base error handler} does not log
     * the exception.
     * 
     * @implSpec
     * The default implementation returns {@code true} if the
     * {@linkplain #status() status} is less than 500.
     * 
     * @return see JavaDoc
     */
    default boolean expose() {
        return status() < 500;
    }
}
