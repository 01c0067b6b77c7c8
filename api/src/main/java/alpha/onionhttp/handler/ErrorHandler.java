package alpha.onionhttp.handler;

import alpha.onionhttp.Application;
import alpha.onionhttp.Config;
import alpha.onionhttp.context.Context;

/**
 * Reports an error that occurred during request processing, or that was
 * emitted by the application itself.<p>
 * 
 * The error handler is an observer. It does not produce the error response;
 * that is the job of {@link Context#onerror(Throwable)}, which calls the
 * application's error handler before writing the response.<p>
 * 
 * An application has exactly one error handler, which is {@link #BASE} unless
 * replaced using {@link Application#errorHandler(ErrorHandler)}. A custom
 * handler may decorate the base handler:
 * 
 * {@snippet :
 *   app.errorHandler((err, app) -> {
 *       metrics.increment("errors");
 *       ErrorHandler.BASE.handle(err, app);
 *   });
 * }
 * 
 * The error handler should not throw an exception. If it does, the exception
 * is logged and otherwise ignored.<p>
 * 
 * The error handler must be thread-safe, as it may be called concurrently.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles the given error.
     * 
     * @param err the error
     * @param app the application that emitted the error
     * 
     * @throws IllegalArgumentException if {@code err} is {@code null}
     */
    void handle(Throwable err, Application app);
    
    /**
     * Is the default error handler.<p>
     * 
     * The handler logs the error's stack trace on level ERROR, each line
     * indented two spaces and surrounded by blank lines, unless:
     * 
     * <ul>
     *   <li>the error implements {@link HasStatus} with status 404, or</li>
     *   <li>the error implements {@link HasStatus} and is
     *       {@linkplain HasStatus#expose() exposed}, or</li>
     *   <li>{@link Config#silent()} is {@code true}.</li>
     * </ul>
     * 
     * A {@code null} error is rejected with an
     * {@code IllegalArgumentException}.
     */
    ErrorHandler BASE = new BaseErrorHandler();
}
