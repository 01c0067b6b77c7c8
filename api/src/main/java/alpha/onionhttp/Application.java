package alpha.onionhttp;

import alpha.onionhttp.context.Context;
import alpha.onionhttp.handler.ErrorHandler;
import alpha.onionhttp.middleware.Middleware;
import alpha.onionhttp.middleware.Pipeline;
import alpha.onionhttp.transport.IncomingRequest;
import alpha.onionhttp.transport.OutgoingResponse;
import alpha.onionhttp.transport.RequestListener;
import alpha.onionhttp.util.Attributes;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Is a stack of middleware, composed and executed for each request.<p>
 * 
 * A trivial example:
 * 
 * <pre>{@code
 *    Application app = Application.create();
 *    app.use((ctx, next) -> {
 *        ctx.body("Hello");
 *        return next.proceed();
 *    });
 *    Server server = app.listen(8080);
 * }</pre>
 * 
 * The application does not itself manage sockets. {@link #callback()} returns
 * a {@link RequestListener} that any transport may call with a raw request and
 * response pair. For convenience, {@link #listen(int)} starts a server backed
 * by the JDK's built-in HTTP server.<p>
 * 
 * For each request, the application creates a {@link Context}, sets the
 * initial status to 404 (Not Found), executes the middleware pipeline, and
 * finally serializes the response. Errors end up in
 * {@link Context#onerror(Throwable)} and the application's
 * {@link ErrorHandler}.<p>
 * 
 * Middleware and the error handler should be installed before the
 * application starts serving requests. The middleware list is snapshotted
 * when the pipeline is composed, so middleware added after a call to
 * {@link #callback()} affects only pipelines composed afterwards.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Application
{
    /**
     * Creates an application using {@linkplain Config#DEFAULT default
     * configuration} and the {@linkplain ErrorHandler#BASE base error
     * handler}.
     * 
     * @return an instance of {@code Application}
     */
    static Application create() {
        return create(Config.DEFAULT);
    }
    
    /**
     * Creates an application using the {@linkplain ErrorHandler#BASE base
     * error handler}.
     * 
     * @param config of application
     * 
     * @return an instance of {@code Application}
     * 
     * @throws NullPointerException if {@code config} is {@code null}
     */
    static Application create(Config config) {
        return create(config, ErrorHandler.BASE);
    }
    
    /**
     * Creates an application.<p>
     * 
     * The implementation is loaded using {@link ServiceLoader}. Exactly one
     * {@link ApplicationFactory} must be present on the class- or module
     * path.
     * 
     * @param config of application
     * @param eh     error handler
     * 
     * @return an instance of {@code Application}
     * 
     * @throws NullPointerException if an argument is {@code null}
     */
    static Application create(Config config, ErrorHandler eh) {
        var loader = ServiceLoader.load(ApplicationFactory.class);
        var factories = loader.stream().toList();
        if (factories.size() != 1) {
            throw new AssertionError(
                "Expected 1 factory, saw: " + factories.size());
        }
        return factories.get(0).get().create(config, eh);
    }
    
    /**
     * Appends a middleware to the stack.
     * 
     * @param mw the middleware
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException if {@code mw} is {@code null}
     */
    Application use(Middleware mw);
    
    /**
     * Returns the middleware installed.
     * 
     * @return the middleware (never {@code null}, unmodifiable snapshot)
     */
    List<Middleware> middleware();
    
    /**
     * Composes the middleware pipeline and returns a request listener.<p>
     * 
     * The listener creates a context and dispatches it through the pipeline
     * composed by this method. The stage returned by the listener never
     * completes exceptionally because of a pipeline error.
     * 
     * @return a request listener (never {@code null})
     */
    RequestListener callback();
    
    /**
     * Creates a new context.<p>
     * 
     * The only property read from the raw request is its URL, which becomes
     * the context's original URL.
     * 
     * @param in  raw request
     * @param out raw response
     * 
     * @return a new context
     * 
     * @throws NullPointerException if an argument is {@code null}
     */
    Context createContext(IncomingRequest in, OutgoingResponse out);
    
    /**
     * Executes the given pipeline for the given context.<p>
     * 
     * The status is set to 404 (Not Found) before the pipeline executes. On
     * success, the response is serialized. On failure, the error is handed to
     * {@link Context#onerror(Throwable)}.
     * 
     * @param ctx      context
     * @param pipeline to execute
     * 
     * @return a stage that completes when the response has been handled
     * 
     * @throws NullPointerException if an argument is {@code null}
     */
    CompletionStage<Void> handleRequest(Context ctx, Pipeline pipeline);
    
    /**
     * Returns the context of the request being processed by the calling
     * thread.<p>
     * 
     * The returned optional is always empty, unless
     * {@link Config#contextPropagation()} is {@code true}, or the calling
     * thread executes downstream of the middleware returned by
     * {@link #contextStorageMiddleware()}.
     * 
     * @return the active context (never {@code null} but possibly empty)
     */
    Optional<Context> currentContext();
    
    /**
     * Returns a middleware that makes the context retrievable through
     * {@link #currentContext()} for the rest of the pipeline.<p>
     * 
     * Useful when {@link Config#contextPropagation()} is {@code false}, and
     * propagation is only wanted for a part of the stack.
     * 
     * @return a middleware (never {@code null})
     */
    Middleware contextStorageMiddleware();

    /**
     * Wraps the given executor.<p>
     *
     * A task submitted to the returned executor by a thread that has a
     * {@linkplain #currentContext() current context} will execute with the
     * same current context.
     *
     * @param delegate the executor
     *
     * @return a context-propagating executor
     *
     * @throws NullPointerException if {@code delegate} is {@code null}
     */
    Executor contextExecutor(Executor delegate);

    /**
     * {@return the error handler}
     */
    ErrorHandler errorHandler();
    
    /**
     * Replaces the error handler.
     * 
     * @param eh the new error handler
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException if {@code eh} is {@code null}
     */
    Application errorHandler(ErrorHandler eh);
    
    /**
     * Returns the application-wide attributes.<p>
     * 
     * Every context falls back to these attributes when a name is not found
     * in its own {@linkplain Context#state() state}. See
     * {@link Context#attribute(String)}.
     * 
     * @return the application-wide attributes (never {@code null})
     */
    Attributes defaults();
    
    /**
     * Returns the application's configuration.
     * 
     * @return the application's configuration (never {@code null})
     */
    Config getConfig();
    
    /**
     * Returns a snapshot of the public configuration.<p>
     * 
     * The map contains exactly the keys "subdomainOffset", "proxy" and "env",
     * in that order.
     * 
     * @return a snapshot (never {@code null}, unmodifiable)
     */
    Map<String, Object> toJson();
    
    /**
     * Starts a server on the wildcard address and the given port.
     * 
     * @param port to listen on (0 for a system-picked port)
     * 
     * @return a running server
     * 
     * @throws IOException if the server could not be bound
     */
    Server listen(int port) throws IOException;
    
    /**
     * Starts a server on the given address.
     * 
     * @param address to listen on
     * 
     * @return a running server
     * 
     * @throws NullPointerException if {@code address} is {@code null}
     * @throws IOException if the server could not be bound
     */
    Server listen(InetSocketAddress address) throws IOException;
}
