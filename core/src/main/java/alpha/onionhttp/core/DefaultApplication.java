package alpha.onionhttp.core;

import alpha.onionhttp.Application;
import alpha.onionhttp.Config;
import alpha.onionhttp.Server;
import alpha.onionhttp.context.Context;
import alpha.onionhttp.handler.ErrorHandler;
import alpha.onionhttp.middleware.Composer;
import alpha.onionhttp.middleware.Middleware;
import alpha.onionhttp.middleware.Pipeline;
import alpha.onionhttp.transport.IncomingRequest;
import alpha.onionhttp.transport.OutgoingResponse;
import alpha.onionhttp.transport.RequestListener;
import alpha.onionhttp.util.Attributes;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Application}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class DefaultApplication implements Application
{
    private static final System.Logger LOG
            = System.getLogger(DefaultApplication.class.getPackageName());
    
    private final Config config;
    private final List<Middleware> middleware;
    private final Attributes defaults;
    private final JsonWriter json;
    private final RequestDispatcher dispatcher;
    private volatile ErrorHandler errorHandler;
    
    /**
     * Constructs a {@code DefaultApplication}.
     * 
     * @param config of application
     * @param eh error handler
     * 
     * @throws NullPointerException if an argument is {@code null}
     */
    public DefaultApplication(Config config, ErrorHandler eh) {
        this.config       = requireNonNull(config);
        this.errorHandler = requireNonNull(eh);
        this.middleware   = new CopyOnWriteArrayList<>();
        this.defaults     = Attributes.create();
        this.json         = new JsonWriter();
        this.dispatcher   = new RequestDispatcher(
                new ResponseSerializer(json), config.contextPropagation());
    }
    
    @Override
    public Application use(Middleware mw) {
        middleware.add(requireNonNull(mw, "middleware"));
        LOG.log(DEBUG, () -> "Using middleware: " + mw);
        return this;
    }
    
    @Override
    public List<Middleware> middleware() {
        return List.copyOf(middleware);
    }
    
    @Override
    public RequestListener callback() {
        final Pipeline pipeline = composer().compose(middleware);
        return (in, out) -> handleRequest(createContext(in, out), pipeline);
    }
    
    private Composer composer() {
        var c = config.composer();
        return c != null ? c : DefaultComposer.INSTANCE;
    }
    
    @Override
    public Context createContext(IncomingRequest in, OutgoingResponse out) {
        return new DefaultContext(this, in, out);
    }
    
    @Override
    public CompletionStage<Void> handleRequest(Context ctx, Pipeline pipeline) {
        return dispatcher.dispatch(requireNonNull(ctx), requireNonNull(pipeline));
    }
    
    @Override
    public Optional<Context> currentContext() {
        return ContextStorage.current().filter(c -> c.app() == this);
    }
    
    @Override
    public Middleware contextStorageMiddleware() {
        return (ctx, next) -> ContextStorage.run(ctx, () ->
                ContextStorage.propagate(ctx, next.proceed()));
    }
    
    @Override
    public Executor contextExecutor(Executor delegate) {
        return ContextStorage.bind(delegate);
    }
    
    @Override
    public ErrorHandler errorHandler() {
        return errorHandler;
    }
    
    @Override
    public Application errorHandler(ErrorHandler eh) {
        errorHandler = requireNonNull(eh);
        return this;
    }
    
    @Override
    public Attributes defaults() {
        return defaults;
    }
    
    @Override
    public Config getConfig() {
        return config;
    }
    
    @Override
    public Map<String, Object> toJson() {
        var map = new LinkedHashMap<String, Object>();
        map.put("subdomainOffset", config.subdomainOffset());
        map.put("proxy", config.proxy());
        map.put("env", config.env());
        return unmodifiableMap(map);
    }
    
    @Override
    public Server listen(int port) throws IOException {
        return listen(new InetSocketAddress(port));
    }
    
    @Override
    public Server listen(InetSocketAddress address) throws IOException {
        return JdkHttpTransport.start(requireNonNull(address), callback());
    }
    
    JsonWriter jsonWriter() {
        return json;
    }
    
    @Override
    public String toString() {
        return toJson().toString();
    }
}
