package alpha.onionhttp.core;

import alpha.onionhttp.Application;
import alpha.onionhttp.context.Context;
import alpha.onionhttp.context.ContextRequest;
import alpha.onionhttp.context.ContextResponse;
import alpha.onionhttp.handler.HasStatus;
import alpha.onionhttp.handler.HttpException;
import alpha.onionhttp.transport.IncomingRequest;
import alpha.onionhttp.transport.OutgoingResponse;
import alpha.onionhttp.util.Attributes;
import alpha.onionhttp.util.Statuses;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static alpha.onionhttp.HttpConstants.HeaderName.CONTENT_LENGTH;
import static alpha.onionhttp.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.onionhttp.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.onionhttp.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Context}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultContext implements Context
{
    private static final System.Logger LOG
            = System.getLogger(DefaultContext.class.getPackageName());
    
    static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    
    private final DefaultApplication app;
    private final IncomingRequest in;
    private final OutgoingResponse out;
    private final DefaultContextRequest req;
    private final DefaultContextResponse res;
    private final Attributes state;
    private final String originalUrl;
    private boolean respond;
    
    DefaultContext(DefaultApplication app, IncomingRequest in, OutgoingResponse out) {
        this.app = requireNonNull(app);
        this.in  = requireNonNull(in);
        this.out = requireNonNull(out);
        this.originalUrl = in.url();
        this.req = new DefaultContextRequest(this, originalUrl);
        this.res = new DefaultContextResponse(this, app.jsonWriter());
        this.state = Attributes.create();
        this.respond = true;
    }
    
    @Override
    public Application app() {
        return app;
    }
    
    @Override
    public ContextRequest request() {
        return req;
    }
    
    @Override
    public DefaultContextResponse response() {
        return res;
    }
    
    @Override
    public IncomingRequest incoming() {
        return in;
    }
    
    @Override
    public OutgoingResponse outgoing() {
        return out;
    }
    
    @Override
    public Attributes state() {
        return state;
    }
    
    @Override
    public Optional<Object> attribute(String name) {
        var v = state.getOpt(name);
        return v.isPresent() ? v : app.defaults().getOpt(name);
    }
    
    @Override
    public String originalUrl() {
        return originalUrl;
    }
    
    @Override
    public boolean respond() {
        return respond;
    }
    
    @Override
    public void respond(boolean respond) {
        this.respond = respond;
    }
    
    @Override
    public void onerror(Throwable err) {
        if (err == null) {
            return;
        }
        final Throwable e = unwrap(err);
        try {
            app.errorHandler().handle(e, app);
        } catch (RuntimeException t) {
            t.addSuppressed(e);
            LOG.log(ERROR, "Error handler failed.", t);
        }
        if (out.headersSent() || !out.isWritable()) {
            LOG.log(DEBUG, () ->
                "Response already sent or not writable, can not write error response.");
            return;
        }
        out.headerNames().forEach(out::removeHeader);
        if (e instanceof HttpException h) {
            h.headers().forEach(out::setHeader);
        }
        final int code = statusOf(e);
        final String phrase = Statuses.message(code).orElse(String.valueOf(code));
        final String msg = e instanceof HasStatus s && s.expose() && e.getMessage() != null ?
                e.getMessage() : phrase;
        final byte[] bytes = msg.getBytes(UTF_8);
        out.statusCode(code);
        out.statusMessage(null);
        out.setHeader(CONTENT_TYPE, TEXT_PLAIN);
        out.setHeader(CONTENT_LENGTH, Integer.toString(bytes.length));
        try {
            out.end(bytes);
        } catch (IOException io) {
            io.addSuppressed(e);
            LOG.log(DEBUG, "Failed to write error response.", io);
        }
    }
    
    private static Throwable unwrap(Throwable err) {
        Throwable e = err;
        while ((e instanceof CompletionException || e instanceof ExecutionException) &&
                e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }
    
    private static int statusOf(Throwable e) {
        if (e instanceof FileNotFoundException || e instanceof NoSuchFileException) {
            return FOUR_HUNDRED_FOUR;
        }
        if (e instanceof HasStatus s && Statuses.isValid(s.status())) {
            return s.status();
        }
        return FIVE_HUNDRED;
    }
    
    @Override
    public String toString() {
        return DefaultContext.class.getSimpleName() + "{" +
                "method=" + req.method() +
                ", url=" + req.url() +
                ", status=" + res.status() + "}";
    }
}
