package alpha.onionhttp.core;

import alpha.onionhttp.Application;
import alpha.onionhttp.context.Context;
import alpha.onionhttp.context.ContextRequest;
import alpha.onionhttp.context.ContextResponse;
import alpha.onionhttp.transport.OutgoingResponse;
import alpha.onionhttp.util.Statuses;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.Optional;
import java.util.OptionalLong;

import static alpha.onionhttp.HttpConstants.HeaderName.CONTENT_LENGTH;
import static alpha.onionhttp.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.onionhttp.HttpConstants.HeaderName.TRANSFER_ENCODING;
import static alpha.onionhttp.HttpConstants.StatusCode.TWO_HUNDRED;
import static alpha.onionhttp.HttpConstants.StatusCode.TWO_HUNDRED_FOUR;
import static java.lang.System.Logger.Level.DEBUG;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link ContextResponse}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultContextResponse implements ContextResponse
{
    private static final System.Logger LOG
            = System.getLogger(DefaultContextResponse.class.getPackageName());
    
    static final String
            TEXT_HTML    = "text/html; charset=utf-8",
            OCTET_STREAM = "application/octet-stream",
            JSON         = "application/json; charset=utf-8";
    
    private final DefaultContext ctx;
    private final JsonWriter json;
    private Object body;
    private boolean explicitStatus,
                    explicitNullBody;
    
    DefaultContextResponse(DefaultContext ctx, JsonWriter json) {
        this.ctx  = ctx;
        this.json = json;
    }
    
    @Override
    public Context context() {
        return ctx;
    }
    
    @Override
    public ContextRequest request() {
        return ctx.request();
    }
    
    @Override
    public Application app() {
        return ctx.app();
    }
    
    @Override
    public OutgoingResponse outgoing() {
        return ctx.outgoing();
    }
    
    @Override
    public int status() {
        return outgoing().statusCode();
    }
    
    @Override
    public void status(int code) {
        if (!Statuses.isValid(code)) {
            throw new IllegalArgumentException("Invalid status code: " + code);
        }
        if (headersSent()) {
            return;
        }
        explicitStatus = true;
        outgoing().statusCode(code);
        outgoing().statusMessage(null);
        if (body != null && Statuses.isBodyless(code)) {
            body(null);
        }
    }
    
    @Override
    public Optional<String> message() {
        var msg = outgoing().statusMessage();
        return msg != null ? Optional.of(msg) : Statuses.message(status());
    }
    
    @Override
    public void message(String phrase) {
        outgoing().statusMessage(requireNonNull(phrase));
    }
    
    @Override
    public Object body() {
        return body;
    }
    
    @Override
    public void body(Object body) {
        this.body = body;
        if (body == null) {
            if (!Statuses.isBodyless(status())) {
                status(TWO_HUNDRED_FOUR);
            }
            explicitNullBody = true;
            remove(CONTENT_TYPE);
            remove(CONTENT_LENGTH);
            remove(TRANSFER_ENCODING);
            return;
        }
        if (!explicitStatus) {
            status(TWO_HUNDRED);
        }
        explicitNullBody = false;
        final boolean setType = !has(CONTENT_TYPE);
        if (body instanceof String str) {
            if (setType) {
                type(str.stripLeading().startsWith("<") ?
                        TEXT_HTML : DefaultContext.TEXT_PLAIN);
            }
            length(str.getBytes(UTF_8).length);
        } else if (body instanceof byte[] || body instanceof ByteBuffer) {
            if (setType) {
                type(OCTET_STREAM);
            }
            length(body instanceof byte[] b ? b.length : ((ByteBuffer) body).remaining());
        } else if (body instanceof InputStream) {
            if (setType) {
                type(OCTET_STREAM);
            }
            remove(CONTENT_LENGTH);
        } else {
            remove(CONTENT_LENGTH);
            type(JSON);
        }
    }
    
    @Override
    public boolean explicitNullBody() {
        return explicitNullBody;
    }
    
    @Override
    public OptionalLong length() {
        var header = get(CONTENT_LENGTH);
        if (header.isPresent()) {
            try {
                return OptionalLong.of(Long.parseLong(header.get().strip()));
            } catch (NumberFormatException e) {
                LOG.log(DEBUG, () -> "Ignoring malformed Content-Length: " + header.get());
            }
        }
        if (body == null || body instanceof InputStream) {
            return OptionalLong.empty();
        }
        if (body instanceof String str) {
            return OptionalLong.of(str.getBytes(UTF_8).length);
        }
        if (body instanceof byte[] b) {
            return OptionalLong.of(b.length);
        }
        if (body instanceof ByteBuffer buf) {
            return OptionalLong.of(buf.remaining());
        }
        try {
            return OptionalLong.of(json.write(body).length);
        } catch (JsonProcessingException e) {
            LOG.log(DEBUG, "Body length unknown; JSON serialization failed.", e);
            return OptionalLong.empty();
        }
    }
    
    @Override
    public void length(long length) {
        if (!has(TRANSFER_ENCODING)) {
            set(CONTENT_LENGTH, Long.toString(length));
        }
    }
    
    @Override
    public Optional<String> type() {
        return get(CONTENT_TYPE);
    }
    
    @Override
    public void type(String type) {
        set(CONTENT_TYPE, requireNonNull(type));
    }
    
    @Override
    public Optional<String> get(String name) {
        return outgoing().header(name);
    }
    
    @Override
    public void set(String name, String value) {
        if (!headersSent()) {
            outgoing().setHeader(name, value);
        }
    }
    
    @Override
    public boolean has(String name) {
        return outgoing().hasHeader(name);
    }
    
    @Override
    public void remove(String name) {
        if (!headersSent()) {
            outgoing().removeHeader(name);
        }
    }
    
    @Override
    public boolean headersSent() {
        return outgoing().headersSent();
    }
    
    @Override
    public boolean writable() {
        return outgoing().isWritable();
    }
}
