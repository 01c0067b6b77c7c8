package alpha.onionhttp.core;

import alpha.onionhttp.context.Context;
import alpha.onionhttp.context.ContextResponse;
import alpha.onionhttp.transport.OutgoingResponse;
import alpha.onionhttp.util.Statuses;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;

import static alpha.onionhttp.HttpConstants.HeaderName.CONTENT_LENGTH;
import static alpha.onionhttp.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.onionhttp.HttpConstants.HeaderName.TRANSFER_ENCODING;
import static alpha.onionhttp.HttpConstants.Method.HEAD;
import static java.lang.System.Logger.Level.DEBUG;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Writes the response held by a context to the raw response.<p>
 * 
 * I/O errors are handed to {@link Context#onerror(Throwable)}, unless the
 * failure left the response unwritable. The transport reports such failures
 * to its finish listeners.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ResponseSerializer
{
    private static final System.Logger LOG
            = System.getLogger(ResponseSerializer.class.getPackageName());
    
    private static final int BUFFER_SIZE = 8 * 1_024;
    
    private final JsonWriter json;
    
    ResponseSerializer(JsonWriter json) {
        this.json = json;
    }
    
    void respond(Context ctx) {
        if (!ctx.respond()) {
            LOG.log(DEBUG, "Response bypassed by application.");
            return;
        }
        if (!ctx.writable()) {
            LOG.log(DEBUG, "Response not writable.");
            return;
        }
        try {
            respond0(ctx, ctx.response(), ctx.outgoing());
        } catch (IOException e) {
            if (ctx.writable()) {
                ctx.onerror(e);
            } else {
                // Already reported through the finish listener
                LOG.log(DEBUG, "Response failed.", e);
            }
        }
    }
    
    private void respond0(
            Context ctx, ContextResponse res, OutgoingResponse out) throws IOException {
        final int code = res.status();
        if (Statuses.isBodyless(code)) {
            res.body(null);
            out.end();
            return;
        }
        if (HEAD.equals(ctx.method())) {
            if (!out.headersSent() && !res.has(CONTENT_LENGTH)) {
                res.length().ifPresent(res::length);
            }
            out.end();
            return;
        }
        final Object body = res.body();
        if (body == null) {
            if (res.explicitNullBody()) {
                res.remove(CONTENT_TYPE);
                res.remove(TRANSFER_ENCODING);
                res.length(0);
                out.end();
                return;
            }
            final String fallback = ctx.request().httpVersionMajor() >= 2 ?
                    String.valueOf(code) :
                    res.message().orElse(String.valueOf(code));
            final byte[] bytes = fallback.getBytes(UTF_8);
            if (!out.headersSent()) {
                res.type(DefaultContext.TEXT_PLAIN);
                res.length(bytes.length);
            }
            out.end(bytes);
        } else if (body instanceof byte[] b) {
            out.end(b);
        } else if (body instanceof ByteBuffer buf) {
            var copy = new byte[buf.remaining()];
            buf.duplicate().get(copy);
            out.end(copy);
        } else if (body instanceof String str) {
            out.end(str.getBytes(UTF_8));
        } else if (body instanceof InputStream stream) {
            pipe(stream, out);
        } else {
            final byte[] bytes = json.write(body);
            if (!out.headersSent()) {
                res.length(bytes.length);
            }
            out.end(bytes);
        }
    }
    
    private static void pipe(InputStream src, OutgoingResponse dst) throws IOException {
        try (src) {
            var buf = new byte[BUFFER_SIZE];
            int n;
            while ((n = src.read(buf)) != -1) {
                if (n > 0) {
                    dst.write(buf, 0, n);
                }
            }
            dst.end();
        }
    }
}
