package alpha.onionhttp.core;

import alpha.onionhttp.Application;
import alpha.onionhttp.middleware.Middleware;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ResponseSerializer}, driven through the application's
 * request listener and an in-memory transport.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ResponseSerializerTest
{
    @Test
    void noMiddleware_notFound() {
        var out = run(FakeIncoming.get("/"));
        assertThat(out.statusCode()).isEqualTo(404);
        assertThat(out.body()).isEqualTo("Not Found");
        assertThat(out.header("Content-Type")).hasValue("text/plain; charset=utf-8");
        assertThat(out.header("Content-Length")).hasValue("9");
        assertThat(out.ended()).isTrue();
    }
    
    @Test
    void noMiddleware_http2_statusCodeAsBody() {
        var out = run(FakeIncoming.get("/").major(2));
        assertThat(out.statusCode()).isEqualTo(404);
        assertThat(out.body()).isEqualTo("404");
        assertThat(out.header("Content-Length")).hasValue("3");
    }
    
    @Test
    void customMessageAsFallbackBody() {
        var out = run(FakeIncoming.get("/"), (ctx, next) -> {
            ctx.status(403);
            ctx.response().message("Go away");
            return null;
        });
        assertThat(out.statusCode()).isEqualTo(403);
        assertThat(out.body()).isEqualTo("Go away");
    }
    
    @Test
    void nullBody_noContent() {
        var out = run(FakeIncoming.get("/"), (ctx, next) -> {
            ctx.body(null);
            return null;
        });
        assertThat(out.statusCode()).isEqualTo(204);
        assertThat(out.bodyBytes()).isEmpty();
        assertThat(out.hasHeader("Content-Type")).isFalse();
        assertThat(out.ended()).isTrue();
    }
    
    @Test
    void bodylessStatusDropsBody() {
        var out = run(FakeIncoming.get("/"), (ctx, next) -> {
            ctx.body("ignored");
            ctx.status(304);
            return null;
        });
        assertThat(out.statusCode()).isEqualTo(304);
        assertThat(out.bodyBytes()).isEmpty();
        assertThat(out.hasHeader("Content-Type")).isFalse();
        assertThat(out.hasHeader("Content-Length")).isFalse();
    }
    
    @Test
    void explicitNullWithOkStatus() {
        var out = run(FakeIncoming.get("/"), (ctx, next) -> {
            ctx.body(null);
            ctx.status(200);
            ctx.set("Transfer-Encoding", "chunked");
            return null;
        });
        assertThat(out.statusCode()).isEqualTo(200);
        assertThat(out.bodyBytes()).isEmpty();
        assertThat(out.header("Content-Length")).hasValue("0");
        assertThat(out.hasHeader("Content-Type")).isFalse();
        assertThat(out.hasHeader("Transfer-Encoding")).isFalse();
    }
    
    @Test
    void string() {
        var out = run(FakeIncoming.get("/"), (ctx, next) -> {
            ctx.body("Hellö");
            return null;
        });
        assertThat(out.statusCode()).isEqualTo(200);
        assertThat(out.body()).isEqualTo("Hellö");
        assertThat(out.header("Content-Type")).hasValue("text/plain; charset=utf-8");
        assertThat(out.header("Content-Length")).hasValue("6");
    }
    
    @Test
    void html() {
        var out = run(FakeIncoming.get("/"), (ctx, next) -> {
            ctx.body("  <p>Hi</p>");
            return null;
        });
        assertThat(out.header("Content-Type")).hasValue("text/html; charset=utf-8");
    }
    
    @Test
    void bytes() {
        var out = run(FakeIncoming.get("/"), (ctx, next) -> {
            ctx.body(new byte[]{1, 2, 3});
            return null;
        });
        assertThat(out.bodyBytes()).containsExactly(1, 2, 3);
        assertThat(out.header("Content-Type")).hasValue("application/octet-stream");
        assertThat(out.header("Content-Length")).hasValue("3");
    }
    
    @Test
    void byteBuffer() {
        var buf = ByteBuffer.wrap("abcd".getBytes(UTF_8));
        buf.get();
        var out = run(FakeIncoming.get("/"), (ctx, next) -> {
            ctx.body(buf);
            return null;
        });
        assertThat(out.body()).isEqualTo("bcd");
        assertThat(out.header("Content-Length")).hasValue("3");
    }
    
    @Test
    void json() {
        var out = run(FakeIncoming.get("/"), (ctx, next) -> {
            ctx.body(Map.of("a", 1));
            return null;
        });
        assertThat(out.statusCode()).isEqualTo(200);
        assertThat(out.body()).isEqualTo("{\"a\":1}");
        assertThat(out.header("Content-Type")).hasValue("application/json; charset=utf-8");
        assertThat(out.header("Content-Length")).hasValue("7");
    }
    
    @Test
    void json_typeSetByApplicationIsReplaced() {
        var out = run(FakeIncoming.get("/"), (ctx, next) -> {
            ctx.type("text/plain");
            ctx.body(Map.of());
            return null;
        });
        assertThat(out.header("Content-Type")).hasValue("application/json; charset=utf-8");
    }
    
    @Test
    void inputStream() {
        var closed = new AtomicBoolean();
        var src = new ByteArrayInputStream("streamed".getBytes(UTF_8)) {
            @Override
            public void close() throws IOException {
                closed.set(true);
                super.close();
            }
        };
        var out = run(FakeIncoming.get("/"), (ctx, next) -> {
            ctx.body(src);
            return null;
        });
        assertThat(out.body()).isEqualTo("streamed");
        assertThat(out.header("Content-Type")).hasValue("application/octet-stream");
        assertThat(out.hasHeader("Content-Length")).isFalse();
        assertThat(out.ended()).isTrue();
        assertThat(closed).isTrue();
    }
    
    @Test
    void head_lengthWithoutBody() {
        var out = run(FakeIncoming.head("/"), (ctx, next) -> {
            ctx.body("Hello");
            ctx.response().remove("Content-Length");
            return null;
        });
        assertThat(out.statusCode()).isEqualTo(200);
        assertThat(out.header("Content-Length")).hasValue("5");
        assertThat(out.bodyBytes()).isEmpty();
        assertThat(out.ended()).isTrue();
    }
    
    @Test
    void head_json() {
        var out = run(FakeIncoming.head("/"), (ctx, next) -> {
            ctx.body(Map.of("a", 1));
            return null;
        });
        assertThat(out.header("Content-Length")).hasValue("7");
        assertThat(out.bodyBytes()).isEmpty();
    }
    
    @Test
    void respondFalse_bypass() {
        var out = run(FakeIncoming.get("/"), (ctx, next) -> {
            ctx.respond(false);
            ctx.body("never");
            return null;
        });
        assertThat(out.ended()).isFalse();
        assertThat(out.bodyBytes()).isEmpty();
    }
    
    @Test
    void notWritable_nothingWritten() {
        var out = run(FakeIncoming.get("/"), (ctx, next) -> {
            ctx.body("too late");
            ctx.outgoing().end("early".getBytes(UTF_8));
            return null;
        });
        assertThat(out.body()).isEqualTo("early");
        assertThat(out.endCount()).isOne();
    }
    
    private static FakeOutgoing run(FakeIncoming in, Middleware... mw) {
        var app = Application.create();
        for (var m : mw) {
            app.use(m);
        }
        var out = new FakeOutgoing();
        app.callback().handle(in, out).toCompletableFuture().join();
        return out;
    }
}
