package alpha.onionhttp.core;

import alpha.onionhttp.Application;
import alpha.onionhttp.Config;
import alpha.onionhttp.Server;
import alpha.onionhttp.handler.HttpException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import static java.net.http.HttpResponse.BodyHandlers.ofString;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exchanges real messages with the JDK-backed server over the loopback
 * interface.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class JdkHttpTransportTest
{
    private static final HttpClient CLIENT = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    
    private Server server;
    
    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
    }
    
    @Test
    void helloWorld() throws Exception {
        var app = Application.create();
        app.use((ctx, next) -> {
            ctx.body("Hello " + ctx.request().querystring());
            return next.proceed();
        });
        var rsp = get(app, "/greet?World");
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.body()).isEqualTo("Hello World");
        assertThat(rsp.headers().firstValue("Content-Type"))
                .hasValue("text/plain; charset=utf-8");
        assertThat(rsp.headers().firstValue("Content-Length")).hasValue("11");
    }
    
    @Test
    void notFound() throws Exception {
        var rsp = get(Application.create(), "/nothing/here");
        assertThat(rsp.statusCode()).isEqualTo(404);
        assertThat(rsp.body()).isEqualTo("Not Found");
    }
    
    @Test
    void json() throws Exception {
        var app = Application.create();
        app.use((ctx, next) -> {
            ctx.body(Map.of("path", ctx.path()));
            return next.proceed();
        });
        var rsp = get(app, "/p?x=1");
        assertThat(rsp.headers().firstValue("Content-Type"))
                .hasValue("application/json; charset=utf-8");
        assertThat(rsp.body()).isEqualTo("{\"path\":\"/p\"}");
    }
    
    @Test
    void requestDetails() throws Exception {
        var app = Application.create(Config.configuration().proxy(true).build());
        app.use((ctx, next) -> {
            var req = ctx.request();
            ctx.body(req.method() + " " + req.protocol() + " " +
                     req.httpVersionMajor() + " " + req.header("X-Custom").orElse("?"));
            return next.proceed();
        });
        start(app);
        var rsp = CLIENT.send(request("/")
                .header("X-Custom", "yes")
                .header("X-Forwarded-Proto", "https").build(), ofString());
        assertThat(rsp.body()).isEqualTo("GET https 1 yes");
    }
    
    @Test
    void error() throws Exception {
        var app = Application.create(Config.configuration().silent(true).build());
        app.use((ctx, next) -> {
            throw new HttpException(418, "I'm short and stout");
        });
        var rsp = get(app, "/");
        assertThat(rsp.statusCode()).isEqualTo(418);
        assertThat(rsp.body()).isEqualTo("I'm short and stout");
    }
    
    @Test
    void noContent() throws Exception {
        var app = Application.create();
        app.use((ctx, next) -> {
            ctx.body(null);
            return next.proceed();
        });
        var rsp = get(app, "/");
        assertThat(rsp.statusCode()).isEqualTo(204);
        assertThat(rsp.body()).isEmpty();
    }
    
    @Test
    void stop() throws IOException {
        server = Application.create().listen(loopback());
        assertThat(server.port()).isPositive();
        server.stop();
        server.stop();
        assertThatThrownBy(server::getLocalAddress)
                .isExactlyInstanceOf(IllegalStateException.class);
        server = null;
    }
    
    @ParameterizedTest
    @CsvSource({"HTTP/1.1, 1", "HTTP/1.0, 1", "HTTP/2, 2", "HTTP/2.0, 2", "garbage/x, 1"})
    void parseMajor(String protocol, int expected) {
        assertThat(JdkHttpTransport.Incoming.parseMajor(protocol)).isEqualTo(expected);
    }
    
    private HttpResponse<String> get(Application app, String path)
            throws IOException, InterruptedException {
        start(app);
        return CLIENT.send(request(path).build(), ofString());
    }
    
    private void start(Application app) throws IOException {
        server = app.listen(loopback());
    }
    
    private HttpRequest.Builder request(String path) {
        var addr = server.getLocalAddress();
        var uri = URI.create("http://127.0.0.1:" + addr.getPort() + path);
        return HttpRequest.newBuilder(uri).timeout(Duration.ofSeconds(5));
    }
    
    private static InetSocketAddress loopback() {
        return new InetSocketAddress("127.0.0.1", 0);
    }
}
