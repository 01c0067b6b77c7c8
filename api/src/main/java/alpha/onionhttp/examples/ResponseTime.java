package alpha.onionhttp.examples;

import alpha.onionhttp.Application;
import alpha.onionhttp.Server;

import java.io.IOException;
import java.util.Map;

/**
 * Adds a response time header and responds a JSON document.<p>
 * 
 * The first middleware measures the time it takes for the rest of the stack to
 * complete. The second middleware sets the body, which, not being a string or
 * bytes, is serialized as JSON.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ResponseTime
{
    private ResponseTime() {
        // Empty
    }
    
    /**
     * Application's entry point.
     * 
     * @param args ignored
     * 
     * @throws IOException
     *             if an I/O error occurs
     */
    public static void main(String... args) throws IOException {
        Application app = Application.create()
            .use((ctx, next) -> {
                long start = System.nanoTime();
                return next.proceed().thenRun(() -> {
                    long micros = (System.nanoTime() - start) / 1_000;
                    ctx.set("X-Response-Time", micros + "us");
                });
            })
            .use((ctx, next) -> {
                ctx.body(Map.of("path", ctx.path(), "method", ctx.method()));
                return next.proceed();
            });
        
        Server server = app.listen(0);
        System.out.println("Listening on port " + server.port() + ".");
    }
}
