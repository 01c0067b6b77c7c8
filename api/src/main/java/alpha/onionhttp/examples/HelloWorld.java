package alpha.onionhttp.examples;

import alpha.onionhttp.Application;
import alpha.onionhttp.Server;

import java.io.IOException;

/**
 * Responds "Hello World!" to the client.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class HelloWorld
{
    private HelloWorld() {
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
        Application app = Application.create();
        
        // A middleware that never proceeds is the last one to run. Assigning a
        // String body also sets the status to 200 (OK) and the content type to
        // "text/plain".
        app.use((ctx, next) -> {
            ctx.body("Hello World!");
            return null;
        });
        
        /*
         * Port 0 lets the system pick a port. The server is reachable on all
         * interfaces, for example localhost:{port}.
         */
        Server server = app.listen(0);
        System.out.println("Listening on port " + server.port() + ".");
    }
}
