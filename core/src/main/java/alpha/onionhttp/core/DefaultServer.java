package alpha.onionhttp.core;

import alpha.onionhttp.Server;
import com.sun.net.httpserver.HttpServer;

import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;

import static java.lang.System.Logger.Level.INFO;

/**
 * Default implementation of {@link Server}, backed by the JDK's built-in HTTP
 * server.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultServer implements Server
{
    private static final System.Logger LOG
            = System.getLogger(DefaultServer.class.getPackageName());
    
    private static final int GRACEFUL_SECONDS = 1;
    
    private final HttpServer server;
    private final ExecutorService exec;
    private final InetSocketAddress address;
    private volatile boolean stopped;
    
    DefaultServer(HttpServer server, ExecutorService exec) {
        this.server  = server;
        this.exec    = exec;
        this.address = server.getAddress();
    }
    
    @Override
    public InetSocketAddress getLocalAddress() {
        if (stopped) {
            throw new IllegalStateException("Server is stopped.");
        }
        return address;
    }
    
    @Override
    public void stop() {
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
        }
        LOG.log(INFO, () -> "Stopping server on " + address);
        server.stop(GRACEFUL_SECONDS);
        exec.shutdown();
    }
}
