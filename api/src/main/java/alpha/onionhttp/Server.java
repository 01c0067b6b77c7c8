package alpha.onionhttp;

import java.net.InetSocketAddress;

/**
 * Is a handle of a running server, as returned by
 * {@link Application#listen(int)}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Server
{
    /**
     * Returns the address the server is bound to.
     * 
     * @return the local address (never {@code null})
     * 
     * @throws IllegalStateException if the server has been stopped
     */
    InetSocketAddress getLocalAddress();
    
    /**
     * Returns the port the server is bound to.<p>
     * 
     * Useful when the server was started on port 0, and the system picked a
     * port.
     * 
     * @return the local port
     * 
     * @throws IllegalStateException if the server has been stopped
     */
    default int port() {
        return getLocalAddress().getPort();
    }
    
    /**
     * Stops the server.<p>
     * 
     * The server stops accepting new connections and waits at most one second
     * for in-flight exchanges to complete.<p>
     * 
     * Stopping an already stopped server is a NOP.
     */
    void stop();
}
