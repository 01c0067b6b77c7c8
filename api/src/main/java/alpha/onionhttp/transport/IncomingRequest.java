package alpha.onionhttp.transport;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Is the readable side of a raw HTTP exchange, as delivered by the
 * transport.<p>
 * 
 * The library never parses raw HTTP. Any server able to produce a request
 * line and headers can implement this interface.<p>
 * 
 * Header name lookups are case-insensitive.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see OutgoingResponse
 */
public interface IncomingRequest
{
    /**
     * Returns the request-target, as it appeared on the request line.<p>
     * 
     * This is normally the path followed by an optional query, for example
     * "/hello?name=John".
     * 
     * @return the request-target (never {@code null})
     */
    String url();
    
    /**
     * Returns the request method.
     * 
     * @return the request method (never {@code null})
     */
    String method();
    
    /**
     * Returns the major version of the HTTP protocol used by the client.<p>
     * 
     * For example, HTTP/1.1 yields 1 and HTTP/2 yields 2.
     * 
     * @return the major version
     */
    int httpVersionMajor();
    
    /**
     * Returns the first value of the named header.
     * 
     * @param name of header (case-insensitive)
     * 
     * @return the value (never {@code null} but possibly empty)
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Optional<String> header(String name);
    
    /**
     * Returns all headers.
     * 
     * @return all headers (never {@code null}, unmodifiable)
     */
    Map<String, List<String>> headers();
    
    /**
     * Returns the address of the remote peer.
     * 
     * @return the address of the remote peer (may be {@code null} if unknown)
     */
    InetSocketAddress remoteAddress();
    
    /**
     * Returns {@code true} if the connection is encrypted (TLS), otherwise
     * {@code false}.<p>
     * 
     * The default implementation returns {@code false}.
     * 
     * @return see JavaDoc
     */
    default boolean encrypted() {
        return false;
    }
}
