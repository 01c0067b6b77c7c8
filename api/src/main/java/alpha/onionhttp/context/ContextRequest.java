package alpha.onionhttp.context;

import alpha.onionhttp.Application;
import alpha.onionhttp.Config;
import alpha.onionhttp.transport.IncomingRequest;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Is the request view of a {@link Context}.<p>
 * 
 * The view reads the {@linkplain #incoming() raw request}, interpreting it
 * according to the application's {@link Config}. Only the
 * {@linkplain #url(String) URL} is modifiable, which is useful for middleware
 * rewriting paths.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface ContextRequest
{
    /**
     * {@return the owning context}
     */
    Context context();
    
    /**
     * {@return the response view of the same context}
     */
    ContextResponse response();
    
    /**
     * {@return the owning application}
     */
    Application app();
    
    /**
     * {@return the raw request}
     */
    IncomingRequest incoming();
    
    /**
     * {@return the original request-target}
     * 
     * @see Context#originalUrl()
     */
    String originalUrl();
    
    /**
     * Returns the request-target.<p>
     * 
     * Unless rewritten, this is the same as the original URL.
     * 
     * @return the request-target (never {@code null})
     */
    String url();
    
    /**
     * Rewrites the request-target.
     * 
     * @param url new request-target
     * 
     * @throws NullPointerException if {@code url} is {@code null}
     */
    void url(String url);
    
    /**
     * {@return the request method}
     */
    String method();
    
    /**
     * Returns the path component of the request-target.
     * 
     * @return the path (never {@code null}, "/" if empty)
     */
    String path();
    
    /**
     * Returns the query component of the request-target, without the
     * leading question mark.
     * 
     * @return the query (never {@code null}, possibly empty)
     */
    String querystring();
    
    /**
     * {@return the major version of the HTTP protocol used by the client}
     */
    int httpVersionMajor();
    
    /**
     * Returns the first value of the named header.
     * 
     * @param name of header (case-insensitive)
     * 
     * @return the value (never {@code null} but possibly empty)
     */
    Optional<String> header(String name);
    
    /**
     * {@return all request headers}
     */
    Map<String, List<String>> headers();
    
    /**
     * Returns the host and port number.<p>
     * 
     * If {@link Config#proxy()} is {@code true}, the first value of the
     * "X-Forwarded-Host" header is preferred. Otherwise, the "Host" header is
     * used.
     * 
     * @return the host (never {@code null}, possibly empty)
     */
    String host();
    
    /**
     * Returns the host name, without the port number.
     * 
     * @return the host name (never {@code null}, possibly empty)
     */
    String hostname();
    
    /**
     * Returns {@code "https"} if the connection is encrypted, otherwise
     * {@code "http"}.
     * 
     * @return the protocol
     */
    String protocol();
    
    /**
     * {@return {@code true} if the protocol is "https"}
     */
    default boolean secure() {
        return "https".equals(protocol());
    }
    
    /**
     * Returns the client address chain, as forwarded by proxies.<p>
     * 
     * If {@link Config#proxy()} is {@code false}, an empty list is returned.
     * Otherwise, the comma-separated values of the
     * {@linkplain Config#proxyIpHeader() proxy IP header} are returned, the
     * upstream-most client first. If {@link Config#maxIpsCount()} is greater
     * than 0, only that many of the last addresses are returned.
     * 
     * @return the client address chain (never {@code null}, unmodifiable)
     */
    List<String> ips();
    
    /**
     * Returns the client address.<p>
     * 
     * This is the first element of {@link #ips()}, if present, otherwise the
     * address of the remote peer.
     * 
     * @return the client address (never {@code null}, possibly empty)
     */
    String ip();
    
    /**
     * Returns the subdomains of the {@linkplain #hostname() host name}.<p>
     * 
     * The {@linkplain Config#subdomainOffset() offset} number of parts are
     * dropped from the end of the host name, and the rest are returned in
     * reverse order. For example, given "tobi.ferrets.example.com" and offset
     * 2, the list is ["ferrets", "tobi"].<p>
     * 
     * An empty list is returned if the host name is an IP address.
     * 
     * @return the subdomains (never {@code null}, unmodifiable)
     */
    List<String> subdomains();
}
