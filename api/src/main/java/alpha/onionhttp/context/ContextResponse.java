package alpha.onionhttp.context;

import alpha.onionhttp.Application;
import alpha.onionhttp.transport.OutgoingResponse;

import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Is the response view of a {@link Context}.<p>
 * 
 * The status code, reason phrase and headers are stored directly in the
 * {@linkplain #outgoing() raw response}. The body is held by this view until
 * the pipeline completes, at which point it is serialized.<p>
 * 
 * The body can be one of:
 * <ul>
 *   <li>absent (never assigned)</li>
 *   <li>explicitly {@code null}</li>
 *   <li>{@code byte[]} or {@link ByteBuffer}</li>
 *   <li>{@code String} (encoded using UTF-8)</li>
 *   <li>{@link InputStream} (piped, then closed)</li>
 *   <li>any other object (serialized as JSON)</li>
 * </ul>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface ContextResponse
{
    /**
     * {@return the owning context}
     */
    Context context();
    
    /**
     * {@return the request view of the same context}
     */
    ContextRequest request();
    
    /**
     * {@return the owning application}
     */
    Application app();
    
    /**
     * {@return the raw response}
     */
    OutgoingResponse outgoing();
    
    /**
     * {@return the status code}
     */
    int status();
    
    /**
     * Sets the status code.<p>
     * 
     * Once a status has been set, assigning a body no longer changes the
     * status. If the new status does not permit a body, any body assigned is
     * discarded.<p>
     * 
     * Has no effect if the headers have already been sent.
     * 
     * @param code status code
     * 
     * @throws IllegalArgumentException if {@code code} is not in the range
     *                                  100 to 999
     */
    void status(int code);
    
    /**
     * Returns the reason phrase.<p>
     * 
     * Unless set explicitly, this is the registered phrase of the status
     * code.
     * 
     * @return the reason phrase (never {@code null} but possibly empty)
     */
    Optional<String> message();
    
    /**
     * Sets the reason phrase.
     * 
     * @param phrase reason phrase
     * 
     * @throws NullPointerException if {@code phrase} is {@code null}
     */
    void message(String phrase);
    
    /**
     * {@return the body (may be {@code null})}
     */
    Object body();
    
    /**
     * Sets the body.<p>
     * 
     * If the body is {@code null}, the status is set to 204 (No Content)
     * unless the current status already forbids a body, and the headers
     * Content-Type, Content-Length and Transfer-Encoding are removed. The
     * response is then marked as having an {@linkplain #explicitNullBody()
     * explicit null body}.<p>
     * 
     * Otherwise, the status is set to 200 (OK) unless a status has been set
     * explicitly, and the headers Content-Type and Content-Length are set
     * according to the body type. An already set content type is not
     * replaced.
     * 
     * @param body the body (may be {@code null})
     */
    void body(Object body);
    
    /**
     * Returns {@code true} if the body was explicitly set to {@code null}
     * (and has not since been set to something else), otherwise
     * {@code false}.
     * 
     * @return see JavaDoc
     */
    boolean explicitNullBody();
    
    /**
     * Returns the body length.<p>
     * 
     * The length is parsed from the Content-Length header, if present.
     * Otherwise, it is derived from the body, if possible.
     * 
     * @return the body length (possibly empty)
     */
    OptionalLong length();
    
    /**
     * Sets the Content-Length header.
     * 
     * @param length body length
     */
    void length(long length);
    
    /**
     * {@return the Content-Type header value}
     */
    Optional<String> type();
    
    /**
     * Sets the Content-Type header.
     * 
     * @param type media type
     * 
     * @throws NullPointerException if {@code type} is {@code null}
     */
    void type(String type);
    
    /**
     * Returns the named header.
     * 
     * @param name of header
     * 
     * @return the value (never {@code null} but possibly empty)
     */
    Optional<String> get(String name);
    
    /**
     * Sets the named header.
     * 
     * @param name of header
     * @param value of header
     */
    void set(String name, String value);
    
    /**
     * Returns {@code true} if the named header is set.
     * 
     * @param name of header
     * 
     * @return see JavaDoc
     */
    boolean has(String name);
    
    /**
     * Removes the named header.
     * 
     * @param name of header
     */
    void remove(String name);
    
    /**
     * {@return whether the headers have been sent}
     */
    boolean headersSent();
    
    /**
     * {@return whether the raw response can still be written to}
     */
    boolean writable();
}
