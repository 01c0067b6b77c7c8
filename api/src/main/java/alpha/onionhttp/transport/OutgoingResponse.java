package alpha.onionhttp.transport;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Is the writable side of a raw HTTP exchange, as delivered by the
 * transport.<p>
 * 
 * The status line and headers are buffered until they are sent, which happens
 * no later than on the first call to {@code write} or {@code end}. Afterwards,
 * {@link #headersSent()} returns {@code true} and modifying the status or the
 * headers has no effect.<p>
 * 
 * Header name lookups are case-insensitive.<p>
 * 
 * The implementation must be thread-safe.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see IncomingRequest
 */
public interface OutgoingResponse
{
    /**
     * Returns the status code.<p>
     * 
     * The default, if not set, is transport-defined.
     * 
     * @return the status code
     */
    int statusCode();
    
    /**
     * Sets the status code.
     * 
     * @param code status code
     */
    void statusCode(int code);
    
    /**
     * Returns the reason phrase.
     * 
     * @return the reason phrase (may be {@code null} if not set explicitly)
     */
    String statusMessage();
    
    /**
     * Sets the reason phrase.
     * 
     * @param phrase reason phrase (may be {@code null})
     */
    void statusMessage(String phrase);
    
    /**
     * Returns {@code true} if the response can still be written to, otherwise
     * {@code false}.<p>
     * 
     * Once the response has ended, or the connection has been closed, this
     * method returns {@code false}.
     * 
     * @return see JavaDoc
     */
    boolean isWritable();
    
    /**
     * Returns {@code true} if the status line and headers have been sent,
     * otherwise {@code false}.
     * 
     * @return see JavaDoc
     */
    boolean headersSent();
    
    /**
     * Returns the value of the named header.
     * 
     * @param name of header (case-insensitive)
     * 
     * @return the value (never {@code null} but possibly empty)
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Optional<String> header(String name);
    
    /**
     * Sets (replaces) the named header.
     * 
     * @param name of header (case-insensitive)
     * @param value of header
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    void setHeader(String name, String value);
    
    /**
     * Removes the named header.
     * 
     * @param name of header (case-insensitive)
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    void removeHeader(String name);
    
    /**
     * Returns the names of all headers set.
     * 
     * @return header names (never {@code null}, a snapshot)
     */
    Set<String> headerNames();
    
    /**
     * Returns {@code true} if the named header is set, otherwise
     * {@code false}.
     * 
     * @param name of header (case-insensitive)
     * 
     * @return see JavaDoc
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    default boolean hasHeader(String name) {
        return header(name).isPresent();
    }
    
    /**
     * Writes a chunk of the body.<p>
     * 
     * Sends the status line and headers first, if not already sent. If no
     * content length has been set, the transport must delimit the body by
     * other means (for example, chunked encoding).
     * 
     * @param bytes source
     * @param off offset
     * @param len number of bytes
     * 
     * @throws IOException if an I/O error occurs
     * @throws IllegalStateException if the response has ended
     */
    void write(byte[] bytes, int off, int len) throws IOException;
    
    /**
     * Writes the last chunk of the body and ends the response.<p>
     * 
     * Sends the status line and headers first, if not already sent.<p>
     * 
     * Ending an already ended response is a NOP.
     * 
     * @param bytes source
     * @param off offset
     * @param len number of bytes
     * 
     * @throws IOException if an I/O error occurs
     */
    void end(byte[] bytes, int off, int len) throws IOException;
    
    /**
     * Ends the response without writing body bytes.
     * 
     * @throws IOException if an I/O error occurs
     */
    default void end() throws IOException {
        end(new byte[0], 0, 0);
    }
    
    /**
     * Ends the response with the given bytes.
     * 
     * @param bytes the last bytes of the body
     * 
     * @throws IOException if an I/O error occurs
     */
    default void end(byte[] bytes) throws IOException {
        end(bytes, 0, bytes.length);
    }
    
    /**
     * Registers a listener of the response's termination.<p>
     * 
     * The listener is called exactly once; with {@code null} when the
     * response ended successfully, or with the cause if the response failed
     * or the connection closed prematurely. If the response has already
     * terminated, the listener is called immediately by the calling
     * thread.<p>
     * 
     * A write or end that fails with an {@code IOException} terminates the
     * response. Listeners are called with that exception before it is thrown
     * to the writer.
     * 
     * @param listener of termination
     * 
     * @return an action that deregisters the listener
     * 
     * @throws NullPointerException if {@code listener} is {@code null}
     */
    Runnable onFinished(Consumer<? super Throwable> listener);
}
