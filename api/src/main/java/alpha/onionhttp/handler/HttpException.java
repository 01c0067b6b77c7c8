package alpha.onionhttp.handler;

import alpha.onionhttp.util.Statuses;

import java.io.Serial;
import java.util.LinkedHashMap;
import java.util.Map;

import static alpha.onionhttp.HttpConstants.StatusCode.isClientError;
import static alpha.onionhttp.HttpConstants.StatusCode.isServerError;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * An HTTP error, carrying the status code and headers of the error
 * response.<p>
 * 
 * {@snippet :
 *   if (user == null) {
 *       throw new HttpException(401, "Please log in")
 *                 .withHeader("WWW-Authenticate", "Basic");
 *   }
 * }
 * 
 * Unless specified, the message is the reason phrase of the status code, and
 * the exception is {@linkplain #expose() exposed} only if the status is a 4XX
 * (Client Error).
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class HttpException extends RuntimeException implements HasStatus
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final int status;
    private final boolean expose;
    private final Map<String, String> headers;
    
    /**
     * Constructs an {@code HttpException}.
     * 
     * @param status code
     * 
     * @throws IllegalArgumentException
     *             if {@code status} is not a 4XX or 5XX code
     */
    public HttpException(int status) {
        this(status, defaultMessage(status));
    }
    
    /**
     * Constructs an {@code HttpException}.
     * 
     * @param status code
     * @param message detail message
     * 
     * @throws IllegalArgumentException
     *             if {@code status} is not a 4XX or 5XX code
     */
    public HttpException(int status, String message) {
        this(status, message, null);
    }
    
    /**
     * Constructs an {@code HttpException}.
     * 
     * @param status code
     * @param message detail message
     * @param cause of this exception (may be {@code null})
     * 
     * @throws IllegalArgumentException
     *             if {@code status} is not a 4XX or 5XX code
     */
    public HttpException(int status, String message, Throwable cause) {
        this(status, message, cause, status < 500);
    }
    
    /**
     * Constructs an {@code HttpException}.
     * 
     * @param status code
     * @param message detail message
     * @param cause of this exception (may be {@code null})
     * @param expose whether the message is safe to show to the client
     * 
     * @throws IllegalArgumentException
     *             if {@code status} is not a 4XX or 5XX code
     */
    public HttpException(
            int status, String message, Throwable cause, boolean expose) {
        super(message, cause);
        this.status  = requireErrorCode(status);
        this.expose  = expose;
        this.headers = new LinkedHashMap<>();
    }
    
    private static int requireErrorCode(int status) {
        if (!isClientError(status) && !isServerError(status)) {
            throw new IllegalArgumentException(
                    "Not an error status code: " + status);
        }
        return status;
    }
    
    private static String defaultMessage(int status) {
        return Statuses.message(status).orElse(String.valueOf(status));
    }
    
    /**
     * Adds a header to be set on the error response.
     * 
     * @param name of header
     * @param value of header
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public HttpException withHeader(String name, String value) {
        headers.put(requireNonNull(name), requireNonNull(value));
        return this;
    }
    
    @Override
    public int status() {
        return status;
    }
    
    @Override
    public boolean expose() {
        return expose;
    }
    
    /**
     * Returns the headers to be set on the error response.
     * 
     * @return headers (never {@code null}, unmodifiable)
     */
    public Map<String, String> headers() {
        return unmodifiableMap(headers);
    }
}
