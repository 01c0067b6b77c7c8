package alpha.onionhttp.context;

import alpha.onionhttp.Application;
import alpha.onionhttp.handler.ErrorHandler;
import alpha.onionhttp.handler.HasStatus;
import alpha.onionhttp.middleware.Middleware;
import alpha.onionhttp.transport.IncomingRequest;
import alpha.onionhttp.transport.OutgoingResponse;
import alpha.onionhttp.util.Attributes;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Is the per-request aggregate given to all {@link Middleware}.<p>
 * 
 * The context owns a {@linkplain #request() request view} and a
 * {@linkplain #response() response view} over one raw transport pair, a
 * {@linkplain #state() state bag} for application data, and the
 * {@linkplain #originalUrl() original URL}. Exactly one context exists per
 * request, and it is never reused.<p>
 * 
 * Most methods of this interface are shortcuts delegating to the request or
 * response view. For example, {@code ctx.status(201)} is equivalent to
 * {@code ctx.response().status(201)}.<p>
 * 
 * The context is not thread-safe. The middleware pipeline of a request is
 * sequential, so unless the application itself shares the context with other
 * threads, no synchronization is needed.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Context
{
    /**
     * {@return the owning application}
     */
    Application app();
    
    /**
     * {@return the request view}
     */
    ContextRequest request();
    
    /**
     * {@return the response view}
     */
    ContextResponse response();
    
    /**
     * {@return the raw request}
     */
    IncomingRequest incoming();
    
    /**
     * {@return the raw response}
     */
    OutgoingResponse outgoing();
    
    /**
     * Returns the per-request state bag.<p>
     * 
     * The bag is empty when the context is created. It is the recommended
     * namespace for passing data through middleware.
     * 
     * @return the per-request state bag (never {@code null})
     */
    Attributes state();
    
    /**
     * Returns the named attribute, looking first in this context's
     * {@linkplain #state() state}, then in the application's
     * {@linkplain Application#defaults() defaults}.
     * 
     * @param name of attribute
     * 
     * @return the value (never {@code null} but possibly empty)
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Optional<Object> attribute(String name);
    
    /**
     * Returns the request-target as received, before any middleware had the
     * chance to rewrite the {@linkplain ContextRequest#url(String) URL}.
     * 
     * @return the original request-target (never {@code null})
     */
    String originalUrl();
    
    /**
     * Returns whether the library will serialize the response when the
     * pipeline completes.<p>
     * 
     * The default is {@code true}. Middleware that writes directly to the
     * {@linkplain #outgoing() raw response} should set this to
     * {@code false}.
     * 
     * @return see JavaDoc
     */
    boolean respond();
    
    /**
     * Sets whether the library will serialize the response when the pipeline
     * completes.
     * 
     * @param respond new value
     * 
     * @see #respond()
     */
    void respond(boolean respond);
    
    /**
     * Handles an error that occurred during the processing of this
     * request.<p>
     * 
     * A {@code null} argument is ignored. Otherwise, the error is forwarded to
     * the application's {@link ErrorHandler}, and, if the response headers
     * have not yet been sent, a response is written. The status code is taken
     * from the error if it implements {@link HasStatus}, otherwise it is
     * 500 (Internal Server Error). The body is the error message if the error
     * is {@linkplain HasStatus#expose() exposed}, otherwise the reason
     * phrase.<p>
     * 
     * This method never throws.
     * 
     * @param err the error (may be {@code null})
     */
    void onerror(Throwable err);
    
    /**
     * Shortcut for {@code request().method()}.
     * 
     * @return the request method
     */
    default String method() {
        return request().method();
    }
    
    /**
     * Shortcut for {@code request().url()}.
     * 
     * @return the request-target
     */
    default String url() {
        return request().url();
    }
    
    /**
     * Shortcut for {@code request().path()}.
     * 
     * @return the request path
     */
    default String path() {
        return request().path();
    }
    
    /**
     * Shortcut for {@code request().header(name)}.
     * 
     * @param name of header
     * @return the request header value
     */
    default Optional<String> header(String name) {
        return request().header(name);
    }
    
    /**
     * Shortcut for {@code response().status()}.
     * 
     * @return the response status code
     */
    default int status() {
        return response().status();
    }
    
    /**
     * Shortcut for {@code response().status(code)}.
     * 
     * @param code status code
     */
    default void status(int code) {
        response().status(code);
    }
    
    /**
     * Shortcut for {@code response().message()}.
     * 
     * @return the response reason phrase
     */
    default Optional<String> message() {
        return response().message();
    }
    
    /**
     * Shortcut for {@code response().body()}.
     * 
     * @return the response body
     */
    default Object body() {
        return response().body();
    }
    
    /**
     * Shortcut for {@code response().body(body)}.
     * 
     * @param body the response body
     */
    default void body(Object body) {
        response().body(body);
    }
    
    /**
     * Shortcut for {@code response().length()}.
     * 
     * @return the response body length
     */
    default OptionalLong length() {
        return response().length();
    }
    
    /**
     * Shortcut for {@code response().type(type)}.
     * 
     * @param type the response content type
     */
    default void type(String type) {
        response().type(type);
    }
    
    /**
     * Shortcut for {@code response().set(name, value)}.
     * 
     * @param name of header
     * @param value of header
     */
    default void set(String name, String value) {
        response().set(name, value);
    }
    
    /**
     * Shortcut for {@code response().headersSent()}.
     * 
     * @return whether the response headers have been sent
     */
    default boolean headersSent() {
        return response().headersSent();
    }
    
    /**
     * Shortcut for {@code response().writable()}.
     * 
     * @return whether the response is writable
     */
    default boolean writable() {
        return response().writable();
    }
}
