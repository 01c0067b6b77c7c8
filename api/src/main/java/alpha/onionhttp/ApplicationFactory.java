package alpha.onionhttp;

import alpha.onionhttp.handler.ErrorHandler;

/**
 * Factory of {@code Application}.<p>
 * 
 * The OnionHTTP library does not support custom implementations of the API,
 * and application code should have no use of this type. It is only public
 * because it is a requirement by Java's service-provider mechanism.
 */
@FunctionalInterface
public interface ApplicationFactory {
    /**
     * Creates a new {@code Application}.<p>
     * 
     * This method should only be used by the static method
     * {@link Application#create(Config, ErrorHandler)
     * Application.create()}.
     * 
     * @param config of application
     * @param eh     error handler
     * 
     * @return a new {@code Application}
     * 
     * @throws NullPointerException if an argument is {@code null}
     */
    Application create(Config config, ErrorHandler eh);
}
