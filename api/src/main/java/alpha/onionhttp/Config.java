package alpha.onionhttp;

import alpha.onionhttp.context.ContextRequest;
import alpha.onionhttp.handler.ErrorHandler;
import alpha.onionhttp.middleware.Composer;

import java.util.List;

/**
 * Application configuration.<p>
 *
 * {@link Config#toBuilder()} allows for any configuration object to be used as
 * a template for a new instance.<p>
 *
 * The static method {@link #configuration()} is a shortcut for
 * {@code Config.}{@link #DEFAULT}{@code .toBuilder()}:
 *
 * <pre>{@code
 *    Application app = Application.create(configuration()
 *            .proxy(true)
 *            .subdomainOffset(3)
 *            ...
 *            .build());
 * }</pre>
 *
 * @implSpec
 * The implementation is immutable.<p>
 *
 * The implementation inherits the identity-based implementations of
 * {@link Object#hashCode()} and {@link Object#equals(Object)}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Config
{
    /**
     * The configuration used by {@link Application#create()}.<p>
     *
     * This instance contains the following values:<p>
     *
     * Proxy = false<br>
     * Subdomain offset = 2<br>
     * Proxy IP header = "X-Forwarded-For"<br>
     * Max IPs count = 0 (unlimited)<br>
     * Environment = see {@link #env()}<br>
     * Keys = empty<br>
     * Composer = {@code null} (library default)<br>
     * Context propagation = false<br>
     * Silent = false
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();

    /**
     * The name of the system property consulted for the default environment
     * name.
     *
     * @see #env()
     */
    String ENV_PROPERTY = "onionhttp.env";

    /**
     * The name of the environment variable consulted for the default
     * environment name, if the system property is not set.
     *
     * @see #env()
     */
    String ENV_VARIABLE = "APP_ENV";

    /**
     * {@return whether to trust proxy headers}<p>
     *
     * If {@code true}, the {@value HttpConstants.HeaderName#X_FORWARDED_HOST}
     * header and the {@linkplain #proxyIpHeader() proxy IP header} are used by
     * {@link ContextRequest#host()} and {@link ContextRequest#ips()}
     * respectively.<p>
     *
     * The default is {@code false}.
     */
    boolean proxy();

    /**
     * {@return the number of dot-separated parts of the host that make up the
     * domain}<p>
     *
     * The parts are ignored by {@link ContextRequest#subdomains()}. For
     * example, given the host "tobi.ferrets.example.com" and the default
     * offset 2, the subdomains are "ferrets" and "tobi" (in that order).
     */
    int subdomainOffset();

    /**
     * {@return the name of the header holding the client address chain}<p>
     *
     * Only consulted if {@link #proxy()} is {@code true}. The default is
     * {@value HttpConstants.HeaderName#X_FORWARDED_FOR}.
     */
    String proxyIpHeader();

    /**
     * {@return the max number of addresses read from the proxy IP header}<p>
     *
     * The addresses are read from the end of the list (closest proxy first).
     * The default is 0, which means unlimited.
     */
    int maxIpsCount();

    /**
     * {@return the environment name}<p>
     *
     * Unless set explicitly, the value is read from the system property
     * {@value #ENV_PROPERTY}, then from the environment variable
     * {@value #ENV_VARIABLE}, and if neither is set, defaults to
     * "development".
     */
    String env();

    /**
     * {@return signing keys, in order of preference}<p>
     *
     * The core does not itself sign anything. The keys are made available for
     * middleware that does. The default is an empty list. The returned list is
     * unmodifiable.
     */
    List<String> keys();

    /**
     * {@return the composer used to turn middleware into a pipeline}<p>
     *
     * The default is {@code null}, which means that the library-provided
     * composer is used.
     */
    Composer composer();

    /**
     * {@return whether the active context is retrievable without explicit
     * parameter passing}<p>
     *
     * If {@code true}, {@link Application#currentContext()} will return the
     * context of the request being processed by the calling thread.<p>
     *
     * The default is {@code false}.
     */
    boolean contextPropagation();

    /**
     * {@return whether the base error handler is silenced}<p>
     *
     * If {@code true}, {@link ErrorHandler#BASE} does not log anything.<p>
     *
     * The default is {@code false}.
     */
    boolean silent();

    /**
     * {@return the builder instance that built this configuration object}<p>
     *
     * The builder may be used to modify configuration values.
     */
    Config.Builder toBuilder();

    /**
     * {@return the builder used to build the default configuration}<p>
     *
     * The builder may be used to modify default configuration values.
     */
    static Config.Builder configuration() {
        return DEFAULT.toBuilder();
    }

    /**
     * Builder of a {@link Config}.<p>
     *
     * The builder can be used as a template to modify configuration state. Each
     * method returns a new builder instance representing the new state. The API
     * should be used in a fluent style.<p>
     *
     * The implementation is thread-safe.
     *
     * @author Martin Andersson (webmaster at martinandersson.com)
     */
    interface Builder {
        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#proxy()
         */
        Builder proxy(boolean newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws IllegalArgumentException if {@code newVal} is negative
         * @see Config#subdomainOffset()
         */
        Builder subdomainOffset(int newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @throws IllegalArgumentException if {@code newVal} is blank
         * @see Config#proxyIpHeader()
         */
        Builder proxyIpHeader(String newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws IllegalArgumentException if {@code newVal} is negative
         * @see Config#maxIpsCount()
         */
        Builder maxIpsCount(int newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#env()
         */
        Builder env(String newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException
         *             if {@code newVal} or an element is {@code null}
         * @see Config#keys()
         */
        Builder keys(List<String> newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value (may be {@code null})
         * @return a new builder representing the new state
         * @see Config#composer()
         */
        Builder composer(Composer newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#contextPropagation()
         */
        Builder contextPropagation(boolean newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#silent()
         */
        Builder silent(boolean newVal);

        /**
         * Builds a configuration object.
         *
         * @return a configuration object
         */
        Config build();
    }
}
