package alpha.onionhttp;

import alpha.onionhttp.middleware.Composer;

import java.util.List;
import java.util.function.Consumer;

import static alpha.onionhttp.HttpConstants.HeaderName.X_FORWARDED_FOR;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultConfig implements Config {
    private final Builder      builder;
    private final boolean      proxy;
    private final int          subdomainOffset,
                               maxIpsCount;
    private final String       proxyIpHeader,
                               env;
    private final List<String> keys;
    private final Composer     composer;
    private final boolean      contextPropagation,
                               silent;

    DefaultConfig(Builder b, DefaultBuilder.Values s) {
        builder            = b;
        proxy              = s.proxy;
        subdomainOffset    = s.subdomainOffset;
        maxIpsCount        = s.maxIpsCount;
        proxyIpHeader      = s.proxyIpHeader;
        env                = s.env != null ? s.env : defaultEnv();
        keys               = s.keys;
        composer           = s.composer;
        contextPropagation = s.contextPropagation;
        silent             = s.silent;
    }

    private static String defaultEnv() {
        String v = System.getProperty(ENV_PROPERTY);
        if (v == null || v.isBlank()) {
            v = System.getenv(ENV_VARIABLE);
        }
        return v == null || v.isBlank() ? "development" : v;
    }

    @Override
    public boolean proxy() {
        return proxy;
    }

    @Override
    public int subdomainOffset() {
        return subdomainOffset;
    }

    @Override
    public String proxyIpHeader() {
        return proxyIpHeader;
    }

    @Override
    public int maxIpsCount() {
        return maxIpsCount;
    }

    @Override
    public String env() {
        return env;
    }

    @Override
    public List<String> keys() {
        return keys;
    }

    @Override
    public Composer composer() {
        return composer;
    }

    @Override
    public boolean contextPropagation() {
        return contextPropagation;
    }

    @Override
    public boolean silent() {
        return silent;
    }

    @Override
    public Builder toBuilder() {
        return builder;
    }

    /**
     * A builder holding its own copy of the values. Every setter copies the
     * values, applies the change and returns a new builder, so a builder can
     * be shared and used as a template.
     */
    static final class DefaultBuilder implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder(new Values());

        static final class Values {
            boolean      proxy              = false;
            int          subdomainOffset    = 2,
                         maxIpsCount        = 0;
            String       proxyIpHeader      = X_FORWARDED_FOR,
                         // null = resolved at build time
                         env                = null;
            List<String> keys               = List.of();
            Composer     composer           = null;
            boolean      contextPropagation = false,
                         silent             = false;

            Values copy() {
                var c = new Values();
                c.proxy              = proxy;
                c.subdomainOffset    = subdomainOffset;
                c.maxIpsCount        = maxIpsCount;
                c.proxyIpHeader      = proxyIpHeader;
                c.env                = env;
                c.keys               = keys;
                c.composer           = composer;
                c.contextPropagation = contextPropagation;
                c.silent             = silent;
                return c;
            }
        }

        // Never mutated after construction
        private final Values values;

        private DefaultBuilder(Values values) {
            this.values = values;
        }

        private DefaultBuilder with(Consumer<Values> change) {
            var v = values.copy();
            change.accept(v);
            return new DefaultBuilder(v);
        }

        @Override
        public Builder proxy(boolean newVal) {
            return with(v -> v.proxy = newVal);
        }

        @Override
        public Builder subdomainOffset(int newVal) {
            if (newVal < 0) {
                throw new IllegalArgumentException("Negative offset: " + newVal);
            }
            return with(v -> v.subdomainOffset = newVal);
        }

        @Override
        public Builder proxyIpHeader(String newVal) {
            if (newVal.isBlank()) {
                throw new IllegalArgumentException("Blank header name.");
            }
            return with(v -> v.proxyIpHeader = newVal);
        }

        @Override
        public Builder maxIpsCount(int newVal) {
            if (newVal < 0) {
                throw new IllegalArgumentException("Negative count: " + newVal);
            }
            return with(v -> v.maxIpsCount = newVal);
        }

        @Override
        public Builder env(String newVal) {
            requireNonNull(newVal);
            return with(v -> v.env = newVal);
        }

        @Override
        public Builder keys(List<String> newVal) {
            var copy = List.copyOf(newVal);
            return with(v -> v.keys = copy);
        }

        @Override
        public Builder composer(Composer newVal) {
            return with(v -> v.composer = newVal);
        }

        @Override
        public Builder contextPropagation(boolean newVal) {
            return with(v -> v.contextPropagation = newVal);
        }

        @Override
        public Builder silent(boolean newVal) {
            return with(v -> v.silent = newVal);
        }

        @Override
        public Config build() {
            return new DefaultConfig(this, values);
        }
    }
}
