package alpha.onionhttp.core;

import alpha.onionhttp.Application;
import alpha.onionhttp.Config;
import alpha.onionhttp.context.Context;
import alpha.onionhttp.context.ContextRequest;
import alpha.onionhttp.context.ContextResponse;
import alpha.onionhttp.transport.IncomingRequest;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static alpha.onionhttp.HttpConstants.HeaderName.HOST;
import static alpha.onionhttp.HttpConstants.HeaderName.X_FORWARDED_HOST;
import static alpha.onionhttp.HttpConstants.HeaderName.X_FORWARDED_PROTO;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link ContextRequest}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultContextRequest implements ContextRequest
{
    private static final String AUTHORITY = ":authority";
    
    private static final Pattern
            COMMA = Pattern.compile("\\s*,\\s*"),
            IPV4  = Pattern.compile("^(\\d{1,3})(\\.\\d{1,3}){3}$");
    
    private final DefaultContext ctx;
    private String url;
    
    DefaultContextRequest(DefaultContext ctx, String url) {
        this.ctx = ctx;
        this.url = requireNonNull(url);
    }
    
    @Override
    public Context context() {
        return ctx;
    }
    
    @Override
    public ContextResponse response() {
        return ctx.response();
    }
    
    @Override
    public Application app() {
        return ctx.app();
    }
    
    @Override
    public IncomingRequest incoming() {
        return ctx.incoming();
    }
    
    @Override
    public String originalUrl() {
        return ctx.originalUrl();
    }
    
    @Override
    public String url() {
        return url;
    }
    
    @Override
    public void url(String url) {
        this.url = requireNonNull(url);
    }
    
    @Override
    public String method() {
        return incoming().method();
    }
    
    @Override
    public String path() {
        String p = withoutScheme(withoutFragment(url));
        int q = p.indexOf('?');
        if (q >= 0) {
            p = p.substring(0, q);
        }
        return p.isEmpty() ? "/" : p;
    }
    
    @Override
    public String querystring() {
        String u = withoutFragment(url);
        int q = u.indexOf('?');
        return q < 0 ? "" : u.substring(q + 1);
    }
    
    private static String withoutFragment(String url) {
        int f = url.indexOf('#');
        return f < 0 ? url : url.substring(0, f);
    }
    
    // "http://host:port/path" -> "/path"
    private static String withoutScheme(String url) {
        int s = url.indexOf("://");
        if (s < 0 || url.startsWith("/")) {
            return url;
        }
        int p = url.indexOf('/', s + 3);
        if (p < 0) {
            int q = url.indexOf('?', s + 3);
            return q < 0 ? "" : url.substring(q);
        }
        return url.substring(p);
    }
    
    @Override
    public int httpVersionMajor() {
        return incoming().httpVersionMajor();
    }
    
    @Override
    public Optional<String> header(String name) {
        return incoming().header(name);
    }
    
    @Override
    public Map<String, List<String>> headers() {
        return incoming().headers();
    }
    
    @Override
    public String host() {
        if (config().proxy()) {
            var fwd = header(X_FORWARDED_HOST)
                    .map(v -> COMMA.split(v.strip(), 2)[0])
                    .filter(v -> !v.isEmpty());
            if (fwd.isPresent()) {
                return fwd.get();
            }
        }
        Optional<String> host = Optional.empty();
        if (httpVersionMajor() >= 2) {
            host = header(AUTHORITY).filter(v -> !v.isEmpty());
        }
        return host.or(() -> header(HOST)).orElse("");
    }
    
    @Override
    public String hostname() {
        String host = host();
        if (host.isEmpty()) {
            return "";
        }
        if (host.charAt(0) == '[') {
            // IPv6 literal, keep the brackets
            int end = host.indexOf(']');
            return end < 0 ? "" : host.substring(0, end + 1);
        }
        int colon = host.indexOf(':');
        return colon < 0 ? host : host.substring(0, colon);
    }
    
    @Override
    public String protocol() {
        if (incoming().encrypted()) {
            return "https";
        }
        if (!config().proxy()) {
            return "http";
        }
        return header(X_FORWARDED_PROTO)
                .map(v -> COMMA.split(v.strip(), 2)[0])
                .filter(v -> !v.isEmpty())
                .orElse("http");
    }
    
    @Override
    public List<String> ips() {
        final Config c = config();
        if (!c.proxy()) {
            return List.of();
        }
        var val = header(c.proxyIpHeader()).orElse("").strip();
        if (val.isEmpty()) {
            return List.of();
        }
        List<String> ips = new ArrayList<>(Arrays.asList(COMMA.split(val)));
        ips.removeIf(String::isEmpty);
        if (c.maxIpsCount() > 0 && ips.size() > c.maxIpsCount()) {
            ips = ips.subList(ips.size() - c.maxIpsCount(), ips.size());
        }
        return List.copyOf(ips);
    }
    
    @Override
    public String ip() {
        var ips = ips();
        if (!ips.isEmpty()) {
            return ips.get(0);
        }
        InetSocketAddress remote = incoming().remoteAddress();
        if (remote == null) {
            return "";
        }
        return remote.getAddress() != null ?
                remote.getAddress().getHostAddress() :
                remote.getHostString();
    }
    
    @Override
    public List<String> subdomains() {
        String hostname = hostname();
        if (hostname.isEmpty() || isIp(hostname)) {
            return List.of();
        }
        List<String> parts = new ArrayList<>(Arrays.asList(hostname.split("\\.")));
        Collections.reverse(parts);
        int offset = config().subdomainOffset();
        return offset >= parts.size() ?
                List.of() : List.copyOf(parts.subList(offset, parts.size()));
    }
    
    private static boolean isIp(String hostname) {
        return hostname.startsWith("[") ||
               hostname.indexOf(':') >= 0 ||
               IPV4.matcher(hostname).matches();
    }
    
    private Config config() {
        return ctx.app().getConfig();
    }
}
