package alpha.onionhttp.core;

import alpha.onionhttp.Server;
import alpha.onionhttp.transport.IncomingRequest;
import alpha.onionhttp.transport.OutgoingResponse;
import alpha.onionhttp.transport.RequestListener;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.sun.net.httpserver.HttpsExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

import static alpha.onionhttp.HttpConstants.HeaderName.CONTENT_LENGTH;
import static alpha.onionhttp.HttpConstants.HeaderName.TRANSFER_ENCODING;
import static alpha.onionhttp.HttpConstants.Method.HEAD;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Adapts the JDK's built-in HTTP server to {@link IncomingRequest} and
 * {@link OutgoingResponse}.<p>
 * 
 * The status line and headers are buffered until the first write. A response
 * ended before any body bytes were written is sent with an exact
 * Content-Length, otherwise the body is chunked, unless the application set
 * the Content-Length header.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class JdkHttpTransport
{
    private static final System.Logger LOG
            = System.getLogger(JdkHttpTransport.class.getPackageName());
    
    private JdkHttpTransport() {
        // Empty
    }
    
    /**
     * Starts a server.
     * 
     * @param address to bind
     * @param listener of requests
     * @return the running server
     * @throws IOException if binding fails
     */
    static Server start(InetSocketAddress address, RequestListener listener)
            throws IOException
    {
        final HttpServer server = HttpServer.create(address, 0);
        final ExecutorService exec = Executors.newCachedThreadPool();
        server.setExecutor(exec);
        server.createContext("/", exchange -> {
            var in  = new Incoming(exchange);
            var out = new Outgoing(exchange);
            listener.handle(in, out).whenComplete((nil, thr) -> {
                if (thr != null) {
                    LOG.log(ERROR, "Request listener failed.", thr);
                    out.abort(thr);
                } else if (out.isWritable()) {
                    LOG.log(DEBUG, "Response left open by application.");
                }
            });
        });
        server.start();
        LOG.log(INFO, () -> "Listening on " + server.getAddress());
        return new DefaultServer(server, exec);
    }
    
    static final class Incoming implements IncomingRequest
    {
        private final HttpExchange exch;
        
        Incoming(HttpExchange exch) {
            this.exch = exch;
        }
        
        @Override
        public String url() {
            return exch.getRequestURI().toString();
        }
        
        @Override
        public String method() {
            return exch.getRequestMethod();
        }
        
        @Override
        public int httpVersionMajor() {
            return parseMajor(exch.getProtocol());
        }
        
        // "HTTP/1.1" -> 1
        static int parseMajor(String protocol) {
            if (protocol == null) {
                return 1;
            }
            int slash = protocol.indexOf('/');
            int dot = protocol.indexOf('.', slash + 1);
            var major = protocol.substring(slash + 1, dot < 0 ? protocol.length() : dot);
            try {
                return Integer.parseInt(major.strip());
            } catch (NumberFormatException e) {
                LOG.log(DEBUG, () -> "Unknown protocol version: " + protocol);
                return 1;
            }
        }
        
        @Override
        public Optional<String> header(String name) {
            return Optional.ofNullable(
                    exch.getRequestHeaders().getFirst(requireNonNull(name)));
        }
        
        @Override
        public Map<String, List<String>> headers() {
            var copy = new LinkedHashMap<String, List<String>>();
            exch.getRequestHeaders().forEach((k, v) -> copy.put(k, List.copyOf(v)));
            return unmodifiableMap(copy);
        }
        
        @Override
        public InetSocketAddress remoteAddress() {
            return exch.getRemoteAddress();
        }
        
        @Override
        public boolean encrypted() {
            return exch instanceof HttpsExchange;
        }
    }
    
    static final class Outgoing implements OutgoingResponse
    {
        private static final long NO_BODY = -1, CHUNKED = 0;
        
        private final HttpExchange exch;
        private final boolean head;
        private final List<Consumer<? super Throwable>> listeners;
        private int status;
        private String message;
        private OutputStream body;
        private boolean ended, finished;
        private Throwable failure;
        
        Outgoing(HttpExchange exch) {
            this.exch = exch;
            this.head = HEAD.equals(exch.getRequestMethod());
            this.listeners = new ArrayList<>();
            this.status = 200;
        }
        
        @Override
        public synchronized int statusCode() {
            return status;
        }
        
        @Override
        public synchronized void statusCode(int code) {
            if (!headersSent()) {
                status = code;
            }
        }
        
        // The JDK server writes its own reason phrase
        @Override
        public synchronized String statusMessage() {
            return message;
        }
        
        @Override
        public synchronized void statusMessage(String phrase) {
            message = phrase;
        }
        
        @Override
        public synchronized boolean isWritable() {
            return !ended && failure == null;
        }
        
        @Override
        public synchronized boolean headersSent() {
            return body != null;
        }
        
        @Override
        public Optional<String> header(String name) {
            return Optional.ofNullable(
                    exch.getResponseHeaders().getFirst(requireNonNull(name)));
        }
        
        @Override
        public synchronized void setHeader(String name, String value) {
            if (!headersSent()) {
                exch.getResponseHeaders().set(requireNonNull(name), requireNonNull(value));
            }
        }
        
        @Override
        public synchronized void removeHeader(String name) {
            if (!headersSent()) {
                exch.getResponseHeaders().remove(requireNonNull(name));
            }
        }
        
        @Override
        public Set<String> headerNames() {
            return new LinkedHashSet<>(exch.getResponseHeaders().keySet());
        }
        
        @Override
        public synchronized void write(byte[] bytes, int off, int len) throws IOException {
            if (ended) {
                throw new IllegalStateException("Response has ended.");
            }
            if (!headersSent()) {
                sendHeaders(header(CONTENT_LENGTH).map(Outgoing::parseLength).orElse(CHUNKED));
            }
            if (head || len == 0) {
                return;
            }
            try {
                body.write(bytes, off, len);
            } catch (IOException e) {
                abort(e);
                throw e;
            }
        }
        
        @Override
        public synchronized void end(byte[] bytes, int off, int len) throws IOException {
            if (ended) {
                return;
            }
            try {
                if (!headersSent()) {
                    sendHeaders(len == 0 ? NO_BODY : len);
                }
                if (!head && len > 0) {
                    body.write(bytes, off, len);
                }
                ended = true;
                body.close();
                exch.close();
            } catch (IOException e) {
                abort(e);
                throw e;
            }
            finish(null);
        }
        
        private void sendHeaders(long length) throws IOException {
            exch.getResponseHeaders().remove(TRANSFER_ENCODING);
            exch.sendResponseHeaders(status, head ? NO_BODY : length);
            body = exch.getResponseBody();
        }
        
        private static long parseLength(String value) {
            try {
                long n = Long.parseLong(value.strip());
                return n > 0 ? n : NO_BODY;
            } catch (NumberFormatException e) {
                LOG.log(DEBUG, () -> "Ignoring malformed Content-Length: " + value);
                return CHUNKED;
            }
        }
        
        synchronized void abort(Throwable cause) {
            if (finished) {
                return;
            }
            failure = cause;
            ended = true;
            exch.close();
            finish(cause);
        }
        
        private void finish(Throwable cause) {
            if (finished) {
                return;
            }
            finished = true;
            var copy = List.copyOf(listeners);
            listeners.clear();
            copy.forEach(l -> l.accept(cause));
        }
        
        @Override
        public synchronized Runnable onFinished(Consumer<? super Throwable> listener) {
            requireNonNull(listener);
            if (finished) {
                listener.accept(failure);
                return () -> {};
            }
            listeners.add(listener);
            return () -> {
                synchronized (this) {
                    listeners.remove(listener);
                }
            };
        }
    }
}
