package alpha.onionhttp;

import alpha.onionhttp.util.Statuses;

/**
 * Namespace of constants related to the HTTP protocol.<p>
 *
 * For lookups, such as whether a status code permits a message body, see
 * {@link Statuses}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }

    /**
     * HTTP methods are included on the first line of a request and indicates
     * the desired action to be performed on a server-side resource.<p>
     *
     * The method is a case-sensitive string and can be anything. Only the
     * methods this library itself reacts to, or that are commonly used by
     * middleware, are declared here (
     * <a href="https://tools.ietf.org/html/rfc7231#section-4.1">RFC 7231 §4.1</a>
     * ).
     */
    public static final class Method {
        private Method() {
            // Private
        }

        /** Transfer a current representation of the target resource. */
        public static final String GET = "GET";

        /**
         * Same as GET, but only transfer the status line and header
         * section.<p>
         *
         * The response serializer never writes a body in response to a
         * {@value} request, although the length of the would-be body is
         * announced in the {@value HeaderName#CONTENT_LENGTH} header, if
         * known.
         */
        public static final String HEAD = "HEAD";

        /** Perform resource-specific processing on the request payload. */
        public static final String POST = "POST";

        /** Replace all current representations of the target resource. */
        public static final String PUT = "PUT";

        /** Remove all current representations of the target resource. */
        public static final String DELETE = "DELETE";

        /** Establish a tunnel to the server identified by the target. */
        public static final String CONNECT = "CONNECT";

        /** Describe the communication options for the target resource. */
        public static final String OPTIONS = "OPTIONS";

        /** Perform a message loop-back test. */
        public static final String TRACE = "TRACE";

        /** Apply partial modifications to a resource. */
        public static final String PATCH = "PATCH";
    }

    /**
     * The status code is a three-digit integer value giving the result of the
     * processed request. They are classified into five classes; 1XX
     * (Informational), 2XX (Successful), 3XX (Redirection), 4XX (Client Error)
     * and 5XX (Server Error).<p>
     *
     * Only the codes the library refers to by name are declared. Any integer
     * in the range 100 to 999 may be used as a status code.
     */
    public static final class StatusCode {
        private StatusCode() {
            // Private
        }

        /** {@value} {@value ReasonPhrase#CONTINUE}. */
        public static final int ONE_HUNDRED = 100;

        /** {@value} {@value ReasonPhrase#OK}. */
        public static final int TWO_HUNDRED = 200;

        /**
         * {@value} {@value ReasonPhrase#NO_CONTENT}.<p>
         *
         * Is the status code set when the application explicitly assigns a
         * {@code null} response body, unless the status has already been set to
         * a code not allowing a body.
         */
        public static final int TWO_HUNDRED_FOUR = 204;

        /** {@value} {@value ReasonPhrase#RESET_CONTENT}. */
        public static final int TWO_HUNDRED_FIVE = 205;

        /** {@value} {@value ReasonPhrase#NOT_MODIFIED}. */
        public static final int THREE_HUNDRED_FOUR = 304;

        /** {@value} {@value ReasonPhrase#BAD_REQUEST}. */
        public static final int FOUR_HUNDRED = 400;

        /**
         * {@value} {@value ReasonPhrase#NOT_FOUND}.<p>
         *
         * Is the initial status code of every response. Middleware that never
         * sets a status or a body yields a 404 (Not Found) to the client.
         * Errors with this status are never logged by the
         * {@linkplain alpha.onionhttp.handler.ErrorHandler#BASE base error
         * handler}.
         */
        public static final int FOUR_HUNDRED_FOUR = 404;

        /** {@value} {@value ReasonPhrase#INTERNAL_SERVER_ERROR}. */
        public static final int FIVE_HUNDRED = 500;

        /**
         * Returns {@code true} if the given status code is 1XX
         * (Informational), otherwise {@code false}.
         *
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isInformational(int code) {
            return code >= 100 && code <= 199;
        }

        /**
         * Returns {@code true} if the given status code is 2XX (Successful),
         * otherwise {@code false}.
         *
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isSuccessful(int code) {
            return code >= 200 && code <= 299;
        }

        /**
         * Returns {@code true} if the given status code is 4XX (Client Error),
         * otherwise {@code false}.
         *
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isClientError(int code) {
            return code >= 400 && code <= 499;
        }

        /**
         * Returns {@code true} if the given status code is 5XX (Server Error),
         * otherwise {@code false}.
         *
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isServerError(int code) {
            return code >= 500 && code <= 599;
        }
    }

    /**
     * "The reason-phrase element exists for the sole purpose of providing a
     * textual description associated with the numeric status code" (
     * <a href="https://tools.ietf.org/html/rfc7230#section-3.1.2">RFC 7230 §3.1.2</a>
     * ).<p>
     *
     * The full registry is held by {@link Statuses#message(int)}.
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Private
        }

        /** Goes with status code {@value StatusCode#ONE_HUNDRED}. */
        public static final String CONTINUE = "Continue";

        /** Goes with status code {@value StatusCode#TWO_HUNDRED}. */
        public static final String OK = "OK";

        /** Goes with status code {@value StatusCode#TWO_HUNDRED_FOUR}. */
        public static final String NO_CONTENT = "No Content";

        /** Goes with status code {@value StatusCode#TWO_HUNDRED_FIVE}. */
        public static final String RESET_CONTENT = "Reset Content";

        /** Goes with status code {@value StatusCode#THREE_HUNDRED_FOUR}. */
        public static final String NOT_MODIFIED = "Not Modified";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED}. */
        public static final String BAD_REQUEST = "Bad Request";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_FOUR}. */
        public static final String NOT_FOUND = "Not Found";

        /** Goes with status code {@value StatusCode#FIVE_HUNDRED}. */
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";
    }

    /**
     * Header names used by the library.<p>
     *
     * Header names are case-insensitive. The transport is expected to treat
     * them as such.
     */
    public static final class HeaderName {
        private HeaderName() {
            // Private
        }

        /** The size of the message body, in bytes. */
        public static final String CONTENT_LENGTH = "Content-Length";

        /** The media type of the message body. */
        public static final String CONTENT_TYPE = "Content-Type";

        /** Codings applied to the message body in order to form the message. */
        public static final String TRANSFER_ENCODING = "Transfer-Encoding";

        /** The host and port number of the target resource. */
        public static final String HOST = "Host";

        /**
         * Original host requested by the client, as forwarded by a proxy.<p>
         *
         * Only trusted if {@link Config#proxy()} is {@code true}.
         */
        public static final String X_FORWARDED_HOST = "X-Forwarded-Host";

        /**
         * Default header carrying the chain of client addresses, as forwarded
         * by proxies.
         *
         * @see Config#proxyIpHeader()
         */
        public static final String X_FORWARDED_FOR = "X-Forwarded-For";

        /**
         * Protocol used by the client to connect to the proxy.<p>
         *
         * Only trusted if {@link Config#proxy()} is {@code true}.
         */
        public static final String X_FORWARDED_PROTO = "X-Forwarded-Proto";
    }
}
