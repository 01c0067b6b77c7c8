package alpha.onionhttp.util;

import alpha.onionhttp.HttpConstants.ReasonPhrase;
import alpha.onionhttp.HttpConstants.StatusCode;

import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

/**
 * Registry of HTTP status codes.<p>
 *
 * The registry knows the reason phrase of all codes registered with
 * <a href="https://www.iana.org/assignments/http-status-codes">IANA</a>, and
 * which codes forbid a message body.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Statuses {
    private Statuses() {
        // Empty
    }

    private static final Map<Integer, String> PHRASES = Map.ofEntries(
        entry(100, ReasonPhrase.CONTINUE),
        entry(101, "Switching Protocols"),
        entry(102, "Processing"),
        entry(103, "Early Hints"),
        entry(200, ReasonPhrase.OK),
        entry(201, "Created"),
        entry(202, "Accepted"),
        entry(203, "Non-Authoritative Information"),
        entry(204, ReasonPhrase.NO_CONTENT),
        entry(205, ReasonPhrase.RESET_CONTENT),
        entry(206, "Partial Content"),
        entry(207, "Multi-Status"),
        entry(208, "Already Reported"),
        entry(226, "IM Used"),
        entry(300, "Multiple Choices"),
        entry(301, "Moved Permanently"),
        entry(302, "Found"),
        entry(303, "See Other"),
        entry(304, ReasonPhrase.NOT_MODIFIED),
        entry(305, "Use Proxy"),
        entry(307, "Temporary Redirect"),
        entry(308, "Permanent Redirect"),
        entry(400, ReasonPhrase.BAD_REQUEST),
        entry(401, "Unauthorized"),
        entry(402, "Payment Required"),
        entry(403, "Forbidden"),
        entry(404, ReasonPhrase.NOT_FOUND),
        entry(405, "Method Not Allowed"),
        entry(406, "Not Acceptable"),
        entry(407, "Proxy Authentication Required"),
        entry(408, "Request Timeout"),
        entry(409, "Conflict"),
        entry(410, "Gone"),
        entry(411, "Length Required"),
        entry(412, "Precondition Failed"),
        entry(413, "Payload Too Large"),
        entry(414, "URI Too Long"),
        entry(415, "Unsupported Media Type"),
        entry(416, "Range Not Satisfiable"),
        entry(417, "Expectation Failed"),
        entry(418, "I'm a Teapot"),
        entry(421, "Misdirected Request"),
        entry(422, "Unprocessable Entity"),
        entry(423, "Locked"),
        entry(424, "Failed Dependency"),
        entry(425, "Too Early"),
        entry(426, "Upgrade Required"),
        entry(428, "Precondition Required"),
        entry(429, "Too Many Requests"),
        entry(431, "Request Header Fields Too Large"),
        entry(451, "Unavailable For Legal Reasons"),
        entry(500, ReasonPhrase.INTERNAL_SERVER_ERROR),
        entry(501, "Not Implemented"),
        entry(502, "Bad Gateway"),
        entry(503, "Service Unavailable"),
        entry(504, "Gateway Timeout"),
        entry(505, "HTTP Version Not Supported"),
        entry(506, "Variant Also Negotiates"),
        entry(507, "Insufficient Storage"),
        entry(508, "Loop Detected"),
        entry(509, "Bandwidth Limit Exceeded"),
        entry(510, "Not Extended"),
        entry(511, "Network Authentication Required"));

    /**
     * Returns {@code true} if a response with the given status code must not
     * carry a message body, otherwise {@code false}.<p>
     *
     * The body-less codes are all 1XX (Informational) codes, 204 (No Content),
     * 205 (Reset Content) and 304 (Not Modified).
     *
     * @param code status code
     * @return see JavaDoc
     */
    public static boolean isBodyless(int code) {
        return StatusCode.isInformational(code) ||
               code == StatusCode.TWO_HUNDRED_FOUR ||
               code == StatusCode.TWO_HUNDRED_FIVE ||
               code == StatusCode.THREE_HUNDRED_FOUR;
    }

    /**
     * Returns the registered reason phrase of the given status code.
     *
     * @param code status code
     * @return the phrase, or an empty optional if the code is not registered
     */
    public static Optional<String> message(int code) {
        return Optional.ofNullable(PHRASES.get(code));
    }

    /**
     * Returns {@code true} if the given code is a syntactically valid status
     * code (three digits; 100 to 999 inclusive), otherwise {@code false}.
     *
     * @param code status code
     * @return see JavaDoc
     */
    public static boolean isValid(int code) {
        return code >= 100 && code <= 999;
    }
}
