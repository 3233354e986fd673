package alpha.framedhttp;

import alpha.framedhttp.message.HttpVersionNotSupportedException;
import alpha.framedhttp.message.HttpVersionParseException;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Namespace of constants related to the HTTP protocol.<p>
 *
 * Only the constants used by the framing layer and the servers are declared.
 * Header names are given in their canonical form, but are always compared
 * case-insensitively.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }

    /**
     * Request methods with special meaning to the server.<p>
     *
     * The method token is case-sensitive and can be anything, but a request
     * using {@link #GET} or {@link #HEAD} is not allowed to carry a body.
     *
     * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.1">RFC 7231 §4.1</a>
     */
    public static final class Method {
        private Method() {
            // Empty
        }

        /** Retrieve a representation. Carries no body. */
        public static final String GET = "GET";

        /** Same as {@link #GET}, but the response has no body. */
        public static final String HEAD = "HEAD";

        /** Process the enclosed representation. */
        public static final String POST = "POST";

        /** Replace the target resource. */
        public static final String PUT = "PUT";

        /** Remove the target resource. */
        public static final String DELETE = "DELETE";

        /**
         * Returns {@code true} if the given method never carries a request
         * body.
         *
         * @param method of request
         * @return see JavaDoc
         */
        public static boolean isBodyless(String method) {
            return GET.equals(method) || HEAD.equals(method);
        }
    }

    /**
     * Status codes used by the server.
     *
     * @see <a href="https://tools.ietf.org/html/rfc7231#section-6">RFC 7231 §6</a>
     */
    public static final class StatusCode {
        private StatusCode() {
            // Empty
        }

        /** {@value} (OK) */
        public static final int TWO_HUNDRED = 200;

        /** {@value} (No Content) */
        public static final int TWO_HUNDRED_FOUR = 204;

        /** {@value} (Bad Request) */
        public static final int FOUR_HUNDRED = 400;

        /** {@value} (Not Found) */
        public static final int FOUR_HUNDRED_FOUR = 404;

        /** {@value} (Payload Too Large) */
        public static final int FOUR_HUNDRED_THIRTEEN = 413;

        /** {@value} (Internal Server Error) */
        public static final int FIVE_HUNDRED = 500;

        /** {@value} (Not Implemented) */
        public static final int FIVE_HUNDRED_ONE = 501;

        /** {@value} (HTTP Version Not Supported) */
        public static final int FIVE_HUNDRED_FIVE = 505;
    }

    /**
     * Reason phrases, one for each known status code.
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Empty
        }

        /** {@value} is used when no other phrase is known. */
        public static final String UNKNOWN = "Unknown";

        /** Goes with status code {@value StatusCode#TWO_HUNDRED}. */
        public static final String OK = "OK";

        /** Goes with status code {@value StatusCode#TWO_HUNDRED_FOUR}. */
        public static final String NO_CONTENT = "No Content";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED}. */
        public static final String BAD_REQUEST = "Bad Request";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_FOUR}. */
        public static final String NOT_FOUND = "Not Found";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_THIRTEEN}. */
        public static final String PAYLOAD_TOO_LARGE = "Payload Too Large";

        /** Goes with status code {@value StatusCode#FIVE_HUNDRED}. */
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";

        /** Goes with status code {@value StatusCode#FIVE_HUNDRED_ONE}. */
        public static final String NOT_IMPLEMENTED = "Not Implemented";

        /** Goes with status code {@value StatusCode#FIVE_HUNDRED_FIVE}. */
        public static final String HTTP_VERSION_NOT_SUPPORTED = "HTTP Version Not Supported";

        private static final Map<Integer, String> BY_CODE = Map.ofEntries(
                entry(StatusCode.TWO_HUNDRED,           OK),
                entry(StatusCode.TWO_HUNDRED_FOUR,      NO_CONTENT),
                entry(StatusCode.FOUR_HUNDRED,          BAD_REQUEST),
                entry(StatusCode.FOUR_HUNDRED_FOUR,     NOT_FOUND),
                entry(StatusCode.FOUR_HUNDRED_THIRTEEN, PAYLOAD_TOO_LARGE),
                entry(StatusCode.FIVE_HUNDRED,          INTERNAL_SERVER_ERROR),
                entry(StatusCode.FIVE_HUNDRED_ONE,      NOT_IMPLEMENTED),
                entry(StatusCode.FIVE_HUNDRED_FIVE,     HTTP_VERSION_NOT_SUPPORTED));

        /**
         * {@return the reason phrase of the given status code, or
         * {@link #UNKNOWN}}
         *
         * @param statusCode the code
         */
        public static String of(int statusCode) {
            return BY_CODE.getOrDefault(statusCode, UNKNOWN);
        }
    }

    /**
     * Header names used by the server.
     */
    public static final class HeaderName {
        private HeaderName() {
            // Empty
        }

        /**
         * Connection options. The only option the server acts on is
         * "close".
         *
         * @see <a href="https://tools.ietf.org/html/rfc7230#section-6.1">RFC 7230 §6.1</a>
         */
        public static final String CONNECTION = "Connection";

        /**
         * The length of the message body. Is computed by the server for each
         * response and must never be set by the application.
         *
         * @see <a href="https://tools.ietf.org/html/rfc7230#section-3.3.2">RFC 7230 §3.3.2</a>
         */
        public static final String CONTENT_LENGTH = "Content-Length";

        /** The media type of the message body. */
        public static final String CONTENT_TYPE = "Content-Type";

        /** Host and port of the target. */
        public static final String HOST = "Host";

        /** Identifies the origin server software. */
        public static final String SERVER = "Server";

        /**
         * Codings applied to the message body. Same as {@link #CONTENT_LENGTH},
         * the server owns this header for responses.
         *
         * @see <a href="https://tools.ietf.org/html/rfc7230#section-3.3.1">RFC 7230 §3.3.1</a>
         */
        public static final String TRANSFER_ENCODING = "Transfer-Encoding";
    }

    /**
     * HTTP versions understood by the server.<p>
     *
     * The version token of the request line determines whether the connection
     * may be reused after the exchange; HTTP/1.0 closes, HTTP/1.1 is
     * persistent by default.
     *
     * @see <a href="https://tools.ietf.org/html/rfc7230#section-2.6">RFC 7230 §2.6</a>
     */
    public enum Version
    {
        /** HTTP/1.0, not persistent. */
        HTTP_1_0 ("1.0"),

        /** HTTP/1.1, persistent unless told otherwise. */
        HTTP_1_1 ("1.1");

        private final String number;

        Version(String number) {
            this.number = number;
        }

        /**
         * Parses a version token, e.g. "HTTP/1.1".
         *
         * @param str the token
         *
         * @return the version
         *
         * @throws HttpVersionParseException
         *             if the token is not on the form "HTTP/DIGIT.DIGIT"
         * @throws HttpVersionNotSupportedException
         *             if the version is well-formed but neither 1.0 nor 1.1
         */
        public static Version parse(String str) {
            if (str.length() != 8 || !str.startsWith("HTTP/") ||
                !isDigit(str.charAt(5)) || str.charAt(6) != '.' ||
                !isDigit(str.charAt(7)))
            {
                throw new HttpVersionParseException(str);
            }
            for (Version v : values()) {
                if (str.endsWith(v.number)) {
                    return v;
                }
            }
            throw new HttpVersionNotSupportedException(str);
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        /**
         * {@return the version number, e.g. "1.1"}
         */
        public String number() {
            return number;
        }

        /**
         * {@return the version token, e.g. "HTTP/1.1"}
         */
        @Override
        public String toString() {
            return "HTTP/" + number;
        }
    }
}
