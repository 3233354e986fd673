package alpha.framedhttp.message;

import java.io.Serial;

import static alpha.framedhttp.HttpConstants.StatusCode.FOUR_HUNDRED;

/**
 * Thrown if the HTTP-version of a request-line is not on the form
 * "HTTP/DIGIT.DIGIT" (400).
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see <a href="https://tools.ietf.org/html/rfc7230#section-2.6">RFC 7230 §2.6</a>
 */
public final class HttpVersionParseException extends HttpProtocolException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final String version;
    
    /**
     * Constructs a {@code HttpVersionParseException}.
     * 
     * @param version the token that failed to parse
     */
    public HttpVersionParseException(String version) {
        super(FOUR_HUNDRED, "Malformed HTTP-version: \"" + version + "\".");
        this.version = version;
    }
    
    /**
     * {@return the token that failed to parse}
     */
    public String version() {
        return version;
    }
}
