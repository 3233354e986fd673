package alpha.framedhttp.message;

import java.io.Serial;

import static alpha.framedhttp.HttpConstants.StatusCode.FOUR_HUNDRED;

/**
 * Thrown by the server if a header field line is malformed (400).<p>
 * 
 * A header line must have a colon, preceded by a non-empty name that has no
 * control characters and no whitespace.
 * 
 * @see <a href="https://tools.ietf.org/html/rfc7230#section-3.2">RFC 7230 §3.2</a>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class HeaderParseException extends HttpProtocolException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code HeaderParseException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public HeaderParseException(String message) {
        super(FOUR_HUNDRED, message);
    }
}
