package alpha.framedhttp.message;

import java.io.Serial;

import static alpha.framedhttp.HttpConstants.StatusCode.FOUR_HUNDRED;

/**
 * Thrown by the server if the request-line is malformed (400).<p>
 * 
 * The request-line must be {@code METHOD SP TARGET SP VERSION}, with a
 * non-empty token as method and a non-empty request-target.
 * 
 * @see <a href="https://tools.ietf.org/html/rfc7230#section-3.1.1">RFC 7230 §3.1.1</a>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class RequestLineParseException extends HttpProtocolException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code RequestLineParseException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public RequestLineParseException(String message) {
        super(FOUR_HUNDRED, message);
    }
}
