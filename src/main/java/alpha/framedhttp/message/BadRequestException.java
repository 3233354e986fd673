package alpha.framedhttp.message;

import java.io.Serial;

import static alpha.framedhttp.HttpConstants.StatusCode.FOUR_HUNDRED;

/**
 * A generic exception to reject a bad request (400).<p>
 * 
 * Thrown by the server if the request has a malformed {@code Content-Length},
 * both {@code Content-Length} and {@code Transfer-Encoding}, or a {@code
 * Transfer-Encoding} that does not end with "chunked".
 * 
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7230#section-3.3.3">RFC 7230 §3.3.3</a>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class BadRequestException extends HttpProtocolException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code BadRequestException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public BadRequestException(String message) {
        super(FOUR_HUNDRED, message);
    }
}
