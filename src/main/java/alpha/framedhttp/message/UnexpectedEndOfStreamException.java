package alpha.framedhttp.message;

import java.io.Serial;

import static alpha.framedhttp.HttpConstants.StatusCode.FOUR_HUNDRED;

/**
 * Thrown when the client closes its output stream in the middle of a message
 * (400).<p>
 * 
 * A clean close, i.e. end-of-stream before the first byte of a new request, is
 * not an error.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class UnexpectedEndOfStreamException extends HttpProtocolException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code UnexpectedEndOfStreamException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public UnexpectedEndOfStreamException(String message) {
        super(FOUR_HUNDRED, message);
    }
}
