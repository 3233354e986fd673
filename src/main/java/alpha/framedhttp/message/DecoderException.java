package alpha.framedhttp.message;

import java.io.Serial;

import static alpha.framedhttp.HttpConstants.StatusCode.FOUR_HUNDRED;

/**
 * Thrown by a decoder of a chunked request body if the encoding is malformed
 * (400).
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7230#section-4.1">RFC 7230 §4.1</a>
 */
public final class DecoderException extends HttpProtocolException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code DecoderException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public DecoderException(String message) {
        super(FOUR_HUNDRED, message);
    }
    
    /**
     * Constructs a {@code DecoderException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public DecoderException(String message, Throwable cause) {
        super(FOUR_HUNDRED, message, cause);
    }
}
