package alpha.framedhttp.message;

import java.io.Serial;

import static alpha.framedhttp.HttpConstants.StatusCode.FOUR_HUNDRED;

/**
 * Thrown by the server when a request of a method that carries no body (GET,
 * HEAD) nonetheless declares one (400).
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class IllegalRequestBodyException extends HttpProtocolException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code IllegalRequestBodyException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public IllegalRequestBodyException(String message) {
        super(FOUR_HUNDRED, message);
    }
}
