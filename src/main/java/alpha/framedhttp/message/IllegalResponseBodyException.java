package alpha.framedhttp.message;

import java.io.Serial;

/**
 * Thrown by the server if a response body yields more or fewer bytes than its
 * declared length.<p>
 * 
 * This is a programming error of the application. The response is already
 * partially written when this happens, so the connection is closed.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class IllegalResponseBodyException extends IllegalStateException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code IllegalResponseBodyException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public IllegalResponseBodyException(String message) {
        super(message);
    }
}
