package alpha.framedhttp.message;

import java.io.Serial;

/**
 * Thrown by the server if a response carries a header that only the server
 * may set; {@code Content-Length} or {@code Transfer-Encoding}.<p>
 * 
 * This is a programming error of the application, not a protocol error, and
 * the client receives a 500 (Internal Server Error).
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class IllegalResponseHeaderException extends IllegalArgumentException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code IllegalResponseHeaderException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public IllegalResponseHeaderException(String message) {
        super(message);
    }
}
