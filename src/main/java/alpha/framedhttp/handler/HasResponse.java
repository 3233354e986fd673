package alpha.framedhttp.handler;

import alpha.framedhttp.message.HttpProtocolException;
import alpha.framedhttp.message.Response;

/**
 * Adds {@link #getResponse()}.<p>
 * 
 * This interface is intended to be implemented by exception classes aware of
 * their HTTP environment. All {@link HttpProtocolException}s implement it, and
 * so may any exception thrown by a {@link RequestHandler}.<p>
 * 
 * When a request fails before or during the handler invocation, the server
 * writes the exception's response (if the exception implements this interface)
 * or a 500 (Internal Server Error), and then closes the connection.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface HasResponse {
    /**
     * Returns the response to write as a consequence of this exception.<p>
     * 
     * The response should never indicate success, and it must not carry a
     * Content-Length or Transfer-Encoding header.
     * 
     * @apiNote
     * The "get" prefix is to be consistent with {@code Throwable}'s API design.
     * 
     * @return an error response (never {@code null})
     */
    Response getResponse();
}
