package alpha.framedhttp.message;

import alpha.framedhttp.handler.HasResponse;

import java.io.Serial;

/**
 * Abstract superclass of exceptions thrown because a client violated the
 * protocol.<p>
 * 
 * Each exception carries a status code. The response is that status code with
 * the exception message (plus a LF) as a plain text body. A protocol error is
 * fatal to the connection; the server writes the response, if it still can,
 * and then closes the connection.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public abstract class HttpProtocolException
       extends RuntimeException implements HasResponse
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final int statusCode;
    
    HttpProtocolException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }
    
    HttpProtocolException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
    
    /**
     * {@return the status code of the response}
     */
    public final int statusCode() {
        return statusCode;
    }
    
    /**
     * {@return a plain text response with the status code and message}
     */
    @Override
    public Response getResponse() {
        return Responses.text(statusCode, getMessage() + "\n");
    }
}
