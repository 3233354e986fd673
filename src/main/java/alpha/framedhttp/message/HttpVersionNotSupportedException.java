package alpha.framedhttp.message;

import java.io.Serial;

import static alpha.framedhttp.HttpConstants.StatusCode.FIVE_HUNDRED_FIVE;

/**
 * Thrown if the HTTP-version of a request is well-formed, but neither
 * HTTP/1.0 nor HTTP/1.1 (505).
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class HttpVersionNotSupportedException extends HttpProtocolException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final String version;
    
    /**
     * Constructs a {@code HttpVersionNotSupportedException}.
     * 
     * @param version the rejected token
     */
    public HttpVersionNotSupportedException(String version) {
        super(FIVE_HUNDRED_FIVE, "HTTP-version not supported: \"" + version + "\".");
        this.version = version;
    }
    
    /**
     * {@return the rejected token}
     */
    public String version() {
        return version;
    }
}
