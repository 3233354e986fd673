package alpha.framedhttp.message;

import alpha.framedhttp.Config;

import java.io.Serial;

import static alpha.framedhttp.HttpConstants.StatusCode.FOUR_HUNDRED_THIRTEEN;

/**
 * Thrown by the server if the size of an inbound request head exceeds the
 * configured tolerance (413).
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see Config#maxRequestHeadSize()
 */
public final class MaxRequestHeadSizeException extends HttpProtocolException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code MaxRequestHeadSizeException}.
     * 
     * @param configuredMax the exceeded tolerance
     */
    public MaxRequestHeadSizeException(int configuredMax) {
        // This would be the first thing one reading the log would like to know
        super(FOUR_HUNDRED_THIRTEEN,
              "Header is too large, configured max tolerance is " +
              configuredMax + " bytes.");
    }
}
