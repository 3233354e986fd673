package alpha.framedhttp.message;

import static alpha.framedhttp.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.framedhttp.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.framedhttp.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static alpha.framedhttp.HttpConstants.StatusCode.TWO_HUNDRED;
import static alpha.framedhttp.util.BodyReaders.ofString;

/**
 * Factories of responses.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Responses
{
    private Responses() {
        // Empty
    }
    
    /** The media type of text responses. */
    public static final String TEXT_PLAIN_UTF8 = "text/plain; charset=utf-8";
    
    /**
     * Returns a 200 (OK) response with the given body.
     * 
     * @param body of response
     * @return a response
     */
    public static Response ok(BodyReader body) {
        return Response.builder(TWO_HUNDRED).body(body).build();
    }
    
    /**
     * Returns a response with a "text/plain; charset=utf-8" body.
     * 
     * @param statusCode of response
     * @param text body of response
     * @return a response
     */
    public static Response text(int statusCode, String text) {
        return Response.builder(statusCode)
                       .header(CONTENT_TYPE, TEXT_PLAIN_UTF8)
                       .body(ofString(text))
                       .build();
    }
    
    /**
     * Returns a 404 (Not Found) response with no body.
     * 
     * @return a response
     */
    public static Response notFound() {
        return Response.builder(FOUR_HUNDRED_FOUR).build();
    }
    
    /**
     * Returns a 500 (Internal Server Error) response with no body.
     * 
     * @return a response
     */
    public static Response internalServerError() {
        return Response.builder(FIVE_HUNDRED).build();
    }
}
