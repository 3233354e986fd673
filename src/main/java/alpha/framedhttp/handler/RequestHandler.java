package alpha.framedhttp.handler;

import alpha.framedhttp.message.BodyReader;
import alpha.framedhttp.message.Request;
import alpha.framedhttp.message.Response;

import java.util.concurrent.CompletionStage;

/**
 * Produces a response for a request.<p>
 * 
 * The handler is invoked once for each request received on a connection, in
 * the order the requests were received. The next request on the same connection
 * is not parsed until the returned stage has completed and the response has
 * been written.<p>
 * 
 * The handler may consume the request body, or not. Whatever remains of the
 * body after the response has been written is discarded by the server. The
 * body reader must not be used after the returned stage completes, except as
 * the body of the returned response (an echo).<p>
 * 
 * A handler that throws, or returns a stage that completes exceptionally,
 * causes an error response to be written and the connection to be closed. If
 * the exception implements {@link HasResponse}, then that is the response
 * written, otherwise 500 (Internal Server Error).
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface RequestHandler
{
    /**
     * Handles a request.
     * 
     * @param request the request head
     * @param body the request body
     * 
     * @return the response (never {@code null})
     */
    CompletionStage<Response> handle(Request request, BodyReader body);
}
