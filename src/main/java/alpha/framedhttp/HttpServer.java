package alpha.framedhttp;

import alpha.framedhttp.handler.RequestHandler;
import alpha.framedhttp.internal.DefaultServer;

/**
 * Listens on a port for HTTP/1.1 connections.<p>
 * 
 * The server's function is to provide port- and channel management, parse
 * inbound request heads, frame request bodies, and call the {@link
 * RequestHandler} once per request. The response returned by the handler is
 * written back with a server-computed {@code Content-Length} (or chunked
 * encoding, if the length is unknown).<p>
 * 
 * A trivial example:
 * <pre>
 *   HttpServer.{@link #create(RequestHandler) create}((req, body) -&gt;
 *           completedStage(Responses.text(200, "hello world.\n")))
 *       .start(8080);
 * </pre>
 * 
 * Requests on one connection are processed in the order received, one at a
 * time. Persistent connections are the default for HTTP/1.1, and pipelined
 * requests are supported.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface HttpServer extends Server
{
    /**
     * Creates a server using {@linkplain Config#DEFAULT default
     * configuration}.
     * 
     * @param handler of requests
     * 
     * @return an instance of {@link DefaultServer}
     * 
     * @throws NullPointerException if {@code handler} is {@code null}
     */
    static HttpServer create(RequestHandler handler) {
        return create(Config.DEFAULT, handler);
    }
    
    /**
     * Creates a server.
     * 
     * @param config of server
     * @param handler of requests
     * 
     * @return an instance of {@link DefaultServer}
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    static HttpServer create(Config config, RequestHandler handler) {
        return new DefaultServer(config, handler);
    }
    
    /**
     * {@return the request handler}
     */
    RequestHandler getHandler();
}
