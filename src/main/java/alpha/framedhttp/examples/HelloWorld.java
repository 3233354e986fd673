package alpha.framedhttp.examples;

import alpha.framedhttp.HttpServer;
import alpha.framedhttp.handler.RequestHandler;
import alpha.framedhttp.message.Responses;
import alpha.framedhttp.util.BodyReaders;

import java.io.IOException;
import java.net.InetSocketAddress;

import static alpha.framedhttp.HttpConstants.HeaderName.SERVER;
import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * Responds "hello world." to all requests, except for requests to "/echo"
 * which get their own body echoed back.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class HelloWorld
{
    /** The value of the "Server" header in all responses. */
    public static final String SERVER_NAME = "my_first_http_server";
    
    private static final int PORT = 1234;
    
    /**
     * Returns the request handler of this example.
     * 
     * @return a request handler
     */
    public static RequestHandler handler() {
        return (req, body) -> {
            // The request body is given back as-is. The server writes it with
            // Content-Length if the client sent one, else chunked.
            var rsp = req.target().equals("/echo") ?
                    Responses.ok(body) :
                    Responses.ok(BodyReaders.ofString("hello world.\n"));
            return completedStage(rsp.withHeader(SERVER, SERVER_NAME));
        };
    }
    
    /**
     * Application entry point.
     *
     * @param args ignored
     *
     * @throws IOException If an I/O error occurs
     */
    public static void main(String... args) throws IOException {
        HttpServer app = HttpServer.create(handler());
        app.start(new InetSocketAddress("127.0.0.1", PORT));
        System.out.println("Listening on port " + app.getPort() + ".");
    }
}
