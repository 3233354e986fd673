package alpha.framedhttp.examples;

import alpha.framedhttp.LineServer;
import alpha.framedhttp.handler.LineHandler;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;

import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * Echoes each line received, prefixed with "Echo: ". Sending "quit" closes the
 * connection.<p>
 * 
 * Try it out with netcat:
 * <pre>
 *   $ nc 127.0.0.1 1234
 *   hello
 *   Echo: hello
 *   quit
 *   Bye
 * </pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class LineEcho
{
    private static final int PORT = 1234;
    
    private static final byte[] PREFIX = {'E', 'c', 'h', 'o', ':', ' '};
    
    /**
     * Returns the line handler of this example.
     * 
     * @return a line handler
     */
    public static LineHandler handler() {
        return msg -> {
            var reply = ByteBuffer.allocate(PREFIX.length + msg.remaining());
            reply.put(PREFIX).put(msg).flip();
            return completedStage(reply);
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
        LineServer app = LineServer.create(handler());
        app.start(new InetSocketAddress("127.0.0.1", PORT));
        System.out.println("Listening on port " + app.getPort() + ".");
    }
}
