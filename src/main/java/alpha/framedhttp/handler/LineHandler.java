package alpha.framedhttp.handler;

import java.nio.ByteBuffer;
import java.util.concurrent.CompletionStage;

/**
 * Produces a reply for a line received on a line-delimited text connection.<p>
 * 
 * The message given includes its terminating LF. The handler is never called
 * with the message "quit\n"; that message is answered by the server itself
 * with "Bye\n", after which the connection closes.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface LineHandler
{
    /**
     * Handles one line.
     * 
     * @param message the line, including the LF
     * 
     * @return the bytes to write back (may be empty, never {@code null})
     */
    CompletionStage<ByteBuffer> handle(ByteBuffer message);
}
