package alpha.framedhttp.message;

import alpha.framedhttp.util.BodyReaders;

import java.nio.ByteBuffer;
import java.util.concurrent.CompletionStage;

/**
 * A pull-based reader of message body bytes.<p>
 * 
 * Each {@link #read()} yields the next chunk of the body. The end of the body
 * is signalled by an empty chunk, and all reads thereafter yield an empty chunk
 * too. The reader supports one outstanding read at a time; the next read must
 * not be invoked until the previous stage has completed.<p>
 * 
 * The buffer given to the consumer is owned by the consumer until the next read
 * is invoked. It may be a view of a connection's internal buffer, and so its
 * contents must be consumed or copied before reading again.<p>
 * 
 * A request body is tied to the connection it arrived on. Fixed-length and
 * chunked bodies never read past their end, which is where the next request
 * begins. Whatever the application leaves unread is drained by the server.<p>
 * 
 * For in-memory bodies, see {@link BodyReaders}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface BodyReader
{
    /**
     * Returns the number of bytes remaining to be read.<p>
     *
     * Before the first read, this is the length of the body. The value is
     * known for in-memory bodies and requests with a {@code Content-Length}.
     * For chunked requests, and requests terminated by end-of-stream, the
     * length is unknown and this method returns -1 until the end has been
     * reached.
     *
     * @return remaining bytes, or -1 if unknown
     */
    long length();
    
    /**
     * Reads the next chunk of the body.<p>
     * 
     * The stage completes exceptionally with an {@link
     * UnexpectedEndOfStreamException} if the connection ends before the body
     * does, a {@link DecoderException} if the body is malformed, or an
     * {@code IOException} if the channel failed.
     * 
     * @return the next chunk, empty when there are no more bytes
     */
    CompletionStage<ByteBuffer> read();
}
