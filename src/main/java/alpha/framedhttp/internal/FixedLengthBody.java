package alpha.framedhttp.internal;

import alpha.framedhttp.message.BodyReader;
import alpha.framedhttp.message.UnexpectedEndOfStreamException;

import java.nio.ByteBuffer;
import java.util.concurrent.CompletionStage;

import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * A request body of known length.<p>
 * 
 * Bytes already buffered are served first. The body never consumes more than
 * its length from the connection; whatever follows belongs to the next
 * request.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class FixedLengthBody implements BodyReader
{
    private final ChannelReader in;
    private final long length;
    private long remaining;
    
    FixedLengthBody(ChannelReader in, long length) {
        if (length < 0) {
            throw new IllegalArgumentException("Negative length: " + length);
        }
        this.in = in;
        this.length = length;
        this.remaining = length;
    }
    
    @Override
    public long length() {
        return remaining;
    }
    
    @Override
    public CompletionStage<ByteBuffer> read() {
        if (remaining == 0) {
            return completedStage(SequentialStream.EOS);
        }
        if (!in.buffer().isEmpty()) {
            return completedStage(take());
        }
        return in.fill().thenApply(more -> {
            if (!more) {
                throw new UnexpectedEndOfStreamException(
                        "Unexpected EOF, " + (length - remaining) + " of " +
                        length + " body byte(s) received.");
            }
            return take();
        });
    }
    
    private ByteBuffer take() {
        var buf = in.buffer();
        final int n = (int) Math.min(buf.length(), remaining);
        remaining -= n;
        return buf.take(n);
    }
}
