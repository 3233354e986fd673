package alpha.framedhttp.internal;

import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * Couples a connection's buffer of unread bytes with its stream.<p>
 * 
 * Message framers and body readers look at what has already been buffered,
 * and {@link #fill()} the buffer with one more chunk only when they need more.
 * Bytes that belong to the next message are never lost; they stay in the
 * buffer.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ChannelReader
{
    private final SequentialStream stream;
    private final ByteBuf buf;
    private boolean eos;
    
    ChannelReader(SequentialStream stream) {
        this.stream = requireNonNull(stream);
        this.buf = new ByteBuf();
    }
    
    /**
     * {@return the buffer of unread bytes}
     */
    ByteBuf buffer() {
        return buf;
    }
    
    /**
     * {@return {@code true} if the stream has reached its end}
     */
    boolean isEndOfStream() {
        return eos;
    }
    
    /**
     * Reads one more chunk from the stream into the buffer.
     * 
     * @return {@code true} if bytes were added, {@code false} on end-of-stream
     */
    CompletionStage<Boolean> fill() {
        if (eos) {
            return completedStage(false);
        }
        return stream.read().thenApply(chunk -> {
            if (!chunk.hasRemaining()) {
                eos = true;
                return false;
            }
            buf.append(chunk);
            return true;
        });
    }
}
