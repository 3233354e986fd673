package alpha.framedhttp.internal;

import alpha.framedhttp.message.UnexpectedEndOfStreamException;
import alpha.framedhttp.util.AsyncLoop;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * Reads the next message from a connection.<p>
 * 
 * The framer is asked to cut a message from what has already been buffered.
 * Only if it needs more is the buffer filled with another chunk from the
 * stream, after which the framer is asked again.<p>
 * 
 * If the stream ends with an empty buffer, the connection was closed cleanly
 * and {@link #next()} completes with an empty {@code Optional}. If the stream
 * ends in the middle of a message, the stage completes exceptionally with an
 * {@link UnexpectedEndOfStreamException}.
 * 
 * @param <M> type of message
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class MessageReader<M>
{
    private final ChannelReader in;
    private final MessageFramer<? extends M> framer;
    
    MessageReader(ChannelReader in, MessageFramer<? extends M> framer) {
        this.in = requireNonNull(in);
        this.framer = requireNonNull(framer);
    }
    
    /**
     * Reads the next message.
     * 
     * @return the message, or empty if the stream ended cleanly
     */
    CompletionStage<Optional<M>> next() {
        var result = new CompletableFuture<Optional<M>>();
        AsyncLoop.repeat(() -> {
            Optional<? extends M> msg = framer.tryCut(in.buffer());
            if (msg.isPresent()) {
                result.complete(Optional.of(msg.get()));
                return completedStage(false);
            }
            return in.fill().thenApply(more -> {
                if (more) {
                    return true;
                }
                final int n = in.buffer().length();
                if (n == 0) {
                    result.complete(Optional.empty());
                    return false;
                }
                throw new UnexpectedEndOfStreamException(
                        "Unexpected EOF, " + n + " byte(s) of an incomplete message.");
            });
        }).whenComplete((nil, thr) -> {
            if (thr != null) {
                result.completeExceptionally(thr);
            }
        });
        return result;
    }
}
