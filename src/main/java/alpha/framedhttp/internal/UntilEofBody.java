package alpha.framedhttp.internal;

import alpha.framedhttp.message.BodyReader;

import java.nio.ByteBuffer;
import java.util.concurrent.CompletionStage;

import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * A request body that ends when the client shuts down its output stream.<p>
 * 
 * No request can follow this body on the same connection.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class UntilEofBody implements BodyReader
{
    private final ChannelReader in;
    private boolean done;
    
    UntilEofBody(ChannelReader in) {
        this.in = in;
    }
    
    @Override
    public long length() {
        return done ? 0 : -1;
    }
    
    @Override
    public CompletionStage<ByteBuffer> read() {
        var buf = in.buffer();
        if (!buf.isEmpty()) {
            return completedStage(buf.take(buf.length()));
        }
        if (done) {
            return completedStage(SequentialStream.EOS);
        }
        return in.fill().thenApply(more -> {
            if (!more) {
                done = true;
                return SequentialStream.EOS;
            }
            return buf.take(buf.length());
        });
    }
}
