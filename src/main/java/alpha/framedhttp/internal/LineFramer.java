package alpha.framedhttp.internal;

import java.nio.ByteBuffer;
import java.util.Optional;

import static alpha.framedhttp.message.Char.LF;

/**
 * Cuts messages terminated by a line feed.<p>
 * 
 * The message includes the line feed.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class LineFramer implements MessageFramer<ByteBuffer>
{
    @Override
    public Optional<ByteBuffer> tryCut(ByteBuf buf) {
        int i = buf.indexOf(LF);
        return i < 0 ? Optional.empty() : Optional.of(buf.take(i + 1));
    }
}
