package alpha.framedhttp.internal;

import alpha.framedhttp.message.MaxRequestHeadSizeException;
import alpha.framedhttp.message.Request;

import java.util.Optional;

/**
 * Cuts the head of an HTTP request (request line and headers) terminated by an
 * empty line.<p>
 * 
 * The head may not be larger than the configured max. If no terminator is
 * found and the buffer has reached the max, or the terminator is found beyond
 * the max, a {@link MaxRequestHeadSizeException} is thrown. The parsed head is
 * returned as a {@link Request}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RequestHeadFramer implements MessageFramer<Request>
{
    private static final byte[] END_OF_HEAD = {'\r', '\n', '\r', '\n'};
    
    private final int maxHeadSize;
    
    RequestHeadFramer(int maxHeadSize) {
        this.maxHeadSize = maxHeadSize;
    }
    
    @Override
    public Optional<Request> tryCut(ByteBuf buf) {
        final int i = buf.indexOf(END_OF_HEAD);
        if (i < 0) {
            if (buf.length() >= maxHeadSize) {
                throw new MaxRequestHeadSizeException(maxHeadSize);
            }
            return Optional.empty();
        }
        if (i + END_OF_HEAD.length > maxHeadSize) {
            throw new MaxRequestHeadSizeException(maxHeadSize);
        }
        byte[] head = buf.copyOf(i);
        buf.consume(i + END_OF_HEAD.length);
        return Optional.of(RequestParser.parse(head));
    }
}
