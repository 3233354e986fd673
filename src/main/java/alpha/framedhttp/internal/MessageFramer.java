package alpha.framedhttp.internal;

import java.util.Optional;

/**
 * Cuts one complete message from the front of a buffer.<p>
 * 
 * A framer never reads from the stream. It only inspects the buffered bytes
 * and, if a complete message is present, consumes the message from the buffer
 * and returns it. Otherwise the buffer is left untouched and more data is
 * needed. Calling {@code tryCut} twice on an unchanged buffer yields the same
 * result.
 * 
 * @param <M> type of message
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
interface MessageFramer<M>
{
    /**
     * Attempts to cut a message.
     * 
     * @param buf of unread bytes
     * @return the message, or empty if more data is needed
     * @throws RuntimeException if the buffered bytes can never form a valid
     *         message (for example, a protocol error with a response)
     */
    Optional<M> tryCut(ByteBuf buf);
}
