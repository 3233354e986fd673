package alpha.framedhttp.internal;

import alpha.framedhttp.handler.LineHandler;
import alpha.framedhttp.message.UnexpectedEndOfStreamException;
import alpha.framedhttp.util.AsyncLoop;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletionStage;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * Drives a line-delimited text protocol over one connection.<p>
 * 
 * Each line received (terminated by LF) is given to the {@link LineHandler}
 * and the handler's reply is written back, one line at a time. The line
 * {@code "quit\n"} is answered with {@code "Bye\n"}, after which the connection
 * closes. The connection also closes when the client closes its output stream;
 * an incomplete last line is dropped.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class LineConnection
{
    private static final System.Logger LOG
            = System.getLogger(LineConnection.class.getPackageName());
    
    private static final ByteBuffer
            QUIT = ByteBuffer.wrap("quit\n".getBytes(US_ASCII)).asReadOnlyBuffer(),
            BYE  = ByteBuffer.wrap("Bye\n".getBytes(US_ASCII)).asReadOnlyBuffer();
    
    private final SequentialStream stream;
    private final LineHandler handler;
    private final MessageReader<ByteBuffer> lines;
    
    LineConnection(SequentialStream stream, LineHandler handler) {
        this.stream  = requireNonNull(stream);
        this.handler = requireNonNull(handler);
        this.lines   = new MessageReader<>(new ChannelReader(stream), new LineFramer());
    }
    
    /**
     * Runs the protocol until the connection closes.<p>
     * 
     * The returned stage never completes exceptionally. When it completes, the
     * stream has been closed.
     * 
     * @return a stage that completes when the connection is done
     */
    CompletionStage<Void> run() {
        return AsyncLoop.repeat(this::exchange)
                .exceptionally(thr -> {
                    onError(AsyncLoop.unwrap(thr));
                    return null;
                })
                .whenComplete((nil, thr) -> stream.close());
    }
    
    private CompletionStage<Boolean> exchange() {
        return lines.next().thenCompose(line -> {
            if (line.isEmpty()) {
                LOG.log(DEBUG, "Client closed the connection.");
                return completedStage(false);
            }
            final ByteBuffer msg = line.get();
            if (msg.equals(QUIT)) {
                LOG.log(DEBUG, "Client quit.");
                return stream.write(BYE.duplicate()).thenApply(nil -> false);
            }
            return requireNonNull(handler.handle(msg), "Handler returned null.")
                    .thenCompose(reply -> stream.write(
                            requireNonNull(reply, "Handler returned a null reply.")))
                    .thenApply(nil -> true);
        });
    }
    
    private static void onError(Throwable exc) {
        if (exc instanceof UnexpectedEndOfStreamException) {
            LOG.log(DEBUG, () -> "Dropped incomplete line: " + exc.getMessage());
        } else if (exc instanceof IOException) {
            LOG.log(DEBUG, () -> "Channel failed (closing connection).", exc);
        } else {
            LOG.log(ERROR, () -> "Line exchange failed (closing connection).", exc);
        }
    }
}
