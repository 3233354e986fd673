package alpha.framedhttp.internal;

import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;
import static java.util.concurrent.CompletableFuture.failedStage;

/**
 * Adapts an event-driven {@link Transport} into a strictly sequential
 * read-next/write-and-wait stream.<p>
 * 
 * The transport is resumed only while a read is outstanding, and paused again
 * as soon as data arrives. Consequently, nothing is read ahead of what the
 * consumer asked for except for what fits in one transport read.<p>
 * 
 * A read completes with the next chunk of bytes, or an empty buffer ({@link
 * #EOS}) if the peer has shut down its output. End-of-stream is not an error.
 * A transport error observed while a read is outstanding fails the read. An
 * error observed while no read is outstanding is remembered and fails the next
 * read or write.<p>
 * 
 * At most one read and one write may be outstanding. The stream throws an
 * {@link IllegalStateException} if this contract is broken.<p>
 * 
 * This class is thread-safe.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class SequentialStream implements Transport.Listener
{
    private static final System.Logger LOG
            = System.getLogger(SequentialStream.class.getPackageName());
    
    /** Completes a read when the stream has reached its end. */
    static final ByteBuffer EOS = ByteBuffer.allocate(0).asReadOnlyBuffer();
    
    /**
     * Creates a stream which takes ownership of the given transport.
     * 
     * @param transport to adapt
     * @return a new stream
     */
    static SequentialStream of(Transport transport) {
        var s = new SequentialStream(transport);
        transport.listen(s);
        return s;
    }
    
    private final Transport transport;
    
    // All guarded by this
    private CompletableFuture<ByteBuffer> reader;
    private CompletableFuture<Void> writer;
    private Throwable error;
    private boolean ended, closed;
    
    private SequentialStream(Transport transport) {
        this.transport = requireNonNull(transport);
    }
    
    /**
     * Reads the next chunk.
     * 
     * @return the next chunk, empty only on end-of-stream
     * @throws IllegalStateException if a read is already outstanding
     */
    CompletionStage<ByteBuffer> read() {
        final CompletableFuture<ByteBuffer> r;
        synchronized (this) {
            if (reader != null) {
                throw new IllegalStateException("A read is already outstanding.");
            }
            if (closed) {
                return failedStage(new ClosedChannelException());
            }
            if (error != null) {
                return failedStage(error);
            }
            if (ended) {
                return completedStage(EOS);
            }
            r = reader = new CompletableFuture<>();
        }
        transport.resume();
        return r;
    }
    
    /**
     * Writes all remaining bytes of the given buffer.
     * 
     * @param data to write
     * @return a stage that completes when all bytes have been written
     * @throws IllegalStateException if a write is already outstanding
     */
    CompletionStage<Void> write(ByteBuffer data) {
        requireNonNull(data);
        final CompletableFuture<Void> w;
        synchronized (this) {
            if (writer != null) {
                throw new IllegalStateException("A write is already outstanding.");
            }
            if (closed) {
                return failedStage(new ClosedChannelException());
            }
            if (error != null) {
                return failedStage(error);
            }
            w = writer = new CompletableFuture<>();
        }
        transport.write(data, exc -> {
            synchronized (this) {
                writer = null;
                if (exc != null && error == null) {
                    error = exc;
                }
            }
            if (exc == null) {
                w.complete(null);
            } else {
                w.completeExceptionally(exc);
            }
        });
        return w;
    }
    
    /**
     * Returns {@code true} if the stream is open and has not observed an
     * error.
     * 
     * @return see JavaDoc
     */
    synchronized boolean isWritable() {
        return !closed && error == null && transport.isOpen();
    }
    
    /**
     * Returns {@code true} if the stream has not been closed.
     * 
     * @return see JavaDoc
     */
    synchronized boolean isOpen() {
        return !closed;
    }
    
    /**
     * Closes the stream and its transport.<p>
     * 
     * An outstanding read or write fails. NOP if already closed.
     */
    void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        transport.close();
        // The transport is expected to fail an in-flight read, but
        // whatever it did, the stream must not hang
        final CompletableFuture<ByteBuffer> r;
        final CompletableFuture<Void> w;
        synchronized (this) {
            r = reader;
            w = writer;
            reader = null;
        }
        if (r != null) {
            r.completeExceptionally(new ClosedChannelException());
        }
        if (w != null) {
            w.completeExceptionally(new ClosedChannelException());
        }
    }
    
    @Override
    public void onData(ByteBuffer data) {
        transport.pause();
        final CompletableFuture<ByteBuffer> r;
        synchronized (this) {
            r = reader;
            reader = null;
        }
        if (r == null) {
            throw new IllegalStateException(
                    "Received " + data.remaining() + " bytes with no read outstanding.");
        }
        r.complete(data);
    }
    
    @Override
    public void onEnd() {
        final CompletableFuture<ByteBuffer> r;
        synchronized (this) {
            ended = true;
            r = reader;
            reader = null;
        }
        if (r != null) {
            r.complete(EOS);
        }
    }
    
    @Override
    public void onError(Throwable t) {
        final CompletableFuture<ByteBuffer> r;
        synchronized (this) {
            if (error == null) {
                error = t;
            }
            r = reader;
            reader = null;
        }
        if (r != null) {
            r.completeExceptionally(t);
        } else {
            LOG.log(DEBUG, () -> "Transport error observed with no read outstanding: " + t);
        }
    }
    
    @Override
    public String toString() {
        return SequentialStream.class.getSimpleName() + "{transport=" + transport + '}';
    }
}
