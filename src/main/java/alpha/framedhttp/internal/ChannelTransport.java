package alpha.framedhttp.internal;

import alpha.framedhttp.Config;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.CompletionHandler;
import java.nio.channels.InterruptedByTimeoutException;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * A {@link Transport} over an {@link AsynchronousSocketChannel}.<p>
 * 
 * One read buffer of {@link Config#readBufferSize()} bytes is allocated per
 * transport and reused for each read operation. At most one read operation is
 * in flight at any given time, and a new one is only initiated while the
 * transport is resumed.<p>
 * 
 * A read times out after {@link Config#timeoutRead()}, in which case the
 * listener is given an {@link InterruptedByTimeoutException} and the transport
 * ends. A write loops until the given buffer has been fully written. Each
 * write operation times out after {@link Config#timeoutWrite()}.<p>
 * 
 * This class is thread-safe. Locks are never held while calling out to the
 * listener.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ChannelTransport implements Transport
{
    private static final System.Logger LOG
            = System.getLogger(ChannelTransport.class.getPackageName());
    
    private final AsynchronousSocketChannel child;
    private final ByteBuffer readBuf;
    private final long readTimeoutNs,
                       writeTimeoutNs;
    private final OnRead onRead;
    
    // All guarded by this
    private Listener listener;
    private boolean paused, reading, ended;
    private ByteBuffer held;
    
    ChannelTransport(AsynchronousSocketChannel child, Config config) {
        this.child          = requireNonNull(child);
        this.readBuf        = ByteBuffer.allocate(config.readBufferSize());
        this.readTimeoutNs  = config.timeoutRead().toNanos();
        this.writeTimeoutNs = config.timeoutWrite().toNanos();
        this.onRead         = new OnRead();
        this.paused         = true;
    }
    
    @Override
    public void listen(Listener listener) {
        requireNonNull(listener);
        synchronized (this) {
            if (this.listener != null) {
                throw new IllegalStateException("Listener already registered.");
            }
            this.listener = listener;
        }
    }
    
    @Override
    public synchronized void pause() {
        paused = true;
    }
    
    @Override
    public void resume() {
        final ByteBuffer deliver;
        synchronized (this) {
            if (listener == null) {
                throw new IllegalStateException("No listener registered.");
            }
            paused = false;
            deliver = held;
            held = null;
        }
        if (deliver != null) {
            listener.onData(deliver);
        }
        tryInitiateRead();
    }
    
    private void tryInitiateRead() {
        synchronized (this) {
            if (paused || reading || ended || held != null || !child.isOpen()) {
                return;
            }
            reading = true;
        }
        readBuf.clear();
        try {
            child.read(readBuf, readTimeoutNs, NANOSECONDS, null, onRead);
        } catch (Throwable t) {
            onRead.failed(t, null);
        }
    }
    
    @Override
    public void write(ByteBuffer data, WhenDone whenDone) {
        requireNonNull(whenDone);
        new OnWrite(data, whenDone).initiate();
    }
    
    @Override
    public boolean isOpen() {
        return child.isOpen();
    }
    
    @Override
    public void close() {
        if (!child.isOpen()) {
            return;
        }
        try {
            child.close();
            LOG.log(DEBUG, () -> "Closed child: " + child);
        } catch (IOException e) {
            LOG.log(ERROR, "Failed to close child channel.", e);
        }
    }
    
    @Override
    public String toString() {
        return ChannelTransport.class.getSimpleName() + "{child=" + child + '}';
    }
    
    private final class OnRead implements CompletionHandler<Integer, Void>
    {
        @Override
        public void completed(Integer result, Void noAttachment) {
            final Listener l;
            final boolean deliver;
            synchronized (ChannelTransport.this) {
                reading = false;
                l = listener;
                if (result == -1) {
                    ended = true;
                    deliver = true;
                } else {
                    readBuf.flip();
                    deliver = !paused;
                    if (!deliver) {
                        held = readBuf;
                    }
                }
            }
            if (result == -1) {
                LOG.log(DEBUG, () -> "End of stream: " + child);
                l.onEnd();
                return;
            }
            if (deliver) {
                l.onData(readBuf);
            }
            tryInitiateRead();
        }
        
        @Override
        public void failed(Throwable exc, Void noAttachment) {
            final Listener l;
            synchronized (ChannelTransport.this) {
                reading = false;
                ended = true;
                l = listener;
            }
            LOG.log(DEBUG, () -> "Read operation failed: " + exc);
            l.onError(exc);
        }
    }
    
    private final class OnWrite implements CompletionHandler<Integer, Void>
    {
        private final ByteBuffer data;
        private final WhenDone whenDone;
        
        OnWrite(ByteBuffer data, WhenDone whenDone) {
            this.data = data;
            this.whenDone = whenDone;
        }
        
        void initiate() {
            try {
                child.write(data, writeTimeoutNs, NANOSECONDS, null, this);
            } catch (Throwable t) {
                failed(t, null);
            }
        }
        
        @Override
        public void completed(Integer result, Void noAttachment) {
            if (data.hasRemaining()) {
                initiate();
            } else {
                whenDone.accept(null);
            }
        }
        
        @Override
        public void failed(Throwable exc, Void noAttachment) {
            LOG.log(DEBUG, () -> "Write operation failed: " + exc);
            whenDone.accept(exc);
        }
    }
}
