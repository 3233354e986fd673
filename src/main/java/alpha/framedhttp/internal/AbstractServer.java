package alpha.framedhttp.internal;

import alpha.framedhttp.Config;
import alpha.framedhttp.Server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.channels.AsynchronousChannelGroup;
import java.nio.channels.AsynchronousServerSocketChannel;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.CompletionHandler;
import java.nio.channels.ShutdownChannelGroupException;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;

import static java.lang.Long.MAX_VALUE;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;
import static java.net.InetAddress.getLoopbackAddress;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * A fully asynchronous server on top of {@link
 * AsynchronousServerSocketChannel}.<p>
 * 
 * When the server starts, an asynchronous server channel is opened and bound
 * to the specified address. The server channel is also known as "listener",
 * "master" and "parent".<p>
 * 
 * When the server channel accepts a new client connection, the resulting
 * channel, also known as the "child", is handled by {@link OnAccept}, which
 * wraps the child in a {@link SequentialStream} and passes it to the concrete
 * server's {@link #serve(SequentialStream)}.<p>
 * 
 * Each server has its own channel group with a fixed pool of non-daemon
 * threads, one per available processor.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
abstract class AbstractServer implements Server
{
    private static final System.Logger LOG
            = System.getLogger(AbstractServer.class.getPackageName());
    
    private final Config config;
    private final Set<SequentialStream> children;
    private AsynchronousChannelGroup group;
    private AsynchronousServerSocketChannel listener;
    private boolean started;
    
    AbstractServer(Config config) {
        this.config = requireNonNull(config);
        this.children = ConcurrentHashMap.newKeySet();
    }
    
    /**
     * Runs the protocol over an accepted connection.<p>
     * 
     * The returned stage completes when the connection is done. The stream is
     * closed by the server at that point, if it isn't already.
     * 
     * @param child the connection
     * @return a stage that completes when the connection is done
     */
    abstract CompletionStage<Void> serve(SequentialStream child);
    
    @Override
    public final synchronized void start(SocketAddress address) throws IOException {
        if (started) {
            throw new IllegalStateException("Server has started once before.");
        }
        started = true;
        
        SocketAddress use = address != null ? address :
                new InetSocketAddress(getLoopbackAddress(), 0);
        
        group = AsynchronousChannelGroup.withFixedThreadPool(
                Runtime.getRuntime().availableProcessors(),
                // Non-daemon threads
                Executors.defaultThreadFactory());
        try {
            listener = AsynchronousServerSocketChannel.open(group).bind(use);
        } catch (IOException e) {
            group.shutdownNow();
            throw e;
        }
        LOG.log(INFO, () -> "Opened server channel: " + listener);
        
        listener.accept(null, new OnAccept());
    }
    
    @Override
    public final void stop() throws IOException, InterruptedException {
        final AsynchronousChannelGroup g;
        synchronized (this) {
            if (listener == null || !listener.isOpen()) {
                return;
            }
            g = group;
            try {
                listener.close();
                LOG.log(INFO, () -> "Closed server channel: " + listener);
            } finally {
                children.forEach(SequentialStream::close);
                g.shutdownNow();
            }
        }
        g.awaitTermination(MAX_VALUE, NANOSECONDS);
    }
    
    @Override
    public final synchronized boolean isRunning() {
        return listener != null && listener.isOpen();
    }
    
    @Override
    public final SocketAddress getLocalAddress() throws IOException {
        final AsynchronousServerSocketChannel ch;
        synchronized (this) {
            ch = listener;
        }
        if (ch == null) {
            throw notRunning();
        }
        try {
            var addr = ch.getLocalAddress();
            if (addr == null) {
                throw notRunning();
            }
            return addr;
        } catch (ClosedChannelException e) {
            throw notRunning();
        }
    }
    
    @Override
    public final Config getConfig() {
        return config;
    }
    
    /**
     * {@return the number of open client connections}
     */
    final int openConnections() {
        return children.size();
    }
    
    // Stopping from a group thread would await its own termination
    private synchronized void closeListener() {
        try {
            listener.close();
            LOG.log(INFO, () -> "Closed server channel: " + listener);
        } catch (IOException e) {
            LOG.log(ERROR, "Failed to close server channel.", e);
        }
    }
    
    private static IllegalStateException notRunning() {
        return new IllegalStateException("Server is not running.");
    }
    
    private void acceptNext() {
        final AsynchronousServerSocketChannel ch;
        synchronized (this) {
            ch = listener;
        }
        ch.accept(null, new OnAccept());
    }
    
    /**
     * Handles the completion of a listener accept operation.
     */
    private final class OnAccept implements CompletionHandler<AsynchronousSocketChannel, Void>
    {
        @Override
        public void completed(AsynchronousSocketChannel child, Void noAttachment) {
            LOG.log(INFO, () -> "Accepted child: " + child);
            
            try {
                acceptNext();
            } catch (Throwable t) {
                failed(t, null);
            }
            
            var stream = SequentialStream.of(new ChannelTransport(child, config));
            children.add(stream);
            CompletionStage<Void> done;
            try {
                done = serve(stream);
            } catch (Throwable t) {
                LOG.log(ERROR, "Failed to serve child.", t);
                done = completedStage(null);
            }
            done.whenComplete((nil, thr) -> {
                children.remove(stream);
                stream.close();
                LOG.log(INFO, () -> "Closed child: " + child);
            });
        }
        
        @Override
        public void failed(Throwable t, Void noAttachment) {
            if (t instanceof ClosedChannelException) {
                LOG.log(isRunning() ? WARNING : DEBUG,
                        "Server channel closed. Will accept no more.");
            }
            else if (t instanceof ShutdownChannelGroupException) {
                LOG.log(DEBUG, "Group already closed when initiating a new accept. Will accept no more.");
            }
            else if (t instanceof IOException && t.getCause() instanceof ShutdownChannelGroupException) {
                LOG.log(DEBUG, "Connection accepted and immediately closed, because group is shutting down/was shutdown. Will accept no more.");
            }
            else {
                LOG.log(ERROR, "Unknown failure. Will close the server channel.", t);
                closeListener();
            }
        }
    }
}
