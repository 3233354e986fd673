package alpha.framedhttp.internal;

import alpha.framedhttp.Server;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.System.Logger.Level.WARNING;
import static java.net.InetAddress.getLoopbackAddress;
import static java.nio.ByteBuffer.allocate;
import static java.nio.ByteBuffer.wrap;
import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Abstract class to help facilitate end-to-end testing by using
 * <i>{@code writeReadXXX}</i>-provided methods.<p>
 * 
 * A new server is created and started before each test, and stopped after.
 * The server is bound to an ephemeral port on the loopback address.<p>
 * 
 * Any exchange taking 3 seconds or longer will be interrupted and consequently
 * fail the test.<p>
 * 
 * Note: This class provides low-level access for test cases that needs direct
 * control over what bytes are put on the wire and what is received.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
abstract class AbstractEndToEndTest
{
    private static final System.Logger LOG = System.getLogger(AbstractEndToEndTest.class.getPackageName());
    
    private static ScheduledExecutorService scheduler;
    
    private Server server;
    
    @BeforeAll
    static void startScheduler() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        });
    }
    
    @AfterAll
    static void stopScheduler() throws InterruptedException {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler.awaitTermination(1, SECONDS);
        }
    }
    
    @BeforeEach
    final void startServer() throws IOException {
        server = createServer();
        server.start();
    }
    
    @AfterEach
    final void stopServer() throws IOException, InterruptedException {
        if (server != null) {
            server.stop();
        }
    }
    
    /**
     * Creates the server under test. The server is started by the caller.
     * 
     * @return a new server
     */
    abstract Server createServer();
    
    protected final Server server() {
        return server;
    }
    
    /**
     * Opens a client connection to the server.<p>
     * 
     * The caller must close the channel.
     * 
     * @return a connected client
     * @throws IOException if an I/O error occurs
     */
    protected final SocketChannel openConnection() throws IOException {
        return SocketChannel.open(
                new InetSocketAddress(getLoopbackAddress(), server.getPort()));
    }
    
    /**
     * Writes a request on a new connection and reads the response.
     * 
     * @param request to write
     * @param responseEnd last bytes of the expected response
     * 
     * @return the response
     * 
     * @throws IOException if an I/O error occurs
     * @throws InterruptedException if the exchange timed out
     */
    protected final String writeReadText(String request, String responseEnd)
            throws IOException, InterruptedException
    {
        try (SocketChannel client = openConnection()) {
            return writeReadText(client, request, responseEnd);
        }
    }
    
    /**
     * Writes a request on the given connection and reads the response.
     * 
     * @param client connection
     * @param request to write
     * @param responseEnd last bytes of the expected response
     * 
     * @return the response
     * 
     * @throws IOException if an I/O error occurs
     * @throws InterruptedException if the exchange timed out
     */
    protected final String writeReadText(SocketChannel client, String request, String responseEnd)
            throws IOException, InterruptedException
    {
        byte[] bytes = writeReadBytes(client,
                request.getBytes(US_ASCII),
                responseEnd.getBytes(US_ASCII));
        
        return new String(bytes, US_ASCII);
    }
    
    /**
     * Writes a request on the given connection and reads until the server
     * closes the connection.
     * 
     * @param client connection
     * @param request to write
     * 
     * @return everything received
     * 
     * @throws IOException if an I/O error occurs
     * @throws InterruptedException if the exchange timed out
     */
    protected final String writeReadTextUntilEOS(SocketChannel client, String request)
            throws IOException, InterruptedException
    {
        return new String(writeReadBytes(client, request.getBytes(US_ASCII), null), US_ASCII);
    }
    
    private byte[] writeReadBytes(SocketChannel client, byte[] request, byte[] responseEnd)
            throws IOException, InterruptedException
    {
        final Thread worker = Thread.currentThread();
        final AtomicBoolean communicating = new AtomicBoolean(true);
        
        ScheduledFuture<?> interrupt = scheduler.schedule(() -> {
            if (communicating.get()) {
                LOG.log(WARNING, "Exchange took too long, will timeout.");
                worker.interrupt();
            }
        }, 3, SECONDS);
        
        try {
            ByteBuffer req = wrap(request);
            while (req.hasRemaining()) {
                client.write(req);
            }
            
            FiniteByteBufferSink sink = new FiniteByteBufferSink(128, responseEnd);
            ByteBuffer buff = allocate(128);
            
            while (!worker.isInterrupted() &&
                    !sink.hasReachedEnd()   &&
                    client.read(buff) != -1)
            {
                buff.flip();
                sink.write(buff);
                buff.clear();
            }
            
            if (Thread.interrupted()) { // clear flag
                throw new InterruptedException();
            }
            
            return sink.toByteArray();
        }
        finally {
            communicating.set(false);
            interrupt.cancel(false);
        }
    }
    
    private static class FiniteByteBufferSink {
        private final ByteArrayOutputStream delegate;
        private final byte[] eos;
        private int matched;
        
        /**
         * @param endOfSink bytes that end the sink, or {@code null} for no end
         */
        FiniteByteBufferSink(int initialSize, byte[] endOfSink) {
            delegate = new ByteArrayOutputStream(initialSize);
            eos = endOfSink;
            matched = 0;
        }
        
        void write(ByteBuffer data) {
            if (hasReachedEnd()) {
                throw new IllegalStateException();
            }
            
            int start = data.arrayOffset() + data.position(),
                end   = start + data.remaining();
            
            for (int i = start; i < end; ++i) {
                byte b = data.array()[i];
                delegate.write(b);
                memorize(b);
                
                if (hasReachedEnd()) {
                    assertThat(i + 1 == end)
                            .as("Unexpected trailing bytes in response: " + dump(data.array(), i + 1, end))
                            .isTrue();
                }
            }
        }
        
        private void memorize(byte b) {
            if (eos == null) {
                return;
            }
            if (b == eos[matched]) {
                ++matched;
            } else {
                matched = b == eos[0] ? 1 : 0;
            }
        }
        
        boolean hasReachedEnd() {
            return eos != null && matched == eos.length;
        }
        
        byte[] toByteArray() {
            return delegate.toByteArray();
        }
        
        private static String dump(byte[] bytes, int start, int end) {
            StringBuilder b = new StringBuilder();
            
            for (int i = start; i < end; ++i) {
                b.append(bytes[i]).append(" ");
            }
            
            return b.toString();
        }
    }
}
