package alpha.framedhttp;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;

/**
 * Listens on an address for client connections.<p>
 * 
 * Each accepted connection is driven by a protocol-specific state machine
 * until either side closes it. See {@link HttpServer} and {@link
 * LineServer}.
 * 
 * <h2>Server Life-Cycle</h2>
 * 
 * A server is started once. When it is stopped, the listening channel and
 * all client connections are closed. A stopped server can not be started
 * again.<p>
 * 
 * Each server owns a pool of non-daemon threads for as long as it is running.
 * For the application process to end, all server instances must {@link
 * #stop()}.
 * 
 * <h2>Threading Model</h2>
 * 
 * The server instance is thread-safe.<p>
 * 
 * The server's threads handle I/O completion events and execute the
 * application-provided handler. It is absolutely crucial that the handler does
 * not block a server thread, for example by synchronously waiting on an I/O
 * result. Long-lived work should execute somewhere else and be completed
 * through the stage returned by the handler.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Server
{
    /**
     * Makes the server listen for new connections on a system-picked port on
     * the loopback address (IPv4 127.0.0.1, IPv6 ::1).<p>
     * 
     * This method is useful for inter-process communication or to start a
     * server in a test environment.
     * 
     * @implSpec
     * The default implementation is equivalent to:
     * <pre>{@code
     *     InetAddress addr = InetAddress.getLoopbackAddress();
     *     int port = 0;
     *     SocketAddress local = new InetSocketAddress(addr, port);
     *     start(local);
     * }</pre>
     * 
     * @throws IllegalStateException if the server has already been started
     * @throws IOException if an I/O error occurs
     * 
     * @see InetAddress
     */
    default void start() throws IOException {
        start(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
    }
    
    /**
     * Makes the server listen for new connections on a specified port on the
     * wildcard address ("any local address").
     * 
     * @implSpec
     * The default implementation is equivalent to:
     * <pre>{@code
     *     start(new InetSocketAddress(port));
     * }</pre>
     * 
     * @param port to use
     * 
     * @throws IllegalArgumentException if the port is outside the range of
     *         valid port values
     * @throws IllegalStateException if the server has already been started
     * @throws IOException if an I/O error occurs
     */
    default void start(int port) throws IOException {
        start(new InetSocketAddress(port));
    }
    
    /**
     * Makes the server listen for new connections on the specified address.<p>
     * 
     * The port may be 0, in which case the system picks one. The port actually
     * used is returned by {@link #getPort()}.<p>
     * 
     * Passing in {@code null} is the same as calling {@link #start()}.
     * 
     * @param address to use (may be {@code null})
     * 
     * @throws IllegalStateException if the server has already been started
     * @throws IOException if an I/O error occurs
     */
    void start(SocketAddress address) throws IOException;
    
    /**
     * Stops the server.<p>
     * 
     * The listening channel closes, all client connections close, and the
     * server's thread pool terminates. This method blocks until the threads
     * have terminated, and so it must not be called from a handler.<p>
     * 
     * NOP if the server is not running.
     * 
     * @throws IOException if an I/O error occurs
     * @throws InterruptedException if interrupted while waiting for the
     *         threads to terminate
     */
    void stop() throws IOException, InterruptedException;
    
    /**
     * Returns {@code true} if the server is listening for new connections.
     * 
     * @return see JavaDoc
     */
    boolean isRunning();
    
    /**
     * Returns the socket address that the server is listening on.
     * 
     * @return the local address
     * 
     * @throws IllegalStateException if the server is not running
     * @throws IOException if an I/O error occurs
     */
    SocketAddress getLocalAddress() throws IOException;
    
    /**
     * Returns the port that the server is listening on.
     * 
     * @implSpec
     * The default implementation is equivalent to:
     * <pre>{@code
     *     return ((InetSocketAddress) getLocalAddress()).getPort();
     * }</pre>
     * 
     * @return the port
     * 
     * @throws IllegalStateException if the server is not running
     * @throws IOException if an I/O error occurs
     */
    default int getPort() throws IOException {
        return ((InetSocketAddress) getLocalAddress()).getPort();
    }
    
    /**
     * {@return the server's configuration}
     */
    Config getConfig();
}
