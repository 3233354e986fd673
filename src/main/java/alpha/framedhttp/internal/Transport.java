package alpha.framedhttp.internal;

import java.nio.ByteBuffer;

/**
 * An event-driven, bidirectional byte transport.<p>
 * 
 * Received bytes are pushed to the {@link Listener} for as long as the
 * transport is resumed. A new transport is paused, and the transport is also
 * paused by the listener (or its owner) whenever it does not want more data.
 * Pausing stops the delivery of further data events; a read already in flight
 * may complete, but its data is held back until the transport is resumed
 * again.<p>
 * 
 * The buffer passed to {@link Listener#onData(ByteBuffer)} remains valid only
 * until the transport is resumed.<p>
 * 
 * Writes are initiated one at a time. The callback given to {@link
 * #write(ByteBuffer, WhenDone)} executes exactly once, after all bytes have
 * been written or the write failed.<p>
 * 
 * Closing the transport fails the read in flight, if there is one, causing
 * {@link Listener#onError(Throwable)} to be called.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
interface Transport
{
    /**
     * Receiver of transport events.<p>
     * 
     * Callbacks may execute on any thread, but never concurrently.
     */
    interface Listener {
        /**
         * Called when bytes were received.
         * 
         * @param data received (never empty)
         */
        void onData(ByteBuffer data);
        
        /**
         * Called once when the peer has shut down its output.
         */
        void onEnd();
        
        /**
         * Called when a read failed. No more events follow.
         * 
         * @param t the failure
         */
        void onError(Throwable t);
    }
    
    /**
     * Write completion callback.
     */
    @FunctionalInterface
    interface WhenDone {
        /**
         * Called when the write completed.
         * 
         * @param exc only non-null if there was a problem
         */
        void accept(Throwable exc);
    }
    
    /**
     * Registers the receiver of events.<p>
     * 
     * Must be called once, before the transport is resumed.
     * 
     * @param listener of events
     * @throws IllegalStateException if a listener is already registered
     */
    void listen(Listener listener);
    
    /**
     * Stops the delivery of data events.
     */
    void pause();
    
    /**
     * Resumes the delivery of data events.
     */
    void resume();
    
    /**
     * Writes all remaining bytes of the given buffer.
     * 
     * @param data to write
     * @param whenDone executes exactly once
     */
    void write(ByteBuffer data, WhenDone whenDone);
    
    /**
     * Returns {@code true} if the transport has not been closed.
     * 
     * @return see JavaDoc
     */
    boolean isOpen();
    
    /**
     * Closes the transport.<p>
     * 
     * NOP if already closed.
     */
    void close();
}
