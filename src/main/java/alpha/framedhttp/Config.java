package alpha.framedhttp;

import alpha.framedhttp.message.DecoderException;
import alpha.framedhttp.message.MaxRequestHeadSizeException;

import java.time.Duration;

/**
 * Server configuration.<p>
 * 
 * {@link Config#toBuilder()} allows for any configuration object to be used as
 * a template for a new instance. The static method {@link #configuration()} is
 * a shortcut for {@code Config.DEFAULT.toBuilder()}:
 * 
 * <pre>
 *   HttpServer.create(configuration()
 *             .maxRequestHeadSize(16_384)
 *             .build(), handler);
 * </pre>
 * 
 * The implementation is immutable.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Config
{
    /**
     * Values used by {@link HttpServer#create(alpha.framedhttp.handler.RequestHandler)}
     * and {@link LineServer#create(alpha.framedhttp.handler.LineHandler)}.<p>
     * 
     * This instance contains the following values:<p>
     * 
     * Max request head size = 8 192<br>
     * Read buffer size = 16 384<br>
     * Max chunk-size line length = 1 024<br>
     * Timeout read = 90 seconds<br>
     * Timeout write = 90 seconds
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();
    
    /**
     * Returns the max number of bytes of a request head, including the empty
     * line terminating it.<p>
     * 
     * A buffer of this many bytes, not containing the end of the head, fails
     * with a {@link MaxRequestHeadSizeException} (413 Payload Too Large).
     * 
     * @return the max number of request head bytes
     */
    int maxRequestHeadSize();
    
    /**
     * Returns the size of the buffer used for each read operation on a client
     * channel.<p>
     * 
     * At most this many bytes are read ahead of what the connection has asked
     * for.
     * 
     * @return bytes per channel read
     */
    int readBufferSize();
    
    /**
     * Returns the max length of a chunk-size line, or a trailer line, of a
     * chunked request body, including the line terminator.<p>
     * 
     * A longer line fails with a {@link DecoderException}.
     * 
     * @return max length of a chunk-size line
     */
    int maxChunkSizeLineLength();
    
    /**
     * Returns the max duration of one channel read operation.<p>
     * 
     * A read is only in flight while the connection waits for more bytes from
     * the client, so this is also how long an idle connection is kept open.
     * A read that takes longer fails with an {@code
     * InterruptedByTimeoutException} and the connection is closed.
     * 
     * @return the read timeout
     */
    Duration timeoutRead();
    
    /**
     * Returns the max duration of one channel write operation.<p>
     * 
     * A write that takes longer fails with an {@code
     * InterruptedByTimeoutException} and the connection is closed.
     * 
     * @return the write timeout
     */
    Duration timeoutWrite();
    
    /**
     * Returns the builder instance that built this configuration.<p>
     * 
     * The builder may be used for further modifications of the configuration.
     * 
     * @return the builder instance that built this configuration
     */
    Config.Builder toBuilder();
    
    /**
     * {@return the builder used to build the default configuration}
     */
    static Config.Builder configuration() {
        return DEFAULT.toBuilder();
    }
    
    /**
     * Builder of a {@link Config}.<p>
     * 
     * The builder is immutable. All setter methods return a new builder
     * instance.
     * 
     * @author Martin Andersson (webmaster at martinandersson.com)
     */
    interface Builder {
        /**
         * Set a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws IllegalArgumentException if {@code newVal} is less than 1
         * @see Config#maxRequestHeadSize()
         */
        Builder maxRequestHeadSize(int newVal);
        
        /**
         * Set a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws IllegalArgumentException if {@code newVal} is less than 1
         * @see Config#readBufferSize()
         */
        Builder readBufferSize(int newVal);
        
        /**
         * Set a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws IllegalArgumentException if {@code newVal} is less than 3
         * @see Config#maxChunkSizeLineLength()
         */
        Builder maxChunkSizeLineLength(int newVal);
        
        /**
         * Set a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#timeoutRead()
         */
        Builder timeoutRead(Duration newVal);
        
        /**
         * Set a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#timeoutWrite()
         */
        Builder timeoutWrite(Duration newVal);
        
        /**
         * Builds the configuration.
         * 
         * @return a configuration
         */
        Config build();
    }
}
