package alpha.framedhttp.util;

import alpha.framedhttp.message.BodyReader;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.util.concurrent.CompletionStage;

import static java.nio.ByteBuffer.allocate;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * Factories of in-memory {@link BodyReader}s, and utilities to consume
 * bodies.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class BodyReaders
{
    private BodyReaders() {
        // Empty
    }
    
    private static final ByteBuffer EMPTY = allocate(0).asReadOnlyBuffer();
    
    /**
     * Returns an empty body.<p>
     * 
     * The returned body is stateless and may be shared.
     * 
     * @return an empty body
     */
    public static BodyReader empty() {
        return Empty.INSTANCE;
    }
    
    /**
     * Returns a body of the given bytes.<p>
     * 
     * The array is not copied and must not be modified afterwards. The first
     * read yields all of it, the next an empty buffer.
     * 
     * @param bytes of body
     * @return a body of known length
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    public static BodyReader ofBytes(byte[] bytes) {
        return bytes.length == 0 ? empty() : new InMemory(bytes);
    }
    
    /**
     * Returns a body of the UTF-8 encoded string.
     * 
     * @param str of body
     * @return a body of known length
     * @throws NullPointerException if {@code str} is {@code null}
     */
    public static BodyReader ofString(String str) {
        return ofBytes(str.getBytes(UTF_8));
    }
    
    /**
     * Reads and discards all remaining bytes of the given body.
     * 
     * @param body to drain
     * @return the number of bytes discarded
     * @throws NullPointerException if {@code body} is {@code null}
     */
    public static CompletionStage<Long> drain(BodyReader body) {
        requireNonNull(body);
        long[] count = {0};
        return AsyncLoop.repeat(() -> body.read().thenApply(buf -> {
                    final int n = buf.remaining();
                    buf.position(buf.limit());
                    count[0] += n;
                    return n > 0;
                }))
                .thenApply(nil -> count[0]);
    }
    
    /**
     * Reads all remaining bytes of the given body into an array.
     * 
     * @param body to read
     * @return all bytes
     * @throws NullPointerException if {@code body} is {@code null}
     */
    public static CompletionStage<byte[]> toBytes(BodyReader body) {
        requireNonNull(body);
        var sink = new ByteArrayOutputStream();
        return AsyncLoop.repeat(() -> body.read().thenApply(buf -> {
                    if (!buf.hasRemaining()) {
                        return false;
                    }
                    if (buf.hasArray()) {
                        sink.write(buf.array(),
                                buf.arrayOffset() + buf.position(), buf.remaining());
                        buf.position(buf.limit());
                    } else {
                        byte[] cpy = new byte[buf.remaining()];
                        buf.get(cpy);
                        sink.writeBytes(cpy);
                    }
                    return true;
                }))
                .thenApply(nil -> sink.toByteArray());
    }
    
    /**
     * Reads all remaining bytes of the given body and decodes them.
     * 
     * @param body to read
     * @param charset for decoding
     * @return the body as a string
     */
    public static CompletionStage<String> toString(BodyReader body, Charset charset) {
        requireNonNull(charset);
        return toBytes(body).thenApply(b -> new String(b, charset));
    }
    
    private enum Empty implements BodyReader {
        INSTANCE;
        
        @Override
        public long length() {
            return 0;
        }
        
        @Override
        public CompletionStage<ByteBuffer> read() {
            return completedStage(EMPTY);
        }
    }
    
    private static final class InMemory implements BodyReader {
        private ByteBuffer data;
        
        InMemory(byte[] bytes) {
            data = ByteBuffer.wrap(bytes);
        }
        
        @Override
        public long length() {
            return data.remaining();
        }
        
        @Override
        public CompletionStage<ByteBuffer> read() {
            final ByteBuffer b = data;
            data = EMPTY;
            return completedStage(b);
        }
    }
}
