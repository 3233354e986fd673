package alpha.framedhttp.internal;

import alpha.framedhttp.message.BodyReader;
import alpha.framedhttp.message.DecoderException;
import alpha.framedhttp.message.UnexpectedEndOfStreamException;
import alpha.framedhttp.util.AsyncLoop;

import java.nio.ByteBuffer;
import java.util.HexFormat;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static alpha.framedhttp.message.Char.toDebugString;
import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * A request body in HTTP/1.1 chunked encoding.<p>
 * 
 * Each read yields decoded data, never chunk-size lines or CRLF. The body ends
 * with the last chunk (size zero), followed by trailer fields, if any, and an
 * empty line. Trailers are consumed and discarded. So are chunk extensions.<p>
 * 
 * Lines must be terminated by CRLF, and a line, including CRLF, may not be
 * longer than the configured max. Nothing after the empty line ending the
 * body is consumed.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7230#section-4.1">RFC 7230 §4.1</a>
 */
final class ChunkedBody implements BodyReader
{
    private static final byte[] CRLF = {'\r', '\n'};
    
    private static final int
            CHUNK_SIZE = 0, CHUNK_DATA = 1, CHUNK_END = 2, TRAILER = 3, DONE = 4;
    
    private final ChannelReader in;
    private final int maxLineLength;
    
    private int parsing = CHUNK_SIZE;
    // Bytes of current data chunk left to consume
    private long remaining;
    
    ChunkedBody(ChannelReader in, int maxLineLength) {
        this.in = in;
        this.maxLineLength = maxLineLength;
    }
    
    @Override
    public long length() {
        return parsing == DONE ? 0 : -1;
    }
    
    @Override
    public CompletionStage<ByteBuffer> read() {
        var result = new CompletableFuture<ByteBuffer>();
        AsyncLoop.repeat(() -> {
            ByteBuffer data = decode();
            if (data != null) {
                result.complete(data);
                return completedStage(false);
            }
            return in.fill().thenApply(more -> {
                if (!more) {
                    throw new UnexpectedEndOfStreamException(
                            "Unexpected EOF, chunked body is not complete.");
                }
                return true;
            });
        }).whenComplete((nil, thr) -> {
            if (thr != null) {
                result.completeExceptionally(thr);
            }
        });
        return result;
    }
    
    /**
     * Decodes as much as possible.
     * 
     * @return data, empty if done, or {@code null} if more bytes are needed
     */
    private ByteBuffer decode() {
        final ByteBuf buf = in.buffer();
        for (;;) {
            switch (parsing) {
                case CHUNK_SIZE -> {
                    String line = tryLine(buf);
                    if (line == null) {
                        return null;
                    }
                    remaining = parseSize(line);
                    parsing = remaining > 0 ? CHUNK_DATA : TRAILER;
                }
                case CHUNK_DATA -> {
                    if (buf.isEmpty()) {
                        return null;
                    }
                    final int n = (int) Math.min(buf.length(), remaining);
                    remaining -= n;
                    if (remaining == 0) {
                        parsing = CHUNK_END;
                    }
                    return buf.take(n);
                }
                case CHUNK_END -> {
                    if (buf.length() < 2) {
                        return null;
                    }
                    if (buf.get(0) != '\r' || buf.get(1) != '\n') {
                        throw new DecoderException(
                                "Expected CRLF after chunk. Received " +
                                toDebugString((char) buf.get(0)) + ".");
                    }
                    buf.consume(2);
                    parsing = CHUNK_SIZE;
                }
                case TRAILER -> {
                    String line = tryLine(buf);
                    if (line == null) {
                        return null;
                    }
                    if (line.isEmpty()) {
                        parsing = DONE;
                    }
                    // else discard
                }
                case DONE -> {
                    return SequentialStream.EOS;
                }
                default -> throw new AssertionError();
            }
        }
    }
    
    private String tryLine(ByteBuf buf) {
        final int i = buf.indexOf(CRLF);
        if (i < 0) {
            if (buf.length() >= maxLineLength) {
                throw new DecoderException(
                        "Line exceeds max length of " + maxLineLength + " bytes.");
            }
            return null;
        }
        if (i + CRLF.length > maxLineLength) {
            throw new DecoderException(
                    "Line exceeds max length of " + maxLineLength + " bytes.");
        }
        String line = new String(buf.copyOf(i), US_ASCII);
        buf.consume(i + CRLF.length);
        return line;
    }
    
    private static long parseSize(String line) {
        // Extensions discarded
        final int semi = line.indexOf(';');
        String hex = (semi < 0 ? line : line.substring(0, semi)).strip();
        if (hex.isEmpty()) {
            throw new DecoderException("No chunk-size specified.");
        }
        final long v;
        try {
            v = HexFormat.fromHexDigitsToLong(hex);
        } catch (IllegalArgumentException e) {
            throw new DecoderException("Invalid chunk-size: \"" + hex + "\".", e);
        }
        if (v < 0) {
            throw new DecoderException("Long overflow for chunk-size \"" + hex + "\".");
        }
        return v;
    }
}
