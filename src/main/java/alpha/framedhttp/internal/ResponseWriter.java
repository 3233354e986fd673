package alpha.framedhttp.internal;

import alpha.framedhttp.HttpConstants.Version;
import alpha.framedhttp.message.BodyReader;
import alpha.framedhttp.message.HeaderField;
import alpha.framedhttp.message.IllegalResponseBodyException;
import alpha.framedhttp.message.IllegalResponseHeaderException;
import alpha.framedhttp.message.Response;
import alpha.framedhttp.util.AsyncLoop;
import alpha.framedhttp.util.BodyReaders;

import java.nio.ByteBuffer;
import java.util.concurrent.CompletionStage;

import static alpha.framedhttp.HttpConstants.HeaderName.CONTENT_LENGTH;
import static alpha.framedhttp.HttpConstants.HeaderName.TRANSFER_ENCODING;
import static java.lang.System.Logger.Level.DEBUG;
import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.concurrent.CompletableFuture.completedStage;
import static java.util.concurrent.CompletableFuture.failedStage;

/**
 * Writes responses to a stream.<p>
 * 
 * The status-line always carries version HTTP/1.1. The writer owns the
 * message framing: a body of known length is written with a
 * {@code Content-Length} header, a body of unknown length with
 * {@code Transfer-Encoding: chunked}. Unless the request was HTTP/1.0, in
 * which case a body of unknown length is written as-is and ends when the
 * connection closes.<p>
 * 
 * A response to a HEAD request carries the same framing headers as the
 * response to a GET would, but no body. The body reader is drained instead
 * (RFC 7230 §3.3.2).<p>
 * 
 * The application must not set the framing headers. If it does, the returned
 * stage fails with an {@link IllegalResponseHeaderException} before anything
 * has been written. A body that yields more or fewer bytes than its declared
 * length fails the stage with an {@link IllegalResponseBodyException}, at which
 * point the message on the wire is corrupt and the connection must be closed.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ResponseWriter
{
    private static final System.Logger LOG
            = System.getLogger(ResponseWriter.class.getPackageName());
    
    private static final String CRLF = "\r\n";
    
    private static final ByteBuffer LAST_CHUNK
            = ByteBuffer.wrap("0\r\n\r\n".getBytes(US_ASCII)).asReadOnlyBuffer();
    
    private final SequentialStream out;
    
    ResponseWriter(SequentialStream out) {
        this.out = out;
    }
    
    /**
     * Writes a response, body included.
     * 
     * @param rsp the response
     * @param ver the request's version
     * 
     * @return a stage that completes when the whole response has been written
     */
    CompletionStage<Void> write(Response rsp, Version ver) {
        return write(rsp, ver, false);
    }
    
    /**
     * Writes a response.
     * 
     * @param rsp the response
     * @param ver the request's version
     * @param headOnly {@code true} if the request method was HEAD
     * 
     * @return a stage that completes when the whole response has been written
     */
    CompletionStage<Void> write(Response rsp, Version ver, boolean headOnly) {
        for (HeaderField h : rsp.headers()) {
            if (h.hasName(CONTENT_LENGTH) || h.hasName(TRANSFER_ENCODING)) {
                return failedStage(new IllegalResponseHeaderException(
                        "The " + h.name() + " header is set by the server."));
            }
        }
        final BodyReader body = rsp.body();
        final long len = body.length();
        final Framing framing = len >= 0 ? Framing.LENGTH :
                ver == Version.HTTP_1_0 ? Framing.RAW : Framing.CHUNKED;
        
        var head = new StringBuilder()
                .append("HTTP/1.1 ")
                .append(rsp.statusCode()).append(' ')
                .append(rsp.reasonPhrase()).append(CRLF);
        for (HeaderField h : rsp.headers()) {
            head.append(h.name()).append(": ").append(h.value()).append(CRLF);
        }
        switch (framing) {
            case LENGTH  -> head.append(CONTENT_LENGTH).append(": ").append(len).append(CRLF);
            case CHUNKED -> head.append(TRANSFER_ENCODING).append(": chunked").append(CRLF);
            case RAW     -> { }
        }
        head.append(CRLF);
        
        LOG.log(DEBUG, () -> "Writing " + rsp.statusCode() + " using " + framing + " framing.");
        var headBuf = ByteBuffer.wrap(head.toString().getBytes(ISO_8859_1));
        if (headOnly) {
            return out.write(headBuf).thenCompose(nil -> BodyReaders.drain(body))
                    .thenAccept(n -> LOG.log(DEBUG, () ->
                            "Omitted " + n + " byte(s) of body in response to HEAD."));
        }
        return out.write(headBuf).thenCompose(nil -> switch (framing) {
            case LENGTH  -> writeKnownLength(body, len);
            case CHUNKED -> writeChunked(body);
            case RAW     -> writeRaw(body);
        });
    }
    
    private CompletionStage<Void> writeKnownLength(BodyReader body, long len) {
        long[] written = {0};
        return AsyncLoop.repeat(() -> body.read().thenCompose(buf -> {
            final int n = buf.remaining();
            if (n == 0) {
                if (written[0] != len) {
                    throw new IllegalResponseBodyException(
                            "Body ended after " + written[0] + " of " + len + " declared byte(s).");
                }
                return completedStage(false);
            }
            if (written[0] + n > len) {
                throw new IllegalResponseBodyException(
                        "Body yields more than " + len + " declared byte(s).");
            }
            written[0] += n;
            return out.write(buf).thenApply(nil -> true);
        }));
    }
    
    private CompletionStage<Void> writeChunked(BodyReader body) {
        return AsyncLoop.repeat(() -> body.read().thenCompose(buf -> {
            if (!buf.hasRemaining()) {
                return out.write(LAST_CHUNK.duplicate()).thenApply(nil -> false);
            }
            return out.write(chunk(buf)).thenApply(nil -> true);
        }));
    }
    
    private CompletionStage<Void> writeRaw(BodyReader body) {
        return AsyncLoop.repeat(() -> body.read().thenCompose(buf ->
                !buf.hasRemaining() ? completedStage(false) :
                        out.write(buf).thenApply(nil -> true)));
    }
    
    private static ByteBuffer chunk(ByteBuffer data) {
        final byte[] size = (Integer.toHexString(data.remaining()) + CRLF).getBytes(US_ASCII);
        var chunk = ByteBuffer.allocate(size.length + data.remaining() + 2);
        chunk.put(size).put(data).put((byte) '\r').put((byte) '\n');
        return chunk.flip();
    }
    
    private enum Framing {
        LENGTH, CHUNKED, RAW
    }
}
