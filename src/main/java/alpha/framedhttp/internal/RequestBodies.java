package alpha.framedhttp.internal;

import alpha.framedhttp.Config;
import alpha.framedhttp.HttpConstants.Method;
import alpha.framedhttp.message.BadRequestException;
import alpha.framedhttp.message.BodyReader;
import alpha.framedhttp.message.IllegalRequestBodyException;
import alpha.framedhttp.message.Request;
import alpha.framedhttp.util.BodyReaders;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalLong;

import static alpha.framedhttp.HttpConstants.HeaderName.CONTENT_LENGTH;
import static alpha.framedhttp.HttpConstants.HeaderName.TRANSFER_ENCODING;

/**
 * Selects the body reader of a request.<p>
 * 
 * The rules, in order:
 * <ol>
 *   <li>A {@code GET} or {@code HEAD} request has no body. If it declares one
 *       anyway, an {@link IllegalRequestBodyException} is thrown.</li>
 *   <li>A request with {@code Content-Length} has a body of that length.</li>
 *   <li>A request with {@code Transfer-Encoding: chunked} has a chunked
 *       body.</li>
 *   <li>Any other request has a body that ends with the connection.</li>
 * </ol>
 * 
 * A request with both {@code Content-Length} and {@code Transfer-Encoding},
 * a malformed or ambiguous length, or a transfer coding other than chunked,
 * is rejected with a {@link BadRequestException}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7230#section-3.3.3">RFC 7230 §3.3.3</a>
 */
final class RequestBodies
{
    private RequestBodies() {
        // Empty
    }
    
    /**
     * Returns the body reader of the given request.
     * 
     * @param req the request head
     * @param in connection reader positioned at the first body byte
     * @param conf server configuration
     * 
     * @return a body reader
     * 
     * @throws IllegalRequestBodyException
     *             if a GET or HEAD request declares a body
     * @throws BadRequestException
     *             if the framing headers are malformed or contradictory
     */
    static BodyReader of(Request req, ChannelReader in, Config conf) {
        final OptionalLong len = contentLength(req);
        final boolean chunked = isChunked(req);
        if (len.isPresent() && !req.headers(TRANSFER_ENCODING).isEmpty()) {
            throw new BadRequestException(
                    "Content-Length and Transfer-Encoding are both present.");
        }
        if (Method.isBodyless(req.method())) {
            if (chunked || len.orElse(0) > 0) {
                throw new IllegalRequestBodyException(
                        "HTTP body not allowed for " + req.method() + ".");
            }
            return BodyReaders.empty();
        }
        if (len.isPresent()) {
            return len.getAsLong() == 0 ? BodyReaders.empty() :
                    new FixedLengthBody(in, len.getAsLong());
        }
        if (chunked) {
            return new ChunkedBody(in, conf.maxChunkSizeLineLength());
        }
        return new UntilEofBody(in);
    }
    
    private static OptionalLong contentLength(Request req) {
        final List<String> values = req.headers(CONTENT_LENGTH).stream()
                .flatMap(v -> Arrays.stream(v.split(",")))
                .map(String::strip)
                .distinct()
                .toList();
        if (values.isEmpty()) {
            return OptionalLong.empty();
        }
        if (values.size() > 1) {
            throw new BadRequestException("Multiple differing Content-Length values.");
        }
        final String v = values.get(0);
        if (v.isEmpty() || !v.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new BadRequestException("Bad Content-Length: \"" + v + "\".");
        }
        try {
            return OptionalLong.of(Long.parseLong(v));
        } catch (NumberFormatException e) {
            throw new BadRequestException("Bad Content-Length: \"" + v + "\".");
        }
    }
    
    private static boolean isChunked(Request req) {
        final List<String> codings = req.headers(TRANSFER_ENCODING).stream()
                .flatMap(v -> Arrays.stream(v.split(",")))
                .map(String::strip)
                .filter(c -> !c.isEmpty())
                .toList();
        if (codings.isEmpty()) {
            return false;
        }
        if (!codings.get(codings.size() - 1).equalsIgnoreCase("chunked")) {
            throw new BadRequestException(
                    "Transfer-Encoding must end with chunked, got: " + codings);
        }
        if (codings.size() > 1) {
            throw new BadRequestException(
                    "Unsupported transfer coding(s): " + codings.subList(0, codings.size() - 1));
        }
        return true;
    }
}
