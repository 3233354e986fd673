package alpha.framedhttp.internal;

import alpha.framedhttp.Config;
import alpha.framedhttp.message.BadRequestException;
import alpha.framedhttp.message.BodyReader;
import alpha.framedhttp.message.IllegalRequestBodyException;
import alpha.framedhttp.message.Request;
import alpha.framedhttp.util.BodyReaders;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link RequestBodies}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RequestBodiesTest
{
    private final FakeTransport transport = new FakeTransport();
    private final ChannelReader in = new ChannelReader(SequentialStream.of(transport));
    
    @Test
    void get_noBody() {
        var body = of("GET / HTTP/1.1");
        assertThat(body).isSameAs(BodyReaders.empty());
        assertThat(body.length()).isZero();
    }
    
    @Test
    void get_zeroContentLength_isFine() {
        assertThat(of("GET / HTTP/1.1\r\nContent-Length: 0").length()).isZero();
    }
    
    @Test
    void get_withContentLength() {
        assertThatThrownBy(() -> of("GET / HTTP/1.1\r\nContent-Length: 3"))
                .isExactlyInstanceOf(IllegalRequestBodyException.class)
                .hasMessage("HTTP body not allowed for GET.");
    }
    
    @Test
    void head_chunked() {
        assertThatThrownBy(() -> of("HEAD / HTTP/1.1\r\nTransfer-Encoding: chunked"))
                .isExactlyInstanceOf(IllegalRequestBodyException.class);
    }
    
    @Test
    void post_contentLength() {
        var body = of("POST / HTTP/1.1\r\nContent-Length: 12");
        assertThat(body).isExactlyInstanceOf(FixedLengthBody.class);
        assertThat(body.length()).isEqualTo(12);
    }
    
    @Test
    void post_zeroContentLength() {
        assertThat(of("POST / HTTP/1.1\r\nContent-Length: 0").length()).isZero();
    }
    
    @Test
    void post_repeatedEqualContentLength() {
        var body = of("POST / HTTP/1.1\r\nContent-Length: 5\r\nContent-Length: 5, 5");
        assertThat(body.length()).isEqualTo(5);
    }
    
    @Test
    void post_differingContentLength() {
        assertThatThrownBy(() -> of("POST / HTTP/1.1\r\nContent-Length: 5\r\nContent-Length: 6"))
                .isExactlyInstanceOf(BadRequestException.class)
                .hasMessage("Multiple differing Content-Length values.");
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"-1", "+1", "abc", "1.0", "99999999999999999999"})
    void post_badContentLength(String value) {
        assertThatThrownBy(() -> of("POST / HTTP/1.1\r\nContent-Length: " + value))
                .isExactlyInstanceOf(BadRequestException.class)
                .hasMessage("Bad Content-Length: \"" + value + "\".");
    }
    
    @Test
    void post_chunked() {
        assertThat(of("POST / HTTP/1.1\r\nTransfer-Encoding: Chunked"))
                .isExactlyInstanceOf(ChunkedBody.class);
    }
    
    @Test
    void post_bothLengthAndChunked() {
        assertThatThrownBy(() -> of(
                "POST / HTTP/1.1\r\nContent-Length: 5\r\nTransfer-Encoding: chunked"))
                .isExactlyInstanceOf(BadRequestException.class)
                .hasMessage("Content-Length and Transfer-Encoding are both present.");
    }
    
    @Test
    void post_codingNotEndingWithChunked() {
        assertThatThrownBy(() -> of("POST / HTTP/1.1\r\nTransfer-Encoding: chunked, gzip"))
                .isExactlyInstanceOf(BadRequestException.class);
    }
    
    @Test
    void post_unsupportedCoding() {
        assertThatThrownBy(() -> of("POST / HTTP/1.1\r\nTransfer-Encoding: gzip, chunked"))
                .isExactlyInstanceOf(BadRequestException.class)
                .hasMessage("Unsupported transfer coding(s): [gzip]");
    }
    
    @Test
    void post_noFramingHeaders_untilEof() {
        var body = of("POST / HTTP/1.0");
        assertThat(body).isExactlyInstanceOf(UntilEofBody.class);
        assertThat(body.length()).isEqualTo(-1);
        transport.feed("all ", "of it").end();
        assertThat(BodyReaders.toString(body, US_ASCII).toCompletableFuture().join())
                .isEqualTo("all of it");
        assertThat(body.length()).isZero();
    }
    
    private BodyReader of(String head) {
        Request req = RequestParser.parse(head.getBytes(US_ASCII));
        return RequestBodies.of(req, in, Config.DEFAULT);
    }
}
