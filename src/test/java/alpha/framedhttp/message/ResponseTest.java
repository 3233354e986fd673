package alpha.framedhttp.message;

import alpha.framedhttp.util.BodyReaders;
import org.junit.jupiter.api.Test;

import static alpha.framedhttp.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.framedhttp.HttpConstants.HeaderName.SERVER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link Response} and {@link Responses}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ResponseTest
{
    @Test
    void defaults() {
        Response r = Response.builder(404).build();
        assertThat(r.statusCode()).isEqualTo(404);
        assertThat(r.reasonPhrase()).isEqualTo("Not Found");
        assertThat(r.headers()).isEmpty();
        assertThat(r.body().length()).isZero();
        assertThat(r).hasToString("404 Not Found");
    }
    
    @Test
    void unknownStatusCode_unknownPhrase() {
        assertThat(Response.builder(299).build().reasonPhrase()).isEqualTo("Unknown");
    }
    
    @Test
    void withHeader_leavesOriginalIntact() {
        Response a = Responses.ok(BodyReaders.ofString("x"));
        Response b = a.withHeader(SERVER, "test");
        assertThat(a.headers()).isEmpty();
        assertThat(b.headers()).containsExactly(new HeaderField(SERVER, "test"));
        assertThat(b.body()).isSameAs(a.body());
    }
    
    @Test
    void text() {
        Response r = Responses.text(400, "bad");
        assertThat(r.headers()).containsExactly(
                new HeaderField(CONTENT_TYPE, "text/plain; charset=utf-8"));
        assertThat(r.body().length()).isEqualTo(3);
    }
    
    @Test
    void protocolException_hasTextResponse() {
        Response r = new BadRequestException("Nope.").getResponse();
        assertThat(r.statusCode()).isEqualTo(400);
        assertThat(r.reasonPhrase()).isEqualTo("Bad Request");
        assertThat(r.body().length()).isEqualTo("Nope.\n".length());
    }
    
    @Test
    void statusCodeMustHaveThreeDigits() {
        assertThatThrownBy(() -> Response.builder(99))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Status code must have three digits, got: 99");
        assertThatThrownBy(() -> Response.builder(1_000))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
