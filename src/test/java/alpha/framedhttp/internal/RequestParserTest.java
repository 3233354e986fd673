package alpha.framedhttp.internal;

import alpha.framedhttp.HttpConstants.Version;
import alpha.framedhttp.message.HeaderField;
import alpha.framedhttp.message.HeaderParseException;
import alpha.framedhttp.message.HttpVersionNotSupportedException;
import alpha.framedhttp.message.HttpVersionParseException;
import alpha.framedhttp.message.Request;
import alpha.framedhttp.message.RequestLineParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link RequestParser}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RequestParserTest
{
    @Test
    void get_withHost() {
        Request r = parse("GET /hello HTTP/1.1\r\nHost: example.com");
        assertThat(r.method()).isEqualTo("GET");
        assertThat(r.target()).isEqualTo("/hello");
        assertThat(r.version()).isSameAs(Version.HTTP_1_1);
        assertThat(r.headers()).containsExactly(
                new HeaderField("Host", "example.com"));
        assertThat(r.header("host")).contains("example.com");
    }
    
    @Test
    void http10() {
        assertThat(parse("GET / HTTP/1.0").version()).isSameAs(Version.HTTP_1_0);
    }
    
    @Test
    void headers_orderAndDuplicatesPreserved() {
        Request r = parse(
                "POST / HTTP/1.1\r\n" +
                "Accept: a\r\n" +
                "X-Thing: 1\r\n" +
                "accept: b");
        assertThat(r.headers()).extracting(HeaderField::name)
                .containsExactly("Accept", "X-Thing", "accept");
        assertThat(r.header("ACCEPT")).contains("a");
        assertThat(r.headers("Accept")).containsExactly("a", "b");
    }
    
    @Test
    void header_valueIsTrimmed() {
        Request r = parse("GET / HTTP/1.1\r\nName: \t  value with space \t");
        assertThat(r.header("Name")).contains("value with space");
    }
    
    @Test
    void header_emptyValue() {
        Request r = parse("GET / HTTP/1.1\r\nEmpty:");
        assertThat(r.header("Empty")).contains("");
    }
    
    @Test
    void header_valueMayContainColon() {
        Request r = parse("GET / HTTP/1.1\r\nHost: localhost:8080");
        assertThat(r.header("Host")).contains("localhost:8080");
    }
    
    @Test
    void target_isOpaqueBytes() {
        byte[] head = "GET /café?q=1 HTTP/1.1".getBytes(ISO_8859_1);
        Request r = RequestParser.parse(head);
        assertThat(r.targetBytes()).isEqualTo("/café?q=1".getBytes(ISO_8859_1));
    }
    
    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "GET",
        "GET /",
        "GET  / HTTP/1.1",
        "GET / HTTP/1.1 ",
        " GET / HTTP/1.1",
        "GET\t/ HTTP/1.1",
        "G(T / HTTP/1.1"
    })
    void requestLine_malformed(String line) {
        assertThatThrownBy(() -> parse(line))
                .isExactlyInstanceOf(RequestLineParseException.class);
    }
    
    @Test
    void requestLine_controlCharInTarget() {
        assertThatThrownBy(() -> parse("GET /\u0007 HTTP/1.1"))
                .isExactlyInstanceOf(RequestLineParseException.class)
                .hasMessage("Illegal char in request-target: (7)");
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"HTTP/1", "HTTP/1.1.1", "http/1.1", "HTTP/x.1", "HTTP/11"})
    void version_malformed(String version) {
        assertThatThrownBy(() -> parse("GET / " + version))
                .isExactlyInstanceOf(HttpVersionParseException.class)
                .hasMessage("Malformed HTTP-version: \"" + version + "\".");
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"HTTP/0.9", "HTTP/2.0", "HTTP/1.2"})
    void version_notSupported(String version) {
        assertThatThrownBy(() -> parse("GET / " + version))
                .isExactlyInstanceOf(HttpVersionNotSupportedException.class)
                .hasMessage("HTTP-version not supported: \"" + version + "\".");
    }
    
    @ParameterizedTest
    @ValueSource(strings = {
        "NoColon",
        ": no name",
        "Bad Name: value",
        "Name : value",
        " Folded: value",
        "\tFolded: value",
        "Bell: ding\u0007dong"
    })
    void header_malformed(String line) {
        assertThatThrownBy(() -> parse("GET / HTTP/1.1\r\n" + line))
                .isExactlyInstanceOf(HeaderParseException.class);
    }
    
    @Test
    void header_emptyLineInTheMiddle() {
        // The framer never hands over such a head, but the parser must not accept it
        assertThatThrownBy(() -> parse("GET / HTTP/1.1\r\n\r\nHost: x"))
                .isExactlyInstanceOf(HeaderParseException.class);
    }
    
    private static Request parse(String head) {
        return RequestParser.parse(head.getBytes(ISO_8859_1));
    }
}
