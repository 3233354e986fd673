package alpha.framedhttp.internal;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests for {@link LineFramer}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class LineFramerTest
{
    private final LineFramer testee = new LineFramer();
    
    @Test
    void ping() {
        var buf = buf("PING\n");
        assertThat(testee.tryCut(buf)).hasValueSatisfying(msg ->
                assertThat(str(msg)).isEqualTo("PING\n"));
        assertThat(buf.isEmpty()).isTrue();
    }
    
    @Test
    void needMoreData_bufferUntouched() {
        var buf = buf("PIN");
        assertThat(testee.tryCut(buf)).isEmpty();
        assertThat(buf.length()).isEqualTo(3);
    }
    
    @Test
    void idempotent() {
        var buf = buf("no line feed yet");
        assertThat(testee.tryCut(buf)).isEmpty();
        assertThat(testee.tryCut(buf)).isEmpty();
        assertThat(buf.length()).isEqualTo(16);
    }
    
    @Test
    void twoLines_cutOneAtATime() {
        var buf = buf("a\nbc\nd");
        assertThat(testee.tryCut(buf).map(LineFramerTest::str)).contains("a\n");
        assertThat(testee.tryCut(buf).map(LineFramerTest::str)).contains("bc\n");
        assertThat(testee.tryCut(buf)).isEmpty();
        assertThat(buf.length()).isEqualTo(1);
    }
    
    @Test
    void emptyLine() {
        var buf = buf("\n");
        assertThat(testee.tryCut(buf).map(LineFramerTest::str)).contains("\n");
    }
    
    private static ByteBuf buf(String content) {
        var b = new ByteBuf();
        b.append(content.getBytes(US_ASCII));
        return b;
    }
    
    private static String str(ByteBuffer b) {
        return US_ASCII.decode(b).toString();
    }
}
