package alpha.framedhttp.internal;

import alpha.framedhttp.message.UnexpectedEndOfStreamException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link MessageReader}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class MessageReaderTest
{
    private final FakeTransport transport = new FakeTransport();
    private final MessageReader<ByteBuffer> testee = new MessageReader<>(
            new ChannelReader(SequentialStream.of(transport)), new LineFramer());
    
    @Test
    void ping() {
        transport.feed("PING\n");
        assertThat(next()).contains("PING\n");
    }
    
    @Test
    void messageSplitAcrossChunks() {
        transport.feed("PI", "N", "G\nPO", "NG\n");
        assertThat(next()).contains("PING\n");
        assertThat(next()).contains("PONG\n");
        assertThat(transport.deliveries()).isEqualTo(4);
    }
    
    @Test
    void manyMessagesInOneChunk_readOnlyOnce() {
        transport.feed("a\nb\nc\n");
        assertThat(next()).contains("a\n");
        assertThat(next()).contains("b\n");
        assertThat(next()).contains("c\n");
        assertThat(transport.resumes()).isEqualTo(1);
    }
    
    @Test
    void cleanEndOfStream() {
        transport.feed("a\n").end();
        assertThat(next()).contains("a\n");
        assertThat(next()).isEmpty();
    }
    
    @Test
    void unexpectedEndOfStream() {
        transport.feed("partial").end();
        assertThatThrownBy(this::next)
                .hasCauseExactlyInstanceOf(UnexpectedEndOfStreamException.class)
                .hasRootCauseMessage("Unexpected EOF, 7 byte(s) of an incomplete message.");
    }
    
    @Test
    void pendingUntilDataArrives() {
        var f = testee.next().toCompletableFuture();
        assertThat(f).isNotDone();
        transport.feed("x");
        assertThat(f).isNotDone();
        transport.feed("\n");
        assertThat(f.join().map(MessageReaderTest::str)).contains("x\n");
    }
    
    private Optional<String> next() {
        return testee.next().toCompletableFuture().join().map(MessageReaderTest::str);
    }
    
    private static String str(ByteBuffer b) {
        return US_ASCII.decode(b).toString();
    }
}
