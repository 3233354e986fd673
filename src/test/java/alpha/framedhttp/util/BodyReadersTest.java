package alpha.framedhttp.util;

import alpha.framedhttp.message.BodyReader;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests for {@link BodyReaders}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class BodyReadersTest
{
    @Test
    void empty() {
        BodyReader body = BodyReaders.empty();
        assertThat(body.length()).isZero();
        assertThat(body.read().toCompletableFuture().join().hasRemaining()).isFalse();
        assertThat(BodyReaders.ofBytes(new byte[0])).isSameAs(body);
    }
    
    @Test
    void ofString_lengthIsUtf8Bytes() {
        BodyReader body = BodyReaders.ofString("åäö");
        assertThat(body.length()).isEqualTo(6);
        assertThat(BodyReaders.toString(body, UTF_8).toCompletableFuture().join())
                .isEqualTo("åäö");
        assertThat(body.length()).isZero();
    }
    
    @Test
    void readsOnceThenEmpty() {
        BodyReader body = BodyReaders.ofBytes(new byte[]{1, 2, 3});
        assertThat(body.read().toCompletableFuture().join().remaining()).isEqualTo(3);
        assertThat(body.read().toCompletableFuture().join().remaining()).isZero();
        assertThat(body.read().toCompletableFuture().join().remaining()).isZero();
    }
    
    @Test
    void drain() {
        BodyReader body = BodyReaders.ofString("hello");
        assertThat(BodyReaders.drain(body).toCompletableFuture().join()).isEqualTo(5L);
        assertThat(BodyReaders.drain(body).toCompletableFuture().join()).isZero();
    }
    
    @Test
    void toBytes() {
        byte[] bytes = {1, 2, 3};
        assertThat(BodyReaders.toBytes(BodyReaders.ofBytes(bytes)).toCompletableFuture().join())
                .containsExactly(1, 2, 3);
    }
}
