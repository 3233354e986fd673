package alpha.framedhttp;

import alpha.framedhttp.util.AbstractImmutableBuilder;

import java.time.Duration;
import java.util.function.Consumer;

import static java.time.Duration.ofSeconds;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultConfig implements Config {
    private final Builder  builder;
    private final int      maxRequestHeadSize,
                           readBufferSize,
                           maxChunkSizeLineLength;
    private final Duration timeoutRead,
                           timeoutWrite;
    
    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder                = b;
        maxRequestHeadSize     = s.maxRequestHeadSize;
        readBufferSize         = s.readBufferSize;
        maxChunkSizeLineLength = s.maxChunkSizeLineLength;
        timeoutRead            = s.timeoutRead;
        timeoutWrite           = s.timeoutWrite;
    }
    
    @Override
    public int maxRequestHeadSize() {
        return maxRequestHeadSize;
    }
    
    @Override
    public int readBufferSize() {
        return readBufferSize;
    }
    
    @Override
    public int maxChunkSizeLineLength() {
        return maxChunkSizeLineLength;
    }
    
    @Override
    public Duration timeoutRead() {
        return timeoutRead;
    }
    
    @Override
    public Duration timeoutWrite() {
        return timeoutWrite;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "maxRequestHeadSize=" + maxRequestHeadSize +
                ", readBufferSize=" + readBufferSize +
                ", maxChunkSizeLineLength=" + maxChunkSizeLineLength +
                ", timeoutRead=" + timeoutRead +
                ", timeoutWrite=" + timeoutWrite + '}';
    }
    
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static class MutableState {
            int      maxRequestHeadSize     = 8_192,
                     readBufferSize         = 16_384,
                     maxChunkSizeLineLength = 1_024;
            Duration timeoutRead            = ofSeconds(90),
                     timeoutWrite           = timeoutRead;
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Builder maxRequestHeadSize(int newVal) {
            requireAtLeast(newVal, 1);
            return new DefaultBuilder(this, s -> s.maxRequestHeadSize = newVal);
        }
        
        @Override
        public Builder readBufferSize(int newVal) {
            requireAtLeast(newVal, 1);
            return new DefaultBuilder(this, s -> s.readBufferSize = newVal);
        }
        
        @Override
        public Builder maxChunkSizeLineLength(int newVal) {
            // "0" + CRLF
            requireAtLeast(newVal, 3);
            return new DefaultBuilder(this, s -> s.maxChunkSizeLineLength = newVal);
        }
        
        @Override
        public Builder timeoutRead(Duration newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.timeoutRead = newVal);
        }
        
        @Override
        public Builder timeoutWrite(Duration newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.timeoutWrite = newVal);
        }
        
        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }
        
        private static void requireAtLeast(int val, int min) {
            if (val < min) {
                throw new IllegalArgumentException(
                        "Expected at least " + min + ", got " + val + ".");
            }
        }
    }
}
