package alpha.framedhttp.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Baseclass for immutable builders.<p>
 * 
 * Each builder links back to its predecessor and stores nothing but one
 * modifying action. The actions of the chain are replayed, oldest first,
 * against a fresh mutable state container when the built object is
 * constructed. A builder can therefore be shared and branched from freely.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @param <S> mutable state container
 */
public abstract class AbstractImmutableBuilder<S> {
    private final AbstractImmutableBuilder<S> prev;
    private final Consumer<? super S> modifier;
    
    /**
     * Constructs a root builder, one without modifications.
     */
    protected AbstractImmutableBuilder() {
        this.prev = null;
        this.modifier = null;
    }
    
    /**
     * Constructs a builder that adds one modification to its predecessor.
     * 
     * @param prev predecessor
     * @param modifier applied on the mutable state
     * @throws NullPointerException if any arg is {@code null}
     */
    protected AbstractImmutableBuilder(
            AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev);
        this.modifier = requireNonNull(modifier);
    }
    
    /**
     * Creates a state container and applies all modifications of the chain.
     * 
     * @param factory of state
     * @return the populated state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        Deque<Consumer<? super S>> mods = new ArrayDeque<>();
        for (var b = this; b.modifier != null; b = b.prev) {
            mods.addFirst(b.modifier);
        }
        S s = factory.get();
        mods.forEach(m -> m.accept(s));
        return s;
    }
}
