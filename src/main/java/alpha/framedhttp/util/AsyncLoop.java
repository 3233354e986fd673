package alpha.framedhttp.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Repeats an asynchronous step until the step says stop.<p>
 * 
 * A step that completes synchronously, e.g. because the bytes it needed were
 * already buffered, does not recurse into the next step. The loop keeps
 * running on the initiating thread for as long as steps complete
 * synchronously, and is handed over to the completing thread as soon as one
 * does not. The stack depth is therefore constant no matter how many steps
 * run.<p>
 * 
 * Steps never run concurrently; the next step is not started until the
 * previous step's stage has completed.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class AsyncLoop
{
    /**
     * Runs the given step repeatedly.<p>
     * 
     * The loop ends when a step completes with {@code false}, or fails. A step
     * that throws or returns {@code null} fails the loop.
     * 
     * @param step yielding {@code true} to go again
     * 
     * @return a stage that completes when the loop ends
     * 
     * @throws NullPointerException if {@code step} is {@code null}
     */
    public static CompletionStage<Void> repeat(
            Supplier<? extends CompletionStage<Boolean>> step) {
        var loop = new AsyncLoop(requireNonNull(step));
        loop.run();
        return loop.result;
    }
    
    private final Supplier<? extends CompletionStage<Boolean>> step;
    private final CompletableFuture<Void> result;
    
    private AsyncLoop(Supplier<? extends CompletionStage<Boolean>> step) {
        this.step = step;
        this.result = new CompletableFuture<>();
    }
    
    private void run() {
        for (;;) {
            final CompletionStage<Boolean> stage;
            try {
                stage = requireNonNull(step.get(), "Step returned null.");
            } catch (Throwable t) {
                result.completeExceptionally(t);
                return;
            }
            // Whoever comes second continues the loop
            var handOff = new AtomicBoolean();
            stage.whenComplete((again, thr) -> {
                if (thr != null) {
                    result.completeExceptionally(unwrap(thr));
                } else if (again == null || !again) {
                    result.complete(null);
                } else if (!handOff.compareAndSet(false, true)) {
                    run();
                }
            });
            if (handOff.compareAndSet(false, true)) {
                return;
            }
        }
    }
    
    /**
     * Unwraps a {@link CompletionException}.<p>
     * 
     * Stages derived from a failed stage complete with the failure wrapped in a
     * {@code CompletionException}. This method returns the cause of such an
     * exception, or else the given throwable.
     * 
     * @param t throwable
     * @return the real problem
     */
    public static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ?
                t.getCause() : t;
    }
}
