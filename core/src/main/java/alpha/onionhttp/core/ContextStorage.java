package alpha.onionhttp.core;

import alpha.onionhttp.context.Context;
import alpha.onionhttp.util.Throwing;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Binds a {@link Context} to the executing thread.<p>
 * 
 * Bindings are scoped; {@code run} binds the context for the duration of an
 * operation, after which the previous binding (if any) is restored. The
 * bindings are backed by a thread-local stack.<p>
 * 
 * A context can be carried over to other threads using
 * {@link #bind(Executor)}, and to the dependents of a stage using
 * {@link #propagate(Context, CompletionStage)}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ContextStorage
{
    private static final ThreadLocal<Deque<Context>> STACK
            = ThreadLocal.withInitial(ArrayDeque::new);
    
    private ContextStorage() {
        // Empty
    }
    
    /**
     * Calls a value-returning operation with the given context bound to the
     * current thread.
     * 
     * @param ctx the context
     * @param op the operation to call
     * @param <R> the result type
     * @param <X> the exception type
     * @return the result
     * @throws X if the operation completes with an exception
     */
    static <R, X extends Exception> R run(
            Context ctx, Throwing.Supplier<R, X> op) throws X {
        var stack = STACK.get();
        stack.addLast(requireNonNull(ctx));
        try {
            return op.get();
        } finally {
            stack.removeLast();
            if (stack.isEmpty()) {
                STACK.remove();
            }
        }
    }
    
    /**
     * Runs an operation with the given context bound to the current thread.
     * 
     * @param ctx the context
     * @param op the operation to run
     */
    static void run(Context ctx, Runnable op) {
        run(ctx, () -> {
            op.run();
            return null;
        });
    }
    
    /**
     * {@return the context bound to the current thread, if any}
     */
    static Optional<Context> current() {
        return Optional.ofNullable(STACK.get().peekLast());
    }
    
    /**
     * {@return {@code true} if the given context is bound to the current
     * thread}
     * 
     * @param ctx the context
     */
    static boolean isBound(Context ctx) {
        return current().orElse(null) == ctx;
    }
    
    /**
     * Wraps the given executor.<p>
     * 
     * A task submitted to the returned executor runs with the context that was
     * bound to the submitting thread, if any.
     * 
     * @param delegate the executor
     * @return a context-propagating executor
     */
    static Executor bind(Executor delegate) {
        requireNonNull(delegate);
        return command -> {
            requireNonNull(command);
            var ctx = current();
            delegate.execute(ctx.isEmpty() ? command :
                    () -> run(ctx.get(), command));
        };
    }
    
    /**
     * Returns a stage whose dependents execute with the given context bound,
     * provided that the context is bound to the calling thread.<p>
     * 
     * If the context is not bound, or the stage is already completed, the
     * given stage is returned as-is.
     * 
     * @param ctx the context
     * @param stage to propagate the context to
     * @param <T> the result type
     * @return a stage
     */
    static <T> CompletionStage<T> propagate(Context ctx, CompletionStage<T> stage) {
        if (!isBound(ctx) ||
                (stage instanceof CompletableFuture<T> cf && cf.isDone())) {
            return stage;
        }
        Executor inline = command -> run(ctx, command);
        return stage.thenApplyAsync(Function.identity(), inline);
    }
}
