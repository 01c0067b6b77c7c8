package alpha.onionhttp.core;

import alpha.onionhttp.Chain;
import alpha.onionhttp.context.Context;
import alpha.onionhttp.middleware.Composer;
import alpha.onionhttp.middleware.Middleware;
import alpha.onionhttp.middleware.MultipleCallException;
import alpha.onionhttp.middleware.Pipeline;

import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * Default {@code Composer}.<p>
 * 
 * Each middleware is given a unique {@link Chain} that invokes the next
 * middleware in the list. Past the last middleware, {@code proceed} returns an
 * already completed stage. A second call to {@code proceed} on the same chain
 * instance returns a stage completed exceptionally with a
 * {@link MultipleCallException}.<p>
 * 
 * Exceptions thrown by a middleware are returned as failed stages. Thus, the
 * pipeline never throws.<p>
 * 
 * If the context was bound to the thread that invoked a middleware (see
 * {@link ContextStorage}), the context is bound again for the downstream
 * middleware, whichever thread calls {@code proceed}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultComposer implements Composer
{
    private static final System.Logger LOG
            = System.getLogger(DefaultComposer.class.getPackageName());
    
    static final DefaultComposer INSTANCE = new DefaultComposer();
    
    private DefaultComposer() {
        // Empty
    }
    
    @Override
    public Pipeline compose(List<? extends Middleware> middleware) {
        final List<Middleware> snapshot = List.copyOf(middleware);
        return ctx -> invoke(snapshot, 0, ctx);
    }
    
    private static CompletionStage<Void> invoke(
            List<Middleware> middleware, int index, Context ctx) {
        if (index == middleware.size()) {
            return completedFuture(null);
        }
        final var yielded = new AtomicBoolean();
        // proceed() may be called on any thread
        final boolean bound = ContextStorage.isBound(ctx);
        final Chain next = () -> {
            if (!yielded.compareAndSet(false, true)) {
                return failedFuture(new MultipleCallException());
            }
            // Recursive
            return bound ?
                    ContextStorage.run(ctx, () -> ContextStorage.propagate(ctx,
                            invoke(middleware, index + 1, ctx))) :
                    invoke(middleware, index + 1, ctx);
        };
        final var mw = middleware.get(index);
        try {
            var stage = mw.apply(ctx, next);
            if (stage == null) {
                LOG.log(DEBUG, () -> "Middleware returned null: " + mw);
                return completedFuture(null);
            }
            return stage;
        } catch (Exception e) {
            return failedFuture(e);
        }
    }
}
