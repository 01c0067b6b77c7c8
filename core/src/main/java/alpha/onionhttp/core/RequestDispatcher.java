package alpha.onionhttp.core;

import alpha.onionhttp.context.Context;
import alpha.onionhttp.middleware.Pipeline;

import java.util.concurrent.CompletionStage;

import static alpha.onionhttp.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static java.lang.System.Logger.Level.DEBUG;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * Executes the middleware pipeline for a context.<p>
 * 
 * The status is set to 404 (Not Found) before the pipeline executes. A
 * successful pipeline is followed by the {@link ResponseSerializer}, a failed
 * one by {@link Context#onerror(Throwable)}. Errors reported by the transport
 * are also routed to {@code onerror}.<p>
 * 
 * The stage returned by {@link #dispatch(Context, Pipeline)} never completes
 * exceptionally.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RequestDispatcher
{
    private static final System.Logger LOG
            = System.getLogger(RequestDispatcher.class.getPackageName());
    
    private final ResponseSerializer serializer;
    private final boolean propagate;
    
    RequestDispatcher(ResponseSerializer serializer, boolean propagate) {
        this.serializer = serializer;
        this.propagate  = propagate;
    }
    
    CompletionStage<Void> dispatch(Context ctx, Pipeline pipeline) {
        return propagate ?
                ContextStorage.run(ctx, () -> dispatch0(ctx, pipeline)) :
                dispatch0(ctx, pipeline);
    }
    
    private CompletionStage<Void> dispatch0(Context ctx, Pipeline pipeline) {
        LOG.log(DEBUG, () -> "Dispatching " + ctx);
        ctx.outgoing().statusCode(FOUR_HUNDRED_FOUR);
        ctx.outgoing().onFinished(ctx::onerror);
        CompletionStage<Void> stage;
        try {
            stage = pipeline.execute(ctx);
        } catch (RuntimeException e) {
            stage = failedFuture(e);
        }
        if (stage == null) {
            stage = completedFuture(null);
        }
        return ContextStorage.propagate(ctx, stage)
                .thenRun(() -> serializer.respond(ctx))
                .exceptionally(thr -> {
                    ctx.onerror(thr);
                    return null;
                });
    }
}
