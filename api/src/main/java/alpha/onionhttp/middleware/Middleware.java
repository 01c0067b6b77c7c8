package alpha.onionhttp.middleware;

import alpha.onionhttp.Application;
import alpha.onionhttp.Chain;
import alpha.onionhttp.context.Context;
import alpha.onionhttp.handler.ErrorHandler;
import alpha.onionhttp.util.Throwing;

import java.util.concurrent.CompletionStage;

/**
 * Is a handler participating in the request processing pipeline.<p>
 * 
 * The middleware is given the per-request {@link Context} and the
 * {@link Chain} through which the rest of the pipeline is invoked. The
 * middleware may inspect and mutate the context, optionally proceed the
 * chain, and optionally run code after the rest of the chain has completed.
 * 
 * <pre>{@code
 *   Middleware responseTime = (ctx, next) -> {
 *       long start = System.nanoTime();
 *       return next.proceed().thenRun(() -> {
 *           long ms = (System.nanoTime() - start) / 1_000_000;
 *           ctx.response().set("X-Response-Time", ms + "ms");
 *       });
 *   };
 *   app.use(responseTime);
 * }</pre>
 * 
 * Middleware are executed in the same order they were registered. The code
 * executed before proceeding the chain runs top-down, and the code chained
 * onto the stage returned from {@link Chain#proceed()} runs bottom-up. This
 * is commonly referred to as the "onion model".<p>
 * 
 * A middleware has no obligation to proceed the chain.
 * 
 * <pre>{@code
 *   Middleware onlyAdminsAllowed = (ctx, next) -> {
 *       if (!"admin".equals(ctx.state().get("user.role"))) {
 *           // Short-circuit the rest of the pipeline
 *           ctx.status(403);
 *           return completedFuture(null);
 *       }
 *       return next.proceed();
 *   };
 * }</pre>
 * 
 * An exception thrown from the middleware, or a returned stage that completes
 * exceptionally, fails the pipeline and the exception is handed off to the
 * {@link Context#onerror(Throwable) context's error path}, which eventually
 * reaches the application's {@link ErrorHandler}. Middleware never needs to
 * install its own top-level catch.<p>
 * 
 * Returning {@code null} is equivalent to returning an already completed
 * stage.<p>
 * 
 * The middleware may be called concurrently and must be thread-safe.<p>
 * 
 * No argument passed to the middleware will be {@code null}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see Application#use(Middleware)
 */
@FunctionalInterface
public interface Middleware
       extends Throwing.BiFunction<Context, Chain, CompletionStage<Void>, Exception> {
    // Empty
}
