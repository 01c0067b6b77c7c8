package alpha.onionhttp.middleware;

import alpha.onionhttp.context.Context;

import java.util.concurrent.CompletionStage;

/**
 * Is an executable chain of middleware, as produced by a {@link Composer}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface Pipeline
{
    /**
     * Executes all middleware against the given context.<p>
     * 
     * The returned stage completes normally when the entire chain has
     * completed, or exceptionally with whatever error a middleware threw or
     * completed its stage with.<p>
     * 
     * This method does not throw exceptions, all problems are reported
     * through the returned stage.
     * 
     * @param ctx the request context
     * 
     * @return the completion stage of the execution (never {@code null})
     */
    CompletionStage<Void> execute(Context ctx);
}
