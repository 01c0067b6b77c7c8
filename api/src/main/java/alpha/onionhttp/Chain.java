package alpha.onionhttp;

import alpha.onionhttp.middleware.Middleware;
import alpha.onionhttp.middleware.MultipleCallException;

import java.util.concurrent.CompletionStage;

/**
 * An API for proceeding the active processing chain.<p>
 * 
 * The chain is made up of {@link Middleware}, executed in the order they were
 * registered with the {@link Application}. Each middleware invocation is given
 * a unique chain object, which, when proceeded, invokes the next middleware.
 * Proceeding the chain of the last middleware returns an already completed
 * stage.<p>
 * 
 * The middleware can short-circuit the rest of the chain by <i>not</i> calling
 * {@link #proceed()}. The response is then whatever the context holds when
 * the returned stage completes.<p>
 * 
 * The chain object is thread-safe and does not necessarily have to be called
 * by the same thread running the middleware. In fact, the chief purpose behind
 * the stage-returning design is to support asynchronous middleware that does
 * not complete its job when the {@code apply} method returns.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface Chain
{
    /**
     * Calls the next entity in the processing chain.<p>
     * 
     * The returned stage completes when all downstream middleware has
     * completed. Code chained onto the stage therefore executes after all
     * downstream code, in the reverse order of registration.<p>
     * 
     * Only the first call has an effect. A subsequent call returns a stage
     * that completes exceptionally with a {@link MultipleCallException}.
     * Unless handled, this exception fails the processing of the request.
     * 
     * @return the completion stage of the rest of the chain (never {@code null})
     */
    CompletionStage<Void> proceed();
}
