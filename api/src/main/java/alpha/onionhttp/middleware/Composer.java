package alpha.onionhttp.middleware;

import alpha.onionhttp.Chain;
import alpha.onionhttp.Config;

import java.util.List;

/**
 * Turns an ordered list of middleware into one executable pipeline.<p>
 * 
 * The library provides a default implementation, which is used unless the
 * application has configured a different one using
 * {@link Config.Builder#composer(Composer)}.<p>
 * 
 * An implementation must execute the middleware in list order, give each
 * middleware invocation a {@link Chain} that invokes the next middleware,
 * and enforce that the chain is proceeded at most once. The implementation
 * must not retain a reference to the given list; later modifications of the
 * list must not affect pipelines already composed.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface Composer
{
    /**
     * Composes the given middleware.
     * 
     * @param middleware to compose (may be empty)
     * 
     * @return a pipeline
     * 
     * @throws NullPointerException
     *             if {@code middleware} or an element is {@code null}
     */
    Pipeline compose(List<? extends Middleware> middleware);
}
