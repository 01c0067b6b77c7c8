package alpha.onionhttp.middleware;

import alpha.onionhttp.Chain;

import java.io.Serial;

/**
 * Thrown when a middleware proceeds its chain more than once.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see Chain#proceed()
 */
public final class MultipleCallException extends IllegalStateException {
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs this object.
     */
    public MultipleCallException() {
        super(Chain.class.getSimpleName() + ".proceed() called multiple times");
    }
}
