package alpha.onionhttp.util;

/**
 * Namespace for functions that throw checked exceptions.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Throwing {
    private Throwing() {
        // Empty
    }
    
    /**
     * A value supplier that may throw an exception.
     * 
     * @param <T> the result type
     * @param <X> the type of problem that can happen
     */
    @FunctionalInterface
    public interface Supplier<T, X extends Exception> {
        /**
         * Gets a result.
         * 
         * @return a result
         * @throws X should be documented by implementation
         */
        T get() throws X;
    }
    
    /**
     * Represents a function that accepts two arguments and produces a result.
     * 
     * @param <T> the type of the first argument to the function
     * @param <U> the type of the second argument to the function
     * @param <R> the type of the result of the function
     * @param <X> the type of problem that can happen
     */
    @FunctionalInterface
    public interface BiFunction<T, U, R, X extends Exception> {
        /**
         * Applies this function to the given arguments.
         * 
         * @param t the first function argument
         * @param u the second function argument
         * @return the function result
         * @throws X should be documented by implementation
         */
        R apply(T t, U u) throws X;
    }
}
