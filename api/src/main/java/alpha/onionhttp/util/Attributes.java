package alpha.onionhttp.util;

import java.util.Optional;
import java.util.concurrent.ConcurrentMap;

/**
 * Is an API for accessing objects associated with a holder.<p>
 * 
 * Useful when passing data across middleware boundaries where the holder is
 * the data carrier. For example, an authentication middleware may store the
 * user for downstream middleware to read.
 * 
 * <pre>{@code
 *   // In a middleware
 *   ctx.state().set("my.stuff", new MyClass());
 *   // Somewhere else
 *   MyClass obj = ctx.state().getAny("my.stuff");
 * }</pre>
 * 
 * The implementation is thread-safe.<p>
 * 
 * For as long as the holder object is reachable, the attributes are reachable.
 * The other way around is not true as the attributes does not keep a
 * back-reference to the holder object.<p>
 * 
 * The OnionHTTP library reserves the right to use the namespace
 * "alpha.onionhttp.*" exclusively. Applications are encouraged to avoid
 * using this prefix in their names.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Attributes {
    /**
     * Creates a new, empty attributes object.
     * 
     * @return a new attributes object
     */
    static Attributes create() {
        return new DefaultAttributes();
    }
    
    /**
     * Returns the value of the named attribute as an object.
     * 
     * @param name of attribute
     * 
     * @return the value of the named attribute as an object (may be {@code null})
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Object get(String name);
    
    /**
     * Set the value of the named attribute.<p>
     * 
     * Setting a {@code null} value removes the attribute.
     * 
     * @param name  of attribute (any non-null string)
     * @param value of attribute (may be {@code null})
     * 
     * @return the old value (may be {@code null})
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Object set(String name, Object value);
    
    /**
     * Returns the value of the named attribute cast to V.
     * 
     * This method is equivalent to:
     * <pre>{@code
     *   V v = (V) get(name);
     * }</pre>
     * 
     * Except the cast is implicit and the type is inferred by the Java
     * compiler. The call site will still blow up with a {@code
     * ClassCastException} if a non-null object can not be cast to the
     * inferred type.
     * 
     * @param <V>  value type (explicitly provided on call site or inferred 
     *             by Java compiler)
     * @param name of attribute
     * 
     * @return the value of the named attribute as an object (may be {@code null})
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    <V> V getAny(String name);
    
    /**
     * Returns the value of the named attribute described as an Optional of
     * an object.
     * 
     * @param name of attribute
     * 
     * @return the value of the named attribute described as an Optional of
     *         an object (never {@code null} but possibly empty)
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Optional<Object> getOpt(String name);
    
    /**
     * Returns a modifiable map view of the attributes. Changes to the map
     * are reflected in the attributes, and vice-versa.
     * 
     * @return a modifiable map view of the attributes
     */
    ConcurrentMap<String, Object> asMap();
    
    /**
     * Returns a modifiable map view of the attributes. Changes to the map
     * are reflected in the attributes, and vice-versa.<p>
     * 
     * Using this method does not lead to heap pollution if the returned map is
     * immediately used to work with the values. For example:
     * 
     * <pre>{@code
     *   int v = ctx.state()
     *              .<Integer>asMapAny()
     *              .merge("my.counter", 1, Integer::sum);
     * }</pre>
     * 
     * @param <V> value type (explicitly provided on call site or inferred 
     *            by Java compiler)
     * 
     * @return a modifiable map view of the attributes
     */
    <V> ConcurrentMap<String, V> asMapAny();
}
