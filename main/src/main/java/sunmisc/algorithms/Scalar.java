package sunmisc.algorithms;

/**
 * A value that may be expensive to produce, such as a triangle element
 * under a cursor or the cursor that follows it.
 *
 * @param <V> value type
 * @param <E> what producing the value may throw
 */
@FunctionalInterface
public interface Scalar<V, E extends Throwable> {

    /**
     * @throws E if the value cannot be produced
     */
    V value() throws E;
}
