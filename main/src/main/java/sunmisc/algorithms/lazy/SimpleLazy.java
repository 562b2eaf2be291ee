package sunmisc.algorithms.lazy;

import sunmisc.algorithms.Scalar;

/**
 * Evaluates its origin at most once, not thread-safe.
 * A failed evaluation is not remembered and will be retried.
 */
public final class SimpleLazy<V, E extends Throwable> implements Scalar<V, E> {
    private Scalar<V, E> origin;
    private V result;

    public SimpleLazy(final Scalar<V, E> origin) {
        this.origin = origin;
    }

    @Override
    public V value() throws E {
        final Scalar<V, E> src = this.origin;
        if (src != null) {
            this.result = src.value();
            this.origin = null;
        }
        return this.result;
    }
}
