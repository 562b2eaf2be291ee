package sunmisc.algorithms.triangle;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import sunmisc.algorithms.arithmetic.Arithmetic;
import sunmisc.algorithms.arithmetic.IntegralArithmetic;

import static java.util.Objects.requireNonNull;

public final class TriangleBuilder<E> {
    private static final Logger logger = LogManager.getLogger(TriangleBuilder.class);

    private final Arithmetic<E> arithmetic;
    private E base;
    private CacheMode cache = CacheMode.PLAIN;
    private RowSumMode rowSums = RowSumMode.AUTO;

    TriangleBuilder(final Arithmetic<E> arithmetic) {
        this.arithmetic = requireNonNull(arithmetic);
    }

    /**
     * The value of the first and last column of every row. Integral
     * elements default to one.
     */
    public TriangleBuilder<E> base(final E base) {
        this.base = requireNonNull(base);
        return this;
    }

    public TriangleBuilder<E> cache(final CacheMode cache) {
        this.cache = requireNonNull(cache);
        return this;
    }

    public TriangleBuilder<E> rowSums(final RowSumMode rowSums) {
        this.rowSums = requireNonNull(rowSums);
        return this;
    }

    /**
     * @throws IllegalStateException if no base was given and the element
     * has no unit to default to
     */
    public ArithmeticTriangle<E> build() {
        E b = this.base;
        if (b == null) {
            if (this.arithmetic instanceof IntegralArithmetic<E> integral) {
                b = integral.one();
            } else {
                throw new IllegalStateException(String.format(
                        "A base is required for %s", this.arithmetic));
            }
        }
        logger.debug("Building triangle over {}: base {}, cache {}, row sums {}",
                this.arithmetic, b, this.cache, this.rowSums);
        return new ArithmeticTriangle<>(
                this.arithmetic, b,
                this.cache.create(),
                this.rowSums.create(this.arithmetic));
    }
}
