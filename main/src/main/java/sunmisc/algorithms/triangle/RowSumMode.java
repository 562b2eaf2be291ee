package sunmisc.algorithms.triangle;

import sunmisc.algorithms.arithmetic.Arithmetic;
import sunmisc.algorithms.arithmetic.IntegralArithmetic;

public enum RowSumMode {
    /**
     * Constant time shift for integral elements, halving otherwise.
     */
    AUTO {
        @Override
        <E> RowSum<E> create(final Arithmetic<E> arithmetic) {
            return arithmetic instanceof IntegralArithmetic<E> integral
                    ? new RowSum.Shifting<>(integral)
                    : new RowSum.Halving<>(arithmetic);
        }
    },
    /**
     * Always sum half of the row, whatever the element.
     */
    GENERIC {
        @Override
        <E> RowSum<E> create(final Arithmetic<E> arithmetic) {
            return new RowSum.Halving<>(arithmetic);
        }
    };

    abstract <E> RowSum<E> create(Arithmetic<E> arithmetic);
}
