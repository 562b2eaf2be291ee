package sunmisc.algorithms.triangle;

import sunmisc.algorithms.arithmetic.Arithmetic;
import sunmisc.algorithms.arithmetic.IntegralArithmetic;

@FunctionalInterface
interface RowSum<E> {

    E sum(ArithmeticTriangle<E> triangle, int row);

    /**
     * Works for any additive element in O(row): sums the left half of the
     * row, doubles it and adds the middle column when the column count is odd.
     */
    final class Halving<E> implements RowSum<E> {
        private final Arithmetic<E> arithmetic;

        Halving(final Arithmetic<E> arithmetic) {
            this.arithmetic = arithmetic;
        }

        @Override
        public E sum(final ArithmeticTriangle<E> triangle, final int row) {
            if (row < 0) {
                return this.arithmetic.zero();
            } else if (row == 0) {
                return triangle.base();
            } else if (row < 4) {
                final E previous = this.sum(triangle, row - 1);
                return this.arithmetic.add(previous, previous);
            }
            final int columns = ArithmeticTriangle.numberOfColumns(row);
            final int middle = columns >> 1;

            final E half = triangle.sumDirect(row, 0, middle);
            final E doubled = this.arithmetic.add(half, half);
            return (columns & 1) == 0
                    ? doubled
                    : this.arithmetic.add(doubled, triangle.lookup(row, middle));
        }
    }

    /**
     * O(1) for integers, every row sums to {@code base * 2^row}.
     */
    final class Shifting<E> implements RowSum<E> {
        private final IntegralArithmetic<E> arithmetic;

        Shifting(final IntegralArithmetic<E> arithmetic) {
            this.arithmetic = arithmetic;
        }

        @Override
        public E sum(final ArithmeticTriangle<E> triangle, final int row) {
            return row < 0
                    ? this.arithmetic.zero()
                    : this.arithmetic.shiftLeft(triangle.base(), row);
        }
    }
}
