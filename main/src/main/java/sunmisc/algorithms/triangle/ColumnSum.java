package sunmisc.algorithms.triangle;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import sunmisc.algorithms.arithmetic.Arithmetic;
import sunmisc.algorithms.ranges.IntRange;

import java.util.function.Supplier;

/**
 * Strategies for summing a range of columns in one row, ordered by the
 * order {@link #select} tries them in. Every strategy receives a range
 * already clipped to {@code [0, row]}.
 */
enum ColumnSum {
    EMPTY {
        @Override
        <E> E sum(final ArithmeticTriangle<E> triangle,
                  final IntRange columns, final int row) {
            return triangle.arithmetic().zero();
        }
    },
    SINGLE {
        @Override
        <E> E sum(final ArithmeticTriangle<E> triangle,
                  final IntRange columns, final int row) {
            return triangle.lookup(row, columns.lowerBound());
        }
    },
    FULL_ROW {
        @Override
        <E> E sum(final ArithmeticTriangle<E> triangle,
                  final IntRange columns, final int row) {
            return triangle.sumOfRow(row);
        }
    },
    /**
     * Rows with at most four columns have no interior, each column is
     * resolved in constant time.
     */
    SMALL_ROW {
        @Override
        <E> E sum(final ArithmeticTriangle<E> triangle,
                  final IntRange columns, final int row) {
            return triangle.sumDirect(row, columns.lowerBound(), columns.upperBound());
        }
    },
    /**
     * The range stays clear of columns 0, 1, row - 1 and row.
     */
    INTERIOR {
        @Override
        <E> E sum(final ArithmeticTriangle<E> triangle,
                  final IntRange columns, final int row) {
            return triangle.sumDirect(row, columns.lowerBound(), columns.upperBound());
        }
    },
    /**
     * The range covers the whole interior, so only edge columns are missing:
     * the row sum minus at most four lookups.
     */
    EXTERIOR {
        @Override
        <E> E sum(final ArithmeticTriangle<E> triangle,
                  final IntRange columns, final int row) {
            return complement(triangle, columns, row, () -> {
                final Arithmetic<E> arithmetic = triangle.arithmetic();
                E excluded = arithmetic.zero();
                for (final int column : new int[] {0, 1, row - 1, row}) {
                    if (!columns.contains(column)) {
                        excluded = arithmetic.add(excluded, triangle.lookup(row, column));
                    }
                }
                return excluded;
            });
        }
    },
    /**
     * Touches an edge but leaves part of the interior out. Sums whichever is
     * shorter: the range itself, or the columns around it subtracted from
     * the row sum.
     */
    PARTIAL {
        @Override
        <E> E sum(final ArithmeticTriangle<E> triangle,
                  final IntRange columns, final int row) {
            final int lo = columns.lowerBound(), hi = columns.upperBound();
            final long outside = (long) row + 1 - (hi - lo);
            if (outside >= hi - lo) {
                return triangle.sumDirect(row, lo, hi);
            }
            return complement(triangle, columns, row, () -> triangle.arithmetic().add(
                    triangle.sumDirect(row, 0, lo),
                    triangle.sumDirect(row, hi, (long) row + 1)));
        }
    };

    private static final Logger logger = LogManager.getLogger(ColumnSum.class);

    abstract <E> E sum(ArithmeticTriangle<E> triangle, IntRange columns, int row);

    /**
     * The row sum minus the excluded columns. A row sum that overflows the
     * element says nothing about the range, which is then summed column by
     * column instead.
     */
    private static <E> E complement(final ArithmeticTriangle<E> triangle,
                                    final IntRange columns,
                                    final int row,
                                    final Supplier<E> excluded) {
        final E total;
        try {
            total = triangle.sumOfRow(row);
        } catch (final ArithmeticException e) {
            logger.debug("Row {} does not fit the element, summing {} directly: {}",
                    row, columns, e.getMessage());
            return triangle.sumDirect(row, columns.lowerBound(), columns.upperBound());
        }
        return triangle.arithmetic().subtract(total, excluded.get());
    }

    /**
     * @param columns a range clipped to the columns of {@code row}
     */
    static ColumnSum select(final IntRange columns, final int row) {
        final int lo = columns.lowerBound(), hi = columns.upperBound();
        if (columns.isEmpty()) {
            return EMPTY;
        } else if (columns.count() == 1) {
            return SINGLE;
        } else if (lo == 0 && hi == (long) row + 1) {
            return FULL_ROW;
        } else if (row < 4) {
            return SMALL_ROW;
        } else if (IntRange.halfOpen(2, row - 2).contains(columns)) {
            return INTERIOR;
        } else if (lo <= 2 && hi >= row - 1) {
            return EXTERIOR;
        }
        return PARTIAL;
    }
}
