package sunmisc.algorithms.triangle;

import org.hamcrest.CoreMatchers;
import org.hamcrest.MatcherAssert;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import sunmisc.algorithms.arithmetic.Arithmetics;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

public final class ArithmeticTriangleTest {

    @Test
    public void readEdges() {
        final ArithmeticTriangle<Long> t = ArithmeticTriangle.ofLongs();
        for (final int row : new int[] {0, 1, 2, 3, 100}) {
            MatcherAssert.assertThat(
                    String.format("First column of row %s must be the base", row),
                    t.value(row, 0),
                    CoreMatchers.equalTo(1L)
            );
            MatcherAssert.assertThat(
                    String.format("Last column of row %s must be the base", row),
                    t.value(row, row),
                    CoreMatchers.equalTo(1L)
            );
        }
    }

    @Test
    public void readNextToEdges() {
        final ArithmeticTriangle<Long> t = ArithmeticTriangle.ofLongs();
        MatcherAssert.assertThat(t.value(2, 1), CoreMatchers.equalTo(2L));
        MatcherAssert.assertThat(t.value(3, 1), CoreMatchers.equalTo(3L));
        MatcherAssert.assertThat(t.value(42, 1), CoreMatchers.equalTo(42L));
        MatcherAssert.assertThat(t.value(100, 1), CoreMatchers.equalTo(100L));

        MatcherAssert.assertThat(t.value(3, 2), CoreMatchers.equalTo(3L));
        MatcherAssert.assertThat(t.value(42, 41), CoreMatchers.equalTo(42L));
        MatcherAssert.assertThat(t.value(100, 99), CoreMatchers.equalTo(100L));
    }

    @Test
    public void readMiddle() {
        final ArithmeticTriangle<Long> t = ArithmeticTriangle.ofLongs();
        MatcherAssert.assertThat(t.value(6, 2), CoreMatchers.equalTo(15L));
        MatcherAssert.assertThat(t.value(6, 3), CoreMatchers.equalTo(20L));
        MatcherAssert.assertThat(t.value(6, 4), CoreMatchers.equalTo(15L));
        MatcherAssert.assertThat(t.value(7, 2), CoreMatchers.equalTo(21L));
        MatcherAssert.assertThat(t.value(7, 3), CoreMatchers.equalTo(35L));
        MatcherAssert.assertThat(t.value(7, 4), CoreMatchers.equalTo(35L));
        MatcherAssert.assertThat(t.value(7, 5), CoreMatchers.equalTo(21L));
    }

    @ParameterizedTest
    @EnumSource(CacheMode.class)
    public void holdTriangleProperties(final CacheMode mode) {
        final BigInteger base = BigInteger.valueOf(3);
        final ArithmeticTriangle<BigInteger> t = ArithmeticTriangle
                .builder(Arithmetics.BIG_INTEGERS)
                .base(base)
                .cache(mode)
                .build();
        for (int row = 0; row <= 40; ++row) {
            MatcherAssert.assertThat(t.value(row, 0), CoreMatchers.equalTo(base));
            MatcherAssert.assertThat(t.value(row, row), CoreMatchers.equalTo(base));
            for (int column = 0; column <= row; ++column) {
                MatcherAssert.assertThat(
                        String.format("(%s, %s) must mirror its partner", row, column),
                        t.value(row, column),
                        CoreMatchers.equalTo(t.value(row, row - column))
                );
                if (column > 0 && column < row) {
                    MatcherAssert.assertThat(
                            String.format("(%s, %s) must be the sum of its parents", row, column),
                            t.value(row, column),
                            CoreMatchers.equalTo(t.value(row - 1, column)
                                    .add(t.value(row - 1, column - 1)))
                    );
                }
            }
        }
    }

    @Test
    public void matchBinomialCoefficients() {
        final ArithmeticTriangle<BigInteger> t = ArithmeticTriangle.of(Arithmetics.BIG_INTEGERS);
        final int row = 300;
        BigInteger expected = BigInteger.ONE;
        for (int column = 0; column <= row; ++column) {
            MatcherAssert.assertThat(
                    String.format("(%s, %s) must equal the binomial coefficient", row, column),
                    t.value(row, column),
                    CoreMatchers.equalTo(expected)
            );
            expected = expected
                    .multiply(BigInteger.valueOf(row - column))
                    .divide(BigInteger.valueOf(column + 1));
        }
    }

    @Test
    public void clipColumnsOutsideRow() {
        final ArithmeticTriangle<Long> t = ArithmeticTriangle.ofLongs();
        MatcherAssert.assertThat(t.value(5, -1), CoreMatchers.equalTo(0L));
        MatcherAssert.assertThat(t.value(5, 6), CoreMatchers.equalTo(0L));
        MatcherAssert.assertThat(t.value(0, Integer.MAX_VALUE), CoreMatchers.equalTo(0L));
        MatcherAssert.assertThat(t.value(4, Integer.MIN_VALUE), CoreMatchers.equalTo(0L));
    }

    @Test
    public void rejectNegativeRow() {
        final ArithmeticTriangle<Long> t = ArithmeticTriangle.ofLongs();
        Assertions.assertThrows(InvalidIndexException.class, () -> t.value(-1, 0));
        Assertions.assertThrows(InvalidIndexException.class, () -> t.row(-3));
    }

    @Test
    public void resolveDeepRowsWithoutRecursion() {
        final ArithmeticTriangle<Long> t = ArithmeticTriangle.ofLongs();
        final long n = 100_000;
        MatcherAssert.assertThat(
                "Third column must be n(n-1)/2",
                t.value((int) n, 2),
                CoreMatchers.equalTo(n * (n - 1) / 2)
        );
        MatcherAssert.assertThat(
                "Mirrored column must match",
                t.value((int) n, (int) n - 2),
                CoreMatchers.equalTo(n * (n - 1) / 2)
        );
    }

    @Test
    public void iterateRowMajor() {
        final ArithmeticTriangle<Long> t = ArithmeticTriangle.ofLongs();
        final Iterator<Long> iterator = t.iterator();
        final List<Long> first = new ArrayList<>();
        for (int i = 0; i < 6; ++i) {
            first.add(iterator.next());
        }
        MatcherAssert.assertThat(
                "The first six elements must span rows 0, 1 and 2",
                first,
                CoreMatchers.equalTo(List.of(1L, 1L, 1L, 1L, 2L, 1L))
        );
        MatcherAssert.assertThat(
                "Iteration never ends",
                iterator.hasNext(),
                CoreMatchers.is(true)
        );
        MatcherAssert.assertThat(
                "Row 3 follows row 2",
                List.of(iterator.next(), iterator.next(), iterator.next(), iterator.next()),
                CoreMatchers.equalTo(List.of(1L, 3L, 3L, 1L))
        );
    }

    @Test
    public void streamRowMajor() {
        final ArithmeticTriangle<Long> t = ArithmeticTriangle.ofLongs();
        MatcherAssert.assertThat(
                t.stream().limit(15).collect(Collectors.toList()),
                CoreMatchers.equalTo(List.of(
                        1L,
                        1L, 1L,
                        1L, 2L, 1L,
                        1L, 3L, 3L, 1L,
                        1L, 4L, 6L, 4L, 1L))
        );
    }

    @Test
    public void viewRow() {
        final ArithmeticTriangle<Long> t = ArithmeticTriangle.ofLongs();
        final List<Long> row = t.row(6);
        MatcherAssert.assertThat(
                row,
                CoreMatchers.equalTo(List.of(1L, 6L, 15L, 20L, 15L, 6L, 1L))
        );
        Assertions.assertThrows(IndexOutOfBoundsException.class, () -> row.get(7));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> row.set(0, 2L));
    }

    @Test
    public void countColumns() {
        MatcherAssert.assertThat(ArithmeticTriangle.numberOfColumns(0), CoreMatchers.equalTo(1));
        MatcherAssert.assertThat(ArithmeticTriangle.numberOfColumns(5), CoreMatchers.equalTo(6));
        MatcherAssert.assertThat(ArithmeticTriangle.numberOfColumns(-1), CoreMatchers.equalTo(0));
    }

    @Test
    public void buildFromNonIntegralBase() {
        final ArithmeticTriangle<Double> t = new ArithmeticTriangle<>(Arithmetics.DOUBLES, 0.5);
        MatcherAssert.assertThat(t.value(4, 2), CoreMatchers.equalTo(3.0));
        MatcherAssert.assertThat(t.value(4, 7), CoreMatchers.equalTo(0.0));
    }
}
