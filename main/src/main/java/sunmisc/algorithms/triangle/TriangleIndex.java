package sunmisc.algorithms.triangle;

import java.util.NoSuchElementException;

/**
 * A position in an arithmetic triangle, {@code 0 <= column <= row}.
 * Indexes are ordered row-major: by row, then by column.
 */
public record TriangleIndex(int row, int column) implements Comparable<TriangleIndex> {

    public static final TriangleIndex START = new TriangleIndex(0, 0);

    public TriangleIndex {
        if (row < 0 || column < 0 || column > row) {
            throw new InvalidIndexException(row, column);
        }
    }

    /**
     * @return the following position, wrapping to the start of the next row
     */
    public TriangleIndex next() {
        return this.column < this.row
                ? new TriangleIndex(this.row, this.column + 1)
                : new TriangleIndex(Math.incrementExact(this.row), 0);
    }

    /**
     * @throws NoSuchElementException at the start of the triangle
     */
    public TriangleIndex previous() {
        if (this.column > 0) {
            return new TriangleIndex(this.row, this.column - 1);
        } else if (this.row > 0) {
            return new TriangleIndex(this.row - 1, this.row - 1);
        }
        throw new NoSuchElementException("No position precedes the start of the triangle");
    }

    public boolean isColumnFirstOrLast() {
        return this.column == 0 || this.column == this.row;
    }

    /**
     * @return the position on the other side of the row's vertical axis
     */
    public TriangleIndex mirror() {
        return new TriangleIndex(this.row, this.row - this.column);
    }

    /**
     * @return the two positions whose values add up to this one
     * @throws IllegalStateException for the first and last columns, which
     * have a single parent
     */
    public Parents indexesForSum() {
        if (this.isColumnFirstOrLast()) {
            throw new IllegalStateException(String.format(
                    "%s lies on the edge of the triangle", this));
        }
        return new Parents(
                new TriangleIndex(this.row - 1, this.column),
                new TriangleIndex(this.row - 1, this.column - 1));
    }

    /**
     * @return the zero-based number of this position in row-major order
     */
    public long ordinal() {
        return triangular(this.row) + this.column;
    }

    /**
     * @throws NoSuchElementException if the ordinal is negative
     * @throws ArithmeticException if the row does not fit an {@code int}
     */
    public static TriangleIndex ofOrdinal(final long ordinal) {
        if (ordinal < 0) {
            throw new NoSuchElementException(String.format(
                    "Ordinal must be non-negative: %s", ordinal));
        }
        long row = Math.min(Integer.MAX_VALUE,
                (long) ((Math.sqrt(8.0 * ordinal + 1) - 1) / 2));
        // the floating point estimate may be off by one near large squares
        while (row > 0 && triangular(row) > ordinal) {
            --row;
        }
        while (row <= Integer.MAX_VALUE && triangular(row + 1) <= ordinal) {
            ++row;
        }
        return new TriangleIndex(
                Math.toIntExact(row),
                (int) (ordinal - triangular(row)));
    }

    public TriangleIndex offset(final long distance) {
        return distance == 0 ? this : ofOrdinal(Math.addExact(this.ordinal(), distance));
    }

    /**
     * @return the number of steps from this index to {@code other},
     * negative if other comes first
     */
    public long distanceTo(final TriangleIndex other) {
        return other.ordinal() - this.ordinal();
    }

    @Override
    public int compareTo(final TriangleIndex o) {
        final int byRow = Integer.compare(this.row, o.row);
        return byRow != 0 ? byRow : Integer.compare(this.column, o.column);
    }

    @Override
    public String toString() {
        return "(" + this.row + ", " + this.column + ")";
    }

    private static long triangular(final long row) {
        return row * (row + 1) / 2;
    }

    public record Parents(TriangleIndex above, TriangleIndex aboveLeft) { }
}
