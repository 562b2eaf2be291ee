package sunmisc.algorithms.ranges;

import java.util.stream.IntStream;

/**
 * A half-open interval of integers {@code [lowerBound, upperBound)}.
 * Closed and one-sided intervals are expressed through the factories.
 */
public record IntRange(int lowerBound, int upperBound) {

    public IntRange {
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException(String.format(
                    "Range requires lowerBound <= upperBound: [%s, %s)",
                    lowerBound, upperBound));
        }
    }

    public static IntRange halfOpen(final int from, final int to) {
        return new IntRange(from, to);
    }

    public static IntRange closed(final int from, final int through) {
        return new IntRange(from, Math.addExact(through, 1));
    }

    public static IntRange atLeast(final int from) {
        return new IntRange(from, Integer.MAX_VALUE);
    }

    public static IntRange upTo(final int to) {
        return new IntRange(Integer.MIN_VALUE, to);
    }

    public static IntRange through(final int through) {
        return new IntRange(Integer.MIN_VALUE, Math.addExact(through, 1));
    }

    public static IntRange all() {
        return new IntRange(Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    public boolean isEmpty() {
        return this.lowerBound == this.upperBound;
    }

    public long count() {
        return (long) this.upperBound - this.lowerBound;
    }

    public boolean contains(final int value) {
        return this.lowerBound <= value && value < this.upperBound;
    }

    /**
     * @return true if every value of {@code other} lies in this range;
     * an empty {@code other} is never contained
     */
    public boolean contains(final IntRange other) {
        return !other.isEmpty()
                && this.lowerBound <= other.lowerBound
                && other.upperBound <= this.upperBound;
    }

    /**
     * @return the values in both ranges, empty (positioned at the larger
     * lower bound) if they do not overlap
     */
    public IntRange intersection(final IntRange other) {
        final int lo = Math.max(this.lowerBound, other.lowerBound);
        final int hi = Math.min(this.upperBound, other.upperBound);
        return lo < hi ? new IntRange(lo, hi) : new IntRange(lo, lo);
    }

    public IntStream stream() {
        return IntStream.range(this.lowerBound, this.upperBound);
    }

    @Override
    public String toString() {
        return "[" + this.lowerBound + ", " + this.upperBound + ")";
    }
}
