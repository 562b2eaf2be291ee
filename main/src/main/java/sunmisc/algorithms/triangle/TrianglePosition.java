package sunmisc.algorithms.triangle;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Either an index into the triangle or the unbounded end marker that
 * follows every index. The end marker can be compared but never read,
 * stepped or measured.
 */
public abstract class TrianglePosition implements Comparable<TrianglePosition> {

    private static final TrianglePosition UNBOUNDED = new Unbounded();

    private TrianglePosition() {}

    public static TrianglePosition of(final TriangleIndex index) {
        return new Bounded(Objects.requireNonNull(index));
    }

    public static TrianglePosition of(final int row, final int column) {
        return of(new TriangleIndex(row, column));
    }

    public static TrianglePosition unbounded() {
        return UNBOUNDED;
    }

    public abstract boolean isBounded();

    /**
     * @throws NoSuchElementException for the end marker
     */
    public abstract TriangleIndex index();

    public TrianglePosition next() {
        return of(this.index().next());
    }

    public TrianglePosition previous() {
        return of(this.index().previous());
    }

    public TrianglePosition offset(final long distance) {
        return of(this.index().offset(distance));
    }

    /**
     * @throws IllegalArgumentException if either position is the end marker
     */
    public long distanceTo(final TrianglePosition other) {
        if (!this.isBounded() || !other.isBounded()) {
            throw new IllegalArgumentException(
                    "Distance to the unbounded end is not finite");
        }
        return this.index().distanceTo(other.index());
    }

    private static final class Bounded extends TrianglePosition {
        private final TriangleIndex index;

        Bounded(final TriangleIndex index) {
            this.index = index;
        }

        @Override
        public boolean isBounded() {
            return true;
        }

        @Override
        public TriangleIndex index() {
            return this.index;
        }

        @Override
        public int compareTo(final TrianglePosition o) {
            return o.isBounded() ? this.index.compareTo(o.index()) : -1;
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof Bounded b && this.index.equals(b.index);
        }

        @Override
        public int hashCode() {
            return this.index.hashCode();
        }

        @Override
        public String toString() {
            return this.index.toString();
        }
    }

    private static final class Unbounded extends TrianglePosition {

        @Override
        public boolean isBounded() {
            return false;
        }

        @Override
        public TriangleIndex index() {
            throw new NoSuchElementException("The unbounded end has no index");
        }

        @Override
        public int compareTo(final TrianglePosition o) {
            return o.isBounded() ? 1 : 0;
        }

        @Override
        public String toString() {
            return "unbounded";
        }
    }
}
