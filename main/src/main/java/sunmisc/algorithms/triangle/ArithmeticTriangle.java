package sunmisc.algorithms.triangle;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import sunmisc.algorithms.arithmetic.Arithmetic;
import sunmisc.algorithms.arithmetic.Arithmetics;
import sunmisc.algorithms.arithmetic.IntegralArithmetic;
import sunmisc.algorithms.cursor.Cursor;
import sunmisc.algorithms.ranges.IntRange;

import java.util.AbstractList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.RandomAccess;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Also known as Pascal's triangle. Rows are numbered from zero and row
 * {@code n} has {@code n + 1} columns:
 * <pre>
 * 0:   1
 * 1:   1  1
 * 2:   1  2  1
 * 3:   1  3  3  1
 * 4:   1  4  6  4  1
 * 5:   1  5 10 10  5  1
 * 6:   1  6 15 20 15  6  1
 * </pre>
 * The first and last columns hold the base, every other value is the sum of
 * the value above it and the value above and to the left. Values are
 * computed on demand; interior values of the left half are memoized
 * according to the {@link CacheMode}, the rest follow in constant time from
 * the edges and the symmetry of each row.
 * <p>
 * Iteration never ends: it runs left to right through row 0, row 1 and so on.
 *
 * @param <E> element type
 */
public final class ArithmeticTriangle<E> implements Iterable<E> {
    private static final Logger logger = LogManager.getLogger(ArithmeticTriangle.class);

    private final Arithmetic<E> arithmetic;
    private final E base;
    private final TriangleCache<E> cache;
    private final RowSum<E> rowSum;

    ArithmeticTriangle(final Arithmetic<E> arithmetic,
                       final E base,
                       final TriangleCache<E> cache,
                       final RowSum<E> rowSum) {
        this.arithmetic = arithmetic;
        this.base = base;
        this.cache = cache;
        this.rowSum = rowSum;
    }

    public ArithmeticTriangle(final Arithmetic<E> arithmetic, final E base) {
        this(Objects.requireNonNull(arithmetic),
                Objects.requireNonNull(base),
                CacheMode.PLAIN.create(),
                RowSumMode.AUTO.create(arithmetic));
    }

    /**
     * A triangle whose edges hold one.
     */
    public static <E> ArithmeticTriangle<E> of(final IntegralArithmetic<E> arithmetic) {
        return new ArithmeticTriangle<>(arithmetic, arithmetic.one());
    }

    public static ArithmeticTriangle<Long> ofLongs() {
        return of(Arithmetics.LONGS);
    }

    public static <E> TriangleBuilder<E> builder(final Arithmetic<E> arithmetic) {
        return new TriangleBuilder<>(arithmetic);
    }

    /**
     * @return {@code row + 1}, or zero for a negative row
     */
    public static int numberOfColumns(final int row) {
        return row < 0 ? 0 : Math.addExact(row, 1);
    }

    public E base() {
        return this.base;
    }

    /**
     * Columns outside {@code [0, row]} hold zero.
     *
     * @throws InvalidIndexException if the row is negative
     */
    public E value(final int row, final int column) {
        if (row < 0) {
            throw new InvalidIndexException(row, column);
        }
        return this.lookup(row, column);
    }

    public E get(final TriangleIndex index) {
        return this.lookup(index.row(), index.column());
    }

    /**
     * @throws java.util.NoSuchElementException for {@link #endIndex()}
     */
    public E get(final TrianglePosition position) {
        return this.get(position.index());
    }

    /**
     * Integral elements are summed in constant time, others in O(row).
     *
     * @throws ArithmeticException if the sum overflows the element
     */
    public E sumOfRow(final int row) {
        return this.rowSum.sum(this, row);
    }

    /**
     * Sums the values of the given columns in a row. Columns outside the row
     * are skipped.
     */
    public E sumOfColumns(final IntRange columns, final int row) {
        // a half-open int range cannot reach column Integer.MAX_VALUE
        final IntRange clipped = columns.intersection(row == Integer.MAX_VALUE
                ? IntRange.atLeast(0)
                : IntRange.halfOpen(0, numberOfColumns(row)));
        final ColumnSum strategy = ColumnSum.select(clipped, row);
        logger.trace("Summing columns {} of row {} as {}", clipped, row, strategy);
        return strategy.sum(this, clipped, row);
    }

    /**
     * Read-only view of one row.
     *
     * @throws InvalidIndexException if the row is negative
     */
    public List<E> row(final int row) {
        if (row < 0) {
            throw new InvalidIndexException(row, 0);
        }
        return new Row(row);
    }

    public TrianglePosition startIndex() {
        return TrianglePosition.of(TriangleIndex.START);
    }

    /**
     * @return the end marker, it follows every position and holds no value
     */
    public TrianglePosition endIndex() {
        return TrianglePosition.unbounded();
    }

    public TrianglePosition indexAfter(final TrianglePosition position) {
        return position.next();
    }

    public TrianglePosition indexBefore(final TrianglePosition position) {
        return position.previous();
    }

    public TrianglePosition index(final TrianglePosition position, final long offset) {
        return position.offset(offset);
    }

    public long distance(final TrianglePosition from, final TrianglePosition to) {
        return from.distanceTo(to);
    }

    public Cursor<E> cursor() {
        return this.cursor(TriangleIndex.START);
    }

    public Cursor<E> cursor(final TriangleIndex from) {
        return new TriangleCursor<>(this, Objects.requireNonNull(from));
    }

    /**
     * @return an endless iterator starting at row 0
     */
    @Override
    public @NotNull Iterator<E> iterator() {
        return new Cursor.CursorAsIterator<>(this.cursor());
    }

    /**
     * @return an infinite ordered stream, limit it before any terminal operation
     */
    public Stream<E> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(
                this.iterator(),
                Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    Arithmetic<E> arithmetic() {
        return this.arithmetic;
    }

    int cachedEntries() {
        return this.cache.size();
    }

    /**
     * Resolves any coordinate, including ones outside the triangle.
     */
    E lookup(final int row, final int column) {
        if (row < 0) {
            return this.arithmetic.zero();
        } else if (column == 0 || column == row) {
            return this.base;
        } else if (column < 0 || column > row) {
            return this.arithmetic.zero();
        }
        final int left = column > row / 2 ? row - column : column;
        final TriangleIndex index = new TriangleIndex(row, left);
        final E cached = this.cache.get(index);
        return cached != null ? cached : this.fill(index);
    }

    /**
     * Sum of the columns {@code [from, to)} of a row, one lookup each.
     */
    E sumDirect(final int row, final int from, final long to) {
        E sum = this.arithmetic.zero();
        for (long column = from; column < to; ++column) {
            sum = this.arithmetic.add(sum, this.lookup(row, (int) column));
        }
        return sum;
    }

    /*
     * Computes an uncached interior value bottom-up with an explicit stack:
     * an index is summed once both of its parents are known, otherwise the
     * missing parents are pushed above it. Rows of any depth resolve without
     * growing the call stack.
     */
    private E fill(final TriangleIndex target) {
        final Map<TriangleIndex, E> filled = new HashMap<>();
        final Deque<TriangleIndex> pending = new ArrayDeque<>();
        pending.push(target);
        while (!pending.isEmpty()) {
            final TriangleIndex index = pending.peek();
            if (filled.containsKey(index)) {
                pending.pop();
                continue;
            }
            final TriangleIndex.Parents parents = index.indexesForSum();
            final TriangleIndex above = leftHalf(parents.above()),
                                aboveLeft = leftHalf(parents.aboveLeft());
            final E a = this.known(above, filled),
                    b = this.known(aboveLeft, filled);
            if (a != null && b != null) {
                filled.put(index, this.arithmetic.add(a, b));
                pending.pop();
            } else {
                if (a == null) {
                    pending.push(above);
                }
                if (b == null) {
                    pending.push(aboveLeft);
                }
            }
        }
        filled.forEach(this.cache::put);
        logger.debug("Filled {} interior values to resolve {}", filled.size(), target);
        return filled.get(target);
    }

    private @Nullable E known(final TriangleIndex index,
                              final Map<TriangleIndex, E> filled) {
        if (index.isColumnFirstOrLast()) {
            return this.base;
        }
        final E value = filled.get(index);
        return value != null ? value : this.cache.get(index);
    }

    private static TriangleIndex leftHalf(final TriangleIndex index) {
        return index.column() > index.row() / 2 ? index.mirror() : index;
    }

    @Override
    public String toString() {
        return String.format("ArithmeticTriangle{base=%s, arithmetic=%s, cached=%s}",
                this.base, this.arithmetic, this.cache.size());
    }

    private final class Row extends AbstractList<E> implements RandomAccess {
        private final int row;

        Row(final int row) {
            this.row = row;
        }

        @Override
        public E get(final int index) {
            Objects.checkIndex(index, this.size());
            return ArithmeticTriangle.this.lookup(this.row, index);
        }

        @Override
        public int size() {
            return numberOfColumns(this.row);
        }
    }
}
