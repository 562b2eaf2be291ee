package sunmisc.algorithms.sequences;

import sunmisc.algorithms.cursor.Cursor;

import java.util.AbstractList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * Pairs every element with its successor: {@code 1, 2, 3} becomes
 * {@code (1, 2), (2, 3)}. When wrapping, the last element is also paired
 * with the first: {@code (3, 1)}; a single element then pairs with itself.
 */
public final class AdjacentPairs {

    private AdjacentPairs() {}

    /**
     * Lazy view, each iterator reads the source once. Infinite sources give
     * infinite pairs.
     */
    public static <T> Iterable<Pair<T>> pairs(final Iterable<T> source,
                                              final boolean wrapping) {
        Objects.requireNonNull(source);
        return () -> new PairIterator<>(Cursor.of(source.iterator()), wrapping);
    }

    public static <T> Iterable<Pair<T>> pairs(final Iterable<T> source) {
        return pairs(source, false);
    }

    /**
     * Random access view over a list, it reflects later changes of the list.
     */
    public static <T> List<Pair<T>> pairs(final List<T> source,
                                          final boolean wrapping) {
        return new PairList<>(Objects.requireNonNull(source), wrapping);
    }

    public static <T> List<Pair<T>> pairs(final List<T> source) {
        return pairs(source, false);
    }

    private static final class PairIterator<T> implements Iterator<Pair<T>> {
        private final T first;
        private final boolean wrapping;
        private Cursor<T> cursor;

        PairIterator(final Cursor<T> head, final boolean wrapping) {
            this.first = head.exists() ? head.element() : null;
            this.cursor = head;
            this.wrapping = wrapping;
        }

        @Override
        public boolean hasNext() {
            final Cursor<T> c = this.cursor;
            return c.exists() && (this.wrapping || c.next().exists());
        }

        @Override
        public Pair<T> next() {
            if (!this.hasNext()) {
                throw new NoSuchElementException();
            }
            final Cursor<T> c = this.cursor, n = c.next();
            this.cursor = n;
            return new Pair<>(c.element(), n.exists() ? n.element() : this.first);
        }
    }

    private static final class PairList<T>
            extends AbstractList<Pair<T>>
            implements RandomAccess {
        private final List<T> source;
        private final boolean wrapping;

        PairList(final List<T> source, final boolean wrapping) {
            this.source = source;
            this.wrapping = wrapping;
        }

        @Override
        public Pair<T> get(final int index) {
            Objects.checkIndex(index, this.size());
            final int n = this.source.size();
            return new Pair<>(
                    this.source.get(index),
                    this.source.get(index + 1 == n ? 0 : index + 1));
        }

        @Override
        public int size() {
            final int n = this.source.size();
            return this.wrapping ? n : Math.max(0, n - 1);
        }
    }
}
