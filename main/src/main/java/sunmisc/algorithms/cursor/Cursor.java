package sunmisc.algorithms.cursor;

import org.jetbrains.annotations.NotNull;
import sunmisc.algorithms.Scalar;
import sunmisc.algorithms.lazy.SimpleLazy;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A persistent position in a sequence: stepping with {@link #next()} never
 * changes the cursor it was called on, so a cursor may be kept and revisited.
 * Sequences may be infinite.
 */
public interface Cursor<E> {

    Cursor<?> EMPTY = new Cursor<>() {
        @Override
        public boolean exists() {
            return false;
        }

        @Override
        public Object element() {
            throw new NoSuchElementException();
        }

        @Override
        public Cursor<Object> next() {
            throw new NoSuchElementException();
        }
    };

    boolean exists();

    E element();

    @NotNull
    Cursor<E> next();

    /**
     * Collects at most {@code count} elements starting at this cursor.
     */
    default List<E> take(final int count) {
        if (count < 0) {
            throw new IllegalArgumentException(String.format(
                    "Count must be non-negative: %s", count));
        }
        final List<E> result = new ArrayList<>(Math.min(count, 1 << 10));
        Cursor<E> cursor = this;
        for (int i = 0; i < count && cursor.exists(); ++i) {
            result.add(cursor.element());
            cursor = cursor.next();
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    static <E> Cursor<E> empty() {
        return (Cursor<E>) EMPTY;
    }

    static <E> Cursor<E> of(final Iterator<E> iterator) {
        return iterator.hasNext() ? new IteratorAsCursor<>(iterator) : empty();
    }

    /**
     * Reads the iterator lazily: each cursor pulls the next element only
     * when its successor is first requested, and remembers that successor.
     */
    final class IteratorAsCursor<E> implements Cursor<E> {
        private final E item;
        private final Scalar<Cursor<E>, RuntimeException> next;

        public IteratorAsCursor(final Iterator<E> iterator) {
            this.item = iterator.next();
            this.next = new SimpleLazy<>(() -> Cursor.of(iterator));
        }

        @Override
        public boolean exists() {
            return true;
        }

        @Override
        public E element() {
            return this.item;
        }

        @Override
        public @NotNull Cursor<E> next() {
            return this.next.value();
        }
    }

    final class CursorAsIterator<E> implements Iterator<E> {
        private Cursor<E> cursor;

        public CursorAsIterator(final Cursor<E> origin) {
            this.cursor = origin;
        }

        @Override
        public boolean hasNext() {
            return this.cursor.exists();
        }

        @Override
        public E next() {
            final Cursor<E> prev = this.cursor;
            if (!prev.exists()) {
                throw new NoSuchElementException();
            }
            this.cursor = prev.next();
            return prev.element();
        }
    }
}
