package sunmisc.algorithms.triangle;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public enum CacheMode {
    /**
     * Nothing is written back: every lookup derives its ancestors again,
     * which costs O(row * column) per call but keeps memory flat.
     */
    NONE {
        @Override
        <E> TriangleCache<E> create() {
            return new Discarding<>();
        }
    },
    /**
     * A plain hash map for a triangle confined to one thread.
     */
    PLAIN {
        @Override
        <E> TriangleCache<E> create() {
            return new Mapped<>(new HashMap<>());
        }
    },
    /**
     * Safe to share between threads, racing fills store equal values.
     */
    CONCURRENT {
        @Override
        <E> TriangleCache<E> create() {
            return new Mapped<>(new ConcurrentHashMap<>());
        }
    };

    abstract <E> TriangleCache<E> create();


    private static final class Mapped<E> implements TriangleCache<E> {
        private final Map<TriangleIndex, E> values;

        Mapped(final Map<TriangleIndex, E> values) {
            this.values = values;
        }

        @Override
        public @Nullable E get(final @NotNull TriangleIndex index) {
            return this.values.get(index);
        }

        @Override
        public void put(final @NotNull TriangleIndex index, final @NotNull E value) {
            this.values.put(index, value);
        }

        @Override
        public int size() {
            return this.values.size();
        }
    }

    private static final class Discarding<E> implements TriangleCache<E> {

        @Override
        public @Nullable E get(final @NotNull TriangleIndex index) {
            return null;
        }

        @Override
        public void put(final @NotNull TriangleIndex index, final @NotNull E value) { }

        @Override
        public int size() {
            return 0;
        }
    }
}
