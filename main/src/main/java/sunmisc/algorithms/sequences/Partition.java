package sunmisc.algorithms.sequences;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

public final class Partition {

    private Partition() {}

    /**
     * Splits the source into the elements that satisfy the predicate and
     * those that do not, keeping the relative order inside each half.
     *
     * @return matching elements in {@link Partitioned#first()}, the rest in
     * {@link Partitioned#second()}
     */
    public static <T> Partitioned<T> partitioned(final Iterable<? extends T> source,
                                                 final Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate);
        final List<T> matching = new ArrayList<>(), rest = new ArrayList<>();
        for (final T e : source) {
            (predicate.test(e) ? matching : rest).add(e);
        }
        return new Partitioned<>(matching, rest);
    }

    /**
     * Splits the source into {@code [0, upTo)} and {@code [upTo, size)}.
     *
     * @throws IndexOutOfBoundsException if upTo is outside {@code [0, size]}
     */
    public static <T> Partitioned<T> partitioned(final List<? extends T> source,
                                                 final int upTo) {
        Objects.checkIndex(upTo, source.size() + 1);
        return new Partitioned<>(
                new ArrayList<>(source.subList(0, upTo)),
                new ArrayList<>(source.subList(upTo, source.size())));
    }
}
