package sunmisc.algorithms.triangle;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Memoized interior values of a triangle. Entries are never evicted and
 * never go stale: every value is a pure function of its index and the base.
 */
public interface TriangleCache<E> {

    @Nullable E get(@NotNull TriangleIndex index);

    void put(@NotNull TriangleIndex index, @NotNull E value);

    int size();
}
