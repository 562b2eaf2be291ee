package sunmisc.algorithms.triangle;

import org.jetbrains.annotations.NotNull;
import sunmisc.algorithms.Scalar;
import sunmisc.algorithms.cursor.Cursor;
import sunmisc.algorithms.lazy.SimpleLazy;

/**
 * Walks the triangle row by row, left to right, without end. The element
 * under a cursor is looked up on first access only.
 */
final class TriangleCursor<E> implements Cursor<E> {
    private final ArithmeticTriangle<E> triangle;
    private final TriangleIndex index;
    private final Scalar<E, RuntimeException> element;

    TriangleCursor(final ArithmeticTriangle<E> triangle, final TriangleIndex index) {
        this.triangle = triangle;
        this.index = index;
        this.element = new SimpleLazy<>(() -> triangle.get(index));
    }

    @Override
    public boolean exists() {
        return true;
    }

    @Override
    public E element() {
        return this.element.value();
    }

    @Override
    public @NotNull Cursor<E> next() {
        return new TriangleCursor<>(this.triangle, this.index.next());
    }

    @Override
    public String toString() {
        return "cursor at " + this.index;
    }
}
