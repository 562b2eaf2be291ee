package sunmisc.algorithms.triangle;

public final class InvalidIndexException extends IllegalArgumentException {

    public InvalidIndexException(final int row, final int column) {
        super(String.format(
                "No such position in the triangle: row %s, column %s",
                row, column)
        );
    }
}
