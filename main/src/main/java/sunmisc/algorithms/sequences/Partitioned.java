package sunmisc.algorithms.sequences;

import java.util.Collections;
import java.util.List;

/**
 * The two halves of a partition. For a predicate split {@code first} holds
 * the matching elements; for a cut index it holds the prefix.
 * Both lists are read-only.
 */
public record Partitioned<T>(List<T> first, List<T> second) {

    public Partitioned {
        first = Collections.unmodifiableList(first);
        second = Collections.unmodifiableList(second);
    }
}
