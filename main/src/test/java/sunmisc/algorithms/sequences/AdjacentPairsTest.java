package sunmisc.algorithms.sequences;

import org.hamcrest.CoreMatchers;
import org.hamcrest.MatcherAssert;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

public final class AdjacentPairsTest {

    private static List<Integer> upTo(final int n) {
        return IntStream.range(0, n).boxed().collect(Collectors.toList());
    }

    private static <T> List<Pair<T>> lazily(final Iterable<T> source, final boolean wrapping) {
        final List<Pair<T>> result = new ArrayList<>();
        AdjacentPairs.pairs(source, wrapping).forEach(result::add);
        return result;
    }

    private static Iterable<Integer> once(final List<Integer> source) {
        return source::iterator;
    }

    @Test
    public void pairSmallSequences() {
        MatcherAssert.assertThat(lazily(once(upTo(0)), false), CoreMatchers.equalTo(List.of()));
        MatcherAssert.assertThat(lazily(once(upTo(0)), true), CoreMatchers.equalTo(List.of()));
        MatcherAssert.assertThat(lazily(once(upTo(1)), false), CoreMatchers.equalTo(List.of()));
        MatcherAssert.assertThat(
                lazily(once(upTo(1)), true),
                CoreMatchers.equalTo(List.of(new Pair<>(0, 0)))
        );
        MatcherAssert.assertThat(
                lazily(once(upTo(2)), false),
                CoreMatchers.equalTo(List.of(new Pair<>(0, 1)))
        );
        MatcherAssert.assertThat(
                lazily(once(upTo(2)), true),
                CoreMatchers.equalTo(List.of(new Pair<>(0, 1), new Pair<>(1, 0)))
        );
        MatcherAssert.assertThat(
                lazily(once(upTo(3)), true),
                CoreMatchers.equalTo(List.of(new Pair<>(0, 1), new Pair<>(1, 2), new Pair<>(2, 0)))
        );
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 5, 16, 100})
    public void pairManyElements(final int n) {
        final List<Pair<Integer>> expected = new ArrayList<>();
        for (int i = 0; i + 1 < n; ++i) {
            expected.add(new Pair<>(i, i + 1));
        }
        MatcherAssert.assertThat(lazily(once(upTo(n)), false), CoreMatchers.equalTo(expected));
        MatcherAssert.assertThat(AdjacentPairs.pairs(upTo(n)), CoreMatchers.equalTo(expected));

        expected.add(new Pair<>(n - 1, 0));
        MatcherAssert.assertThat(lazily(once(upTo(n)), true), CoreMatchers.equalTo(expected));
        MatcherAssert.assertThat(AdjacentPairs.pairs(upTo(n), true), CoreMatchers.equalTo(expected));
    }

    @Test
    public void viewListPairs() {
        MatcherAssert.assertThat(AdjacentPairs.pairs(upTo(0), true).size(), CoreMatchers.equalTo(0));
        MatcherAssert.assertThat(AdjacentPairs.pairs(upTo(1), false).size(), CoreMatchers.equalTo(0));
        MatcherAssert.assertThat(
                AdjacentPairs.pairs(upTo(1), true),
                CoreMatchers.equalTo(List.of(new Pair<>(0, 0)))
        );
        final List<Pair<Integer>> pairs = AdjacentPairs.pairs(upTo(4), true);
        MatcherAssert.assertThat(pairs.get(3), CoreMatchers.equalTo(new Pair<>(3, 0)));
        MatcherAssert.assertThat(pairs.get(1), CoreMatchers.equalTo(new Pair<>(1, 2)));
    }

    @Test
    public void pairInfiniteSource() {
        final Iterable<Integer> naturals = () -> Stream.iterate(0, i -> i + 1).iterator();
        final Iterator<Pair<Integer>> pairs = AdjacentPairs.pairs(naturals, true).iterator();
        for (int i = 0; i < 1000; ++i) {
            MatcherAssert.assertThat(pairs.next(), CoreMatchers.equalTo(new Pair<>(i, i + 1)));
        }
    }
}
