package sunmisc.algorithms.triangle;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import sunmisc.algorithms.arithmetic.Arithmetics;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@BenchmarkMode(Mode.Throughput)
@Warmup(iterations = 2, time = 1)
@Measurement(iterations = 5, time = 1)
@Threads(4)
@Fork(1)
public class Lookups {
    private static final int ROWS = 60;

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(Lookups.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }

    private ArithmeticTriangle<Long> concurrent;
    private ArithmeticTriangle<Long> uncached;

    @Setup
    public void prepare() {
        concurrent = ArithmeticTriangle.builder(Arithmetics.LONGS)
                .cache(CacheMode.CONCURRENT)
                .build();
        uncached = ArithmeticTriangle.builder(Arithmetics.LONGS)
                .cache(CacheMode.NONE)
                .build();
    }

    @Benchmark
    public Long concurrentCache() {
        int row = ThreadLocalRandom.current().nextInt(ROWS);
        return concurrent.value(row, ThreadLocalRandom.current().nextInt(row + 1));
    }

    @Benchmark
    public Long withoutCache() {
        int row = ThreadLocalRandom.current().nextInt(ROWS);
        return uncached.value(row, ThreadLocalRandom.current().nextInt(row + 1));
    }
}
