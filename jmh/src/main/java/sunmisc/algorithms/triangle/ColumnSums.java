package sunmisc.algorithms.triangle;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import sunmisc.algorithms.arithmetic.Arithmetics;
import sunmisc.algorithms.ranges.IntRange;

import java.math.BigInteger;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@BenchmarkMode(Mode.AverageTime)
@Warmup(iterations = 2, time = 1)
@Measurement(iterations = 5, time = 1)
@Threads(1)
@Fork(1)
public class ColumnSums {
    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(ColumnSums.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }

    @Param({"64", "512", "1024"})
    private int row;

    private ArithmeticTriangle<BigInteger> triangle;

    @Setup
    public void prepare() {
        triangle = ArithmeticTriangle.of(Arithmetics.BIG_INTEGERS);
        // warm the cache so only the summation is measured
        triangle.sumOfColumns(IntRange.all(), row);
        for (int column = 0; column <= row; ++column) {
            triangle.value(row, column);
        }
    }

    @Benchmark
    public BigInteger fullRow() {
        return triangle.sumOfColumns(IntRange.all(), row);
    }

    @Benchmark
    public BigInteger exterior() {
        return triangle.sumOfColumns(IntRange.closed(1, row - 1), row);
    }

    @Benchmark
    public BigInteger interior() {
        return triangle.sumOfColumns(IntRange.closed(2, row - 3), row);
    }

    @Benchmark
    public BigInteger partial() {
        return triangle.sumOfColumns(IntRange.closed(0, row / 3), row);
    }

    @Benchmark
    public BigInteger columnByColumn() {
        BigInteger sum = BigInteger.ZERO;
        for (int column = 1; column < row; ++column) {
            sum = sum.add(triangle.value(row, column));
        }
        return sum;
    }
}
