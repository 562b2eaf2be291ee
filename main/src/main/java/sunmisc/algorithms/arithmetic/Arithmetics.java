package sunmisc.algorithms.arithmetic;

import java.math.BigInteger;

public final class Arithmetics {

    /** Exact {@code long} arithmetic, overflow raises {@link ArithmeticException}. */
    public static final IntegralArithmetic<Long> LONGS = new Longs();

    /** Exact {@code int} arithmetic, overflow raises {@link ArithmeticException}. */
    public static final IntegralArithmetic<Integer> INTEGERS = new Integers();

    public static final IntegralArithmetic<BigInteger> BIG_INTEGERS = new BigIntegers();

    /** Floating point, additive only. */
    public static final Arithmetic<Double> DOUBLES = new Doubles();

    private Arithmetics() {}

    private static void checkBits(final int bits) {
        if (bits < 0) {
            throw new IllegalArgumentException(String.format(
                    "Shift distance must be non-negative: %s", bits));
        }
    }

    private static final class Longs implements IntegralArithmetic<Long> {

        @Override
        public Long zero() {
            return 0L;
        }

        @Override
        public Long one() {
            return 1L;
        }

        @Override
        public Long add(final Long a, final Long b) {
            return Math.addExact(a, b);
        }

        @Override
        public Long subtract(final Long a, final Long b) {
            return Math.subtractExact(a, b);
        }

        @Override
        public Long shiftLeft(final Long value, final int bits) {
            checkBits(bits);
            final long v = value;
            if (v == 0) {
                return 0L;
            }
            final long r = v << bits;
            // shifts of 64 and more are masked by the jvm
            if (bits >= Long.SIZE || (r >> bits) != v) {
                throw new ArithmeticException(String.format(
                        "long overflow: %s << %s", v, bits));
            }
            return r;
        }

        @Override
        public String toString() {
            return "longs";
        }
    }

    private static final class Integers implements IntegralArithmetic<Integer> {

        @Override
        public Integer zero() {
            return 0;
        }

        @Override
        public Integer one() {
            return 1;
        }

        @Override
        public Integer add(final Integer a, final Integer b) {
            return Math.addExact(a, b);
        }

        @Override
        public Integer subtract(final Integer a, final Integer b) {
            return Math.subtractExact(a, b);
        }

        @Override
        public Integer shiftLeft(final Integer value, final int bits) {
            checkBits(bits);
            final int v = value;
            if (v == 0) {
                return 0;
            }
            final int r = v << bits;
            if (bits >= Integer.SIZE || (r >> bits) != v) {
                throw new ArithmeticException(String.format(
                        "integer overflow: %s << %s", v, bits));
            }
            return r;
        }

        @Override
        public String toString() {
            return "integers";
        }
    }

    private static final class BigIntegers implements IntegralArithmetic<BigInteger> {

        @Override
        public BigInteger zero() {
            return BigInteger.ZERO;
        }

        @Override
        public BigInteger one() {
            return BigInteger.ONE;
        }

        @Override
        public BigInteger add(final BigInteger a, final BigInteger b) {
            return a.add(b);
        }

        @Override
        public BigInteger subtract(final BigInteger a, final BigInteger b) {
            return a.subtract(b);
        }

        @Override
        public BigInteger shiftLeft(final BigInteger value, final int bits) {
            checkBits(bits);
            return value.shiftLeft(bits);
        }

        @Override
        public String toString() {
            return "big integers";
        }
    }

    private static final class Doubles implements Arithmetic<Double> {

        @Override
        public Double zero() {
            return 0.0;
        }

        @Override
        public Double add(final Double a, final Double b) {
            return a + b;
        }

        @Override
        public Double subtract(final Double a, final Double b) {
            return a - b;
        }

        @Override
        public String toString() {
            return "doubles";
        }
    }
}
