package sunmisc.algorithms.arithmetic;

/**
 * Integer-like arithmetic. Elements of this kind get a unit value and a
 * multiply-by-power-of-two operation, which lets an arithmetic triangle sum a
 * whole row in constant time.
 *
 * @param <E> element type
 */
public interface IntegralArithmetic<E> extends Arithmetic<E> {

    E one();

    /**
     * @return {@code value * 2^bits}
     * @throws ArithmeticException if the result is not representable
     */
    E shiftLeft(E value, int bits);

}
