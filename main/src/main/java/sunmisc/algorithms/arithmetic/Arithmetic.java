package sunmisc.algorithms.arithmetic;

/**
 * Additive arithmetic over an element type that has no operators of its own.
 *
 * @param <E> element type
 */
public interface Arithmetic<E> {

    E zero();

    E add(E a, E b);

    E subtract(E a, E b);

}
