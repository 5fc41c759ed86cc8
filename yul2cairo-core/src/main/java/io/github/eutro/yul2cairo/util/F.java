package io.github.eutro.yul2cairo.util;

/**
 * A simple unary function.
 * <p>
 * Equivalent to {@link java.util.function.Function}, but shorter to write in
 * signatures that take templates and factories.
 *
 * @param <A> The argument type.
 * @param <B> The return type.
 */
@FunctionalInterface
public interface F<A, B> {
    B apply(A a);

    default <C> F<A, C> andThen(F<B, C> g) {
        return a -> g.apply(apply(a));
    }
}
