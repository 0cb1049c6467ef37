package org.semantic.term;

/**
 * Collapses one layer of structure whose children are {@link Subterm}s into a result.
 *
 * @param <S> The layer shape, e.g. {@code Node<T, Subterm<T, V>>} or {@code Module<Subterm<T, V>>}.
 * @param <R> Result type.
 */
@FunctionalInterface
public interface SubtermAlgebra<S, R> {

    R apply(S shape);
}
