package org.semantic.term;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A term paired with the deferred value of evaluating it.
 * Forcing {@link #value()} more than once evaluates the term only once.
 *
 * @param term     The child term.
 * @param deferred Its lazily evaluated value.
 * @param <T>      Term type.
 * @param <V>      Value type.
 */
public record Subterm<T, V>(T term, Deferred<V> deferred) {

    public Subterm {
        Objects.requireNonNull(term, "term");
        Objects.requireNonNull(deferred, "deferred");
    }

    public static <T, V> Subterm<T, V> of(T term, Supplier<? extends V> evaluation) {
        return new Subterm<>(term, Deferred.of(evaluation));
    }

    /**
     * Forces evaluation of the term.
     */
    public V value() {
        return deferred.get();
    }

    public boolean isEvaluated() {
        return deferred.isForced();
    }
}
