package org.semantic.data;

/**
 * A complete, immutable description of one evaluation state.
 * Structural equality makes it usable as a key when deduplicating states.
 *
 * @param term        The term about to be evaluated.
 * @param roots       Addresses reachable from this point.
 * @param environment The local environment.
 * @param store       The heap.
 * @param <L>         Address type.
 * @param <T>         Term type.
 * @param <V>         Abstract value type.
 */
public record Configuration<L, T, V>(T term, Live<L> roots, Environment<L> environment, Store<L, V> store) {
}
