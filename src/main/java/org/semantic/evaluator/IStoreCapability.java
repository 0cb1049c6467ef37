package org.semantic.evaluator;

import org.semantic.data.Store;

import java.util.function.UnaryOperator;

/**
 * Access to the heap of abstract values.
 *
 * @param <L> Address type.
 * @param <V> Abstract value type.
 */
public interface IStoreCapability<L, V> {

    Store<L, V> getStore();

    void putStore(Store<L, V> store);

    default void modifyStore(UnaryOperator<Store<L, V>> f) {
        putStore(f.apply(getStore()));
    }
}
