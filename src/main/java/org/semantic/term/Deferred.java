package org.semantic.term;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A lazily computed value, memoized after its first successful computation.
 * A computation that throws is not memoized, so the next force runs it again.
 * <p>
 * Evaluation is single-threaded; no synchronization is performed.
 *
 * @param <V> Value type.
 */
public final class Deferred<V> implements Supplier<V> {

    private Supplier<? extends V> computation;
    private V value;
    private boolean forced;

    private Deferred(Supplier<? extends V> computation) {
        this.computation = computation;
    }

    public static <V> Deferred<V> of(Supplier<? extends V> computation) {
        Objects.requireNonNull(computation, "computation");
        return new Deferred<>(computation);
    }

    /**
     * A deferred value that is already known.
     */
    public static <V> Deferred<V> now(V value) {
        Deferred<V> deferred = new Deferred<>(null);
        deferred.value = value;
        deferred.forced = true;
        return deferred;
    }

    @Override
    public V get() {
        if (!forced) {
            value = computation.get();
            forced = true;
            computation = null;
        }
        return value;
    }

    public boolean isForced() {
        return forced;
    }
}
