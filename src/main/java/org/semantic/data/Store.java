package org.semantic.data;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The heap: a persistent mapping from address to the set of abstract values stored there.
 * <p>
 * An address holds a set rather than a single value because an abstract interpreter merges
 * program paths; {@link #insert} therefore joins a value into the set (weak update), while
 * {@link #assign} replaces it (strong update).
 *
 * @param <L> Address type.
 * @param <V> Abstract value type.
 */
public final class Store<L, V> {

    private static final Store<?, ?> EMPTY = new Store<>(Map.of());

    private final Map<L, Set<V>> cells;

    private Store(Map<L, Set<V>> cells) {
        this.cells = cells;
    }

    @SuppressWarnings("unchecked")
    public static <L, V> Store<L, V> empty() {
        return (Store<L, V>) EMPTY;
    }

    /**
     * The values stored at an address; empty if nothing was ever stored there.
     */
    public Set<V> lookup(L address) {
        return cells.getOrDefault(address, Set.of());
    }

    public boolean contains(L address) {
        return cells.containsKey(address);
    }

    /**
     * Joins a value into the set stored at an address.
     */
    public Store<L, V> insert(L address, V value) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(value, "value");
        Set<V> current = lookup(address);
        if (current.contains(value)) return this;
        Set<V> joined = new LinkedHashSet<>(current);
        joined.add(value);
        return with(address, joined);
    }

    /**
     * Replaces whatever is stored at an address with the given values.
     */
    public Store<L, V> assign(L address, Collection<? extends V> values) {
        Objects.requireNonNull(address, "address");
        return with(address, new LinkedHashSet<>(values));
    }

    private Store<L, V> with(L address, Set<V> values) {
        Map<L, Set<V>> copy = new LinkedHashMap<>(cells);
        copy.put(address, Collections.unmodifiableSet(values));
        return new Store<>(Collections.unmodifiableMap(copy));
    }

    public Set<L> addresses() {
        return cells.keySet();
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Store<?, ?> other)) return false;
        return cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return "Store" + cells;
    }
}
