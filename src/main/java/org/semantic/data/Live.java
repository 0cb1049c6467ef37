package org.semantic.data;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A persistent set of addresses reachable from the current point of evaluation.
 *
 * @param <L> Address type.
 */
public final class Live<L> {

    private static final Live<?> EMPTY = new Live<>(Set.of());

    private final Set<L> addresses;

    private Live(Set<L> addresses) {
        this.addresses = addresses;
    }

    @SuppressWarnings("unchecked")
    public static <L> Live<L> empty() {
        return (Live<L>) EMPTY;
    }

    public static <L> Live<L> of(Collection<? extends L> addresses) {
        if (addresses.isEmpty()) return empty();
        return new Live<>(Collections.unmodifiableSet(new LinkedHashSet<>(addresses)));
    }

    public Live<L> insert(L address) {
        Set<L> copy = new LinkedHashSet<>(addresses);
        copy.add(address);
        return new Live<>(Collections.unmodifiableSet(copy));
    }

    public Live<L> delete(L address) {
        if (!addresses.contains(address)) return this;
        Set<L> copy = new LinkedHashSet<>(addresses);
        copy.remove(address);
        return copy.isEmpty() ? empty() : new Live<>(Collections.unmodifiableSet(copy));
    }

    public Live<L> union(Live<L> other) {
        if (other.isEmpty()) return this;
        Set<L> copy = new LinkedHashSet<>(addresses);
        copy.addAll(other.addresses);
        return new Live<>(Collections.unmodifiableSet(copy));
    }

    public boolean contains(L address) {
        return addresses.contains(address);
    }

    public Set<L> addresses() {
        return addresses;
    }

    public boolean isEmpty() {
        return addresses.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Live<?> other)) return false;
        return addresses.equals(other.addresses);
    }

    @Override
    public int hashCode() {
        return addresses.hashCode();
    }

    @Override
    public String toString() {
        return "Live" + addresses;
    }
}
