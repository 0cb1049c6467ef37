package org.semantic.data;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A persistent mapping from variable name to storage address.
 * <p>
 * Environments are values: {@link #insert}, {@link #union}, {@link #merge} and {@link #overwrite}
 * return fresh environments, so a scope captured before a nested scope was entered stays valid
 * after the nested scope ends. Iteration order is binding order.
 *
 * @param <L> Address type.
 */
public final class Environment<L> {

    private static final Environment<?> EMPTY = new Environment<>(Map.of());

    private final Map<String, L> bindings;

    private Environment(Map<String, L> bindings) {
        this.bindings = bindings;
    }

    @SuppressWarnings("unchecked")
    public static <L> Environment<L> empty() {
        return (Environment<L>) EMPTY;
    }

    /**
     * Creates an environment from the given bindings, preserving their iteration order.
     */
    public static <L> Environment<L> of(Map<String, ? extends L> bindings) {
        if (bindings.isEmpty()) return empty();
        return new Environment<>(Collections.unmodifiableMap(new LinkedHashMap<>(bindings)));
    }

    public Optional<L> lookup(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    public boolean contains(String name) {
        return bindings.containsKey(name);
    }

    /**
     * Binds a name to an address, replacing any previous binding of that name.
     */
    public Environment<L> insert(String name, L address) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(address, "address");
        Map<String, L> copy = new LinkedHashMap<>(bindings);
        copy.put(name, address);
        return new Environment<>(Collections.unmodifiableMap(copy));
    }

    /**
     * Left-biased union: on a name collision the binding of this environment wins.
     */
    public Environment<L> union(Environment<L> other) {
        if (other.isEmpty()) return this;
        if (this.isEmpty()) return other;
        Map<String, L> copy = new LinkedHashMap<>(bindings);
        other.bindings.forEach(copy::putIfAbsent);
        return new Environment<>(Collections.unmodifiableMap(copy));
    }

    /**
     * Combines this (earlier) environment with a later one under the given collision policy.
     *
     * @param later  The environment produced after this one.
     * @param policy Decides which binding wins on a name collision.
     * @return The combined environment.
     */
    public Environment<L> merge(Environment<L> later, MergePolicy policy) {
        return switch (policy) {
            case FIRST_WINS -> this.union(later);
            case LAST_WINS -> later.union(this);
        };
    }

    /**
     * Builds a fresh environment holding, for every {@code name -> alias} pair whose name is
     * bound here, the binding {@code alias -> address(name)}. Names that are not bound are skipped,
     * and bindings not mentioned by any pair are dropped.
     *
     * @param aliases Pairs of (bound name, new name), applied in iteration order.
     * @return The renamed environment.
     */
    public Environment<L> overwrite(Map<String, String> aliases) {
        Map<String, L> renamed = new LinkedHashMap<>();
        for (Map.Entry<String, String> pair : aliases.entrySet()) {
            L address = bindings.get(pair.getKey());
            if (address != null) {
                renamed.put(pair.getValue(), address);
            }
        }
        return renamed.isEmpty() ? empty() : new Environment<>(Collections.unmodifiableMap(renamed));
    }

    /**
     * The addresses bound to the given names, as a root set.
     */
    public Live<L> roots(Collection<String> names) {
        Set<L> addresses = new LinkedHashSet<>();
        for (String name : names) {
            L address = bindings.get(name);
            if (address != null) addresses.add(address);
        }
        return Live.of(addresses);
    }

    public Set<String> names() {
        return bindings.keySet();
    }

    public Collection<L> addresses() {
        return bindings.values();
    }

    public Map<String, L> asMap() {
        return bindings;
    }

    public int size() {
        return bindings.size();
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Environment<?> other)) return false;
        return bindings.equals(other.bindings);
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public String toString() {
        return "Environment" + bindings;
    }
}
