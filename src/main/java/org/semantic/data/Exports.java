package org.semantic.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A module's declared export specification: the names it makes visible to importers, each
 * possibly renamed and possibly pinned to an explicit address.
 *
 * @param <L> Address type.
 */
public final class Exports<L> {

    /**
     * One exported name.
     *
     * @param alias   The name importers see.
     * @param address An explicit address, or empty when the export refers to the module's own binding.
     * @param <L>     Address type.
     */
    public record Export<L>(String alias, Optional<L> address) {
        public Export {
            Objects.requireNonNull(alias, "alias");
            Objects.requireNonNull(address, "address");
        }
    }

    private static final Exports<?> EMPTY = new Exports<>(Map.of());

    private final Map<String, Export<L>> exports;

    private Exports(Map<String, Export<L>> exports) {
        this.exports = exports;
    }

    @SuppressWarnings("unchecked")
    public static <L> Exports<L> empty() {
        return (Exports<L>) EMPTY;
    }

    /**
     * Declares an export.
     *
     * @param name    The name as bound inside the module.
     * @param alias   The name importers see.
     * @param address Explicit address for the export, or {@code null} to use the module's binding of {@code name}.
     * @return A new export set.
     */
    public Exports<L> insert(String name, String alias, L address) {
        Objects.requireNonNull(name, "name");
        Map<String, Export<L>> copy = new LinkedHashMap<>(exports);
        copy.put(name, new Export<>(alias, Optional.ofNullable(address)));
        return new Exports<>(Collections.unmodifiableMap(copy));
    }

    public boolean isEmpty() {
        return exports.isEmpty();
    }

    /**
     * Pairs of (name inside the module, alias seen by importers), in declaration order.
     */
    public Map<String, String> aliases() {
        Map<String, String> aliases = new LinkedHashMap<>();
        exports.forEach((name, export) -> aliases.put(name, export.alias()));
        return aliases;
    }

    /**
     * The exports that carry an explicit address, keyed by alias.
     */
    public Environment<L> toEnvironment() {
        Map<String, L> bindings = new LinkedHashMap<>();
        exports.values().forEach(export -> export.address().ifPresent(a -> bindings.put(export.alias(), a)));
        return Environment.of(bindings);
    }

    /**
     * Filters a module environment down to what importers may see.
     * Explicitly addressed exports win over renamed bindings; names outside the export set are dropped.
     * An empty export set is resolved by the given policy.
     *
     * @param environment The module's global environment after evaluation.
     * @param emptyPolicy Applied when no exports were declared.
     * @return The environment visible to importers.
     */
    public Environment<L> filter(Environment<L> environment, EmptyExportsPolicy emptyPolicy) {
        if (isEmpty()) {
            return emptyPolicy.apply(environment);
        }
        return toEnvironment().union(environment.overwrite(aliases()));
    }

    public Map<String, Export<L>> asMap() {
        return exports;
    }

    public int size() {
        return exports.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Exports<?> other)) return false;
        return exports.equals(other.exports);
    }

    @Override
    public int hashCode() {
        return exports.hashCode();
    }

    @Override
    public String toString() {
        return "Exports" + exports;
    }
}
