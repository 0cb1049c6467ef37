package org.semantic.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An ordered, persistent table from module name to a list of entries.
 * <p>
 * Used twice by the evaluator: once for the modules available for import (entries are
 * {@link Module}s) and once as the cache of evaluated modules (entries are exported
 * {@link Environment}s). Several entries per name are legal; they are kept in insertion order.
 * <p>
 * Every operation returns a new table and leaves the receiver untouched.
 *
 * @param <X> Entry type.
 */
public final class ModuleTable<X> {

    private static final ModuleTable<?> EMPTY = new ModuleTable<>(Map.of());

    private final Map<ModuleName, List<X>> entries;

    private ModuleTable(Map<ModuleName, List<X>> entries) {
        this.entries = entries;
    }

    @SuppressWarnings("unchecked")
    public static <X> ModuleTable<X> empty() {
        return (ModuleTable<X>) EMPTY;
    }

    /**
     * Builds a table from a list of modules, grouping same-named modules in list order.
     *
     * @param modules The modules to index by name.
     * @param <B>     Module body type.
     * @return A table with one entry list per distinct module name.
     */
    public static <B> ModuleTable<Module<B>> fromModules(List<Module<B>> modules) {
        Map<ModuleName, List<Module<B>>> grouped = new LinkedHashMap<>();
        for (Module<B> module : modules) {
            grouped.computeIfAbsent(module.name(), k -> new ArrayList<>()).add(module);
        }
        return new ModuleTable<>(freeze(grouped));
    }

    /**
     * Looks up all entries registered under the given name.
     *
     * @param name The module name.
     * @return The entries in insertion order, or empty if the name is unknown.
     */
    public Optional<List<X>> lookup(ModuleName name) {
        return Optional.ofNullable(entries.get(name));
    }

    /**
     * Appends an entry under the given name.
     *
     * @param name  The module name.
     * @param entry The entry to append.
     * @return A new table containing the additional entry.
     */
    public ModuleTable<X> insert(ModuleName name, X entry) {
        Objects.requireNonNull(entry, "entry");
        Map<ModuleName, List<X>> copy = new LinkedHashMap<>(entries);
        List<X> list = new ArrayList<>(copy.getOrDefault(name, List.of()));
        list.add(entry);
        copy.put(name, list);
        return new ModuleTable<>(freeze(copy));
    }

    public boolean contains(ModuleName name) {
        return entries.containsKey(name);
    }

    /**
     * Module names in insertion order.
     */
    public Set<ModuleName> names() {
        return entries.keySet();
    }

    /**
     * Number of distinct module names.
     */
    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Read-only view of the whole table.
     */
    public Map<ModuleName, List<X>> asMap() {
        return entries;
    }

    private static <X> Map<ModuleName, List<X>> freeze(Map<ModuleName, List<X>> source) {
        Map<ModuleName, List<X>> frozen = new LinkedHashMap<>();
        source.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(frozen);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModuleTable<?> other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "ModuleTable" + entries;
    }
}
