package org.semantic.data;

import java.util.Objects;

/**
 * Identifies a module by its logical name (usually a resolved file path or a qualified import name).
 * Used as the key of both the pending and the evaluated module tables.
 *
 * @param name The logical name that uniquely identifies a module within one analysis run.
 */
public record ModuleName(String name) {

    public ModuleName {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
        return name;
    }
}
