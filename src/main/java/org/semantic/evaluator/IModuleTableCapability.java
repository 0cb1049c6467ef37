package org.semantic.evaluator;

import org.semantic.data.Environment;
import org.semantic.data.Module;
import org.semantic.data.ModuleTable;

import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Access to the two module tables: modules available for import (pending) and the exported
 * environments of modules already evaluated (cache).
 *
 * @param <L> Address type.
 * @param <T> Term type.
 */
public interface IModuleTableCapability<L, T> {

    /**
     * Retrieves the table of evaluated modules.
     */
    ModuleTable<Environment<L>> getModuleTable();

    /**
     * Updates the table of evaluated modules.
     */
    void modifyModuleTable(UnaryOperator<ModuleTable<Environment<L>>> f);

    /**
     * Retrieves the table of unevaluated modules.
     */
    ModuleTable<Module<T>> askModuleTable();

    /**
     * Runs an action with a transformed table of unevaluated modules, restoring the previous
     * table once the action returns or throws.
     */
    <A> A localModuleTable(UnaryOperator<ModuleTable<Module<T>>> f, Supplier<A> action);
}
