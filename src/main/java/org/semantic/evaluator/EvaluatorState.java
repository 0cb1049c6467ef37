package org.semantic.evaluator;

import org.semantic.data.Environment;
import org.semantic.data.Exports;
import org.semantic.data.Module;
import org.semantic.data.ModuleTable;
import org.semantic.data.Store;

/**
 * Immutable snapshot of everything an evaluator threads through a run.
 *
 * @param globalEnv        The global environment.
 * @param localEnv         The local environment.
 * @param exports          The export set of the module being evaluated.
 * @param store            The heap.
 * @param evaluatedModules Exported environments of evaluated modules, by name.
 * @param pendingModules   Modules available for import, by name.
 * @param <L>              Address type.
 * @param <T>              Term type.
 * @param <V>              Abstract value type.
 */
public record EvaluatorState<L, T, V>(
        Environment<L> globalEnv,
        Environment<L> localEnv,
        Exports<L> exports,
        Store<L, V> store,
        ModuleTable<Environment<L>> evaluatedModules,
        ModuleTable<Module<T>> pendingModules
) {

    public static <L, T, V> EvaluatorState<L, T, V> initial() {
        return new EvaluatorState<>(Environment.empty(), Environment.empty(), Exports.empty(),
                Store.empty(), ModuleTable.empty(), ModuleTable.empty());
    }
}
