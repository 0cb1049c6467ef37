package org.semantic.evaluator;

import org.semantic.data.Environment;
import org.semantic.data.Exports;

import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Scoped access to variable bindings: the global environment, the local environment and the
 * export set of the module currently being evaluated.
 * <p>
 * Read-modify-write helpers are plain get-then-put; evaluation is single-threaded.
 *
 * @param <L> Address type.
 */
public interface IEnvironmentCapability<L> {

    /**
     * Retrieves the global environment.
     */
    Environment<L> getGlobalEnv();

    /**
     * Replaces the global environment.
     */
    void putGlobalEnv(Environment<L> environment);

    /**
     * Updates the global environment.
     */
    default void modifyGlobalEnv(UnaryOperator<Environment<L>> f) {
        putGlobalEnv(f.apply(getGlobalEnv()));
    }

    /**
     * Runs an action with the given global environment, restoring the previous one afterwards,
     * whether the action returns or throws.
     */
    default <A> A withGlobalEnv(Environment<L> environment, Supplier<A> action) {
        Environment<L> saved = getGlobalEnv();
        putGlobalEnv(environment);
        try {
            return action.get();
        } finally {
            putGlobalEnv(saved);
        }
    }

    /**
     * Retrieves the local environment.
     */
    Environment<L> askLocalEnv();

    /**
     * Runs an action under a locally transformed environment. The previous local environment
     * is in effect again once the action returns or throws.
     */
    <A> A localEnv(UnaryOperator<Environment<L>> f, Supplier<A> action);

    Exports<L> getExports();

    void putExports(Exports<L> exports);

    default void modifyExports(UnaryOperator<Exports<L>> f) {
        putExports(f.apply(getExports()));
    }

    /**
     * Runs an action with the given export set, restoring the previous one afterwards.
     */
    default <A> A withExports(Exports<L> exports, Supplier<A> action) {
        Exports<L> saved = getExports();
        putExports(exports);
        try {
            return action.get();
        } finally {
            putExports(saved);
        }
    }
}
