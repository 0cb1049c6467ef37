package org.semantic.analysis;

import org.semantic.data.Module;

import java.util.Objects;

/**
 * Request to evaluate a module, raised by the module loader.
 * <p>
 * This is not an error: the raiser is suspended until the innermost installed
 * {@link IModuleEvaluationHandler} evaluates the module and resumes it with the resulting value.
 *
 * @param module The module to evaluate.
 * @param <T>    Term type.
 */
public record EvaluateModule<T>(Module<T> module) {

    public EvaluateModule {
        Objects.requireNonNull(module, "module");
    }
}
