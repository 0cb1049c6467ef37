package org.semantic.analysis;

/**
 * Handles an {@link EvaluateModule} signal and resumes the raiser with a value.
 * The evaluator installs one for the duration of every {@code evaluateModule} call.
 *
 * @param <T> Term type.
 * @param <V> Abstract value type.
 */
@FunctionalInterface
public interface IModuleEvaluationHandler<T, V> {

    /**
     * Evaluates the requested module.
     *
     * @param signal The request.
     * @return The value the raiser resumes with.
     */
    V handle(EvaluateModule<T> signal);
}
