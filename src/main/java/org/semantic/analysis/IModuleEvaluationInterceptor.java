package org.semantic.analysis;

import org.semantic.data.Module;

import java.util.function.Function;

/**
 * Intercepts the evaluation of modules requested through {@link EvaluateModule} signals.
 * <p>
 * Interceptors are called in registration order (chaining). Each one receives the module and a
 * {@code proceed} function that runs the rest of the chain and finally the real evaluation.
 * An interceptor may trace the call, pass a different module to {@code proceed}, or skip
 * {@code proceed} entirely and return a value of its own.
 *
 * @param <T> Term type.
 * @param <V> Abstract value type.
 */
@FunctionalInterface
public interface IModuleEvaluationInterceptor<T, V> {

    V intercept(Module<T> module, Function<Module<T>, V> proceed);
}
