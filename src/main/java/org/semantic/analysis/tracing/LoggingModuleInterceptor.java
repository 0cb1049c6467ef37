package org.semantic.analysis.tracing;

import org.semantic.analysis.IModuleEvaluationInterceptor;
import org.semantic.data.Module;
import org.semantic.data.ModuleName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Logs every module evaluated through an import, with its duration, and remembers the order in
 * which modules were entered.
 *
 * @param <T> Term type.
 * @param <V> Abstract value type.
 */
public class LoggingModuleInterceptor<T, V> implements IModuleEvaluationInterceptor<T, V> {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingModuleInterceptor.class);

    private final List<ModuleName> evaluationOrder = new ArrayList<>();
    private int depth;

    @Override
    public V intercept(Module<T> module, Function<Module<T>, V> proceed) {
        evaluationOrder.add(module.name());
        LOG.debug("{}> evaluating module {} ({})", "-".repeat(depth), module.name(), module.path());
        long start = System.nanoTime();
        depth++;
        try {
            return proceed.apply(module);
        } finally {
            depth--;
            LOG.debug("{}< module {} done in {} us", "-".repeat(depth), module.name(), (System.nanoTime() - start) / 1_000);
        }
    }

    /**
     * Names of the intercepted modules in the order their evaluation started.
     */
    public List<ModuleName> getEvaluationOrder() {
        return Collections.unmodifiableList(evaluationOrder);
    }
}
