package org.semantic.analysis;

import org.semantic.data.EmptyExportsPolicy;
import org.semantic.data.Environment;
import org.semantic.data.MergePolicy;
import org.semantic.data.Module;
import org.semantic.data.ModuleName;
import org.semantic.evaluator.Evaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves module names to the environments they export, evaluating each module on demand.
 * <p>
 * Evaluation goes through {@link EvaluateModule} signals, so whatever handler and interceptors are
 * installed on the evaluator decide how a module is actually evaluated. The exported environment
 * of every candidate is cached as soon as that candidate finishes, which is what lets circular
 * imports see a partial environment instead of recursing: a name that is already being loaded
 * resolves to whatever has been cached for it so far.
 *
 * @param <L> Address type.
 * @param <T> Term type.
 * @param <V> Abstract value type.
 */
public final class ModuleLoader<L, T, V> {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleLoader.class);

    private final Evaluator<L, T, V> evaluator;
    private final EmptyExportsPolicy emptyExportsPolicy;
    private final MergePolicy mergePolicy;
    private final Set<ModuleName> loading = new LinkedHashSet<>();

    public ModuleLoader(Evaluator<L, T, V> evaluator, EmptyExportsPolicy emptyExportsPolicy, MergePolicy mergePolicy) {
        this.evaluator = evaluator;
        this.emptyExportsPolicy = emptyExportsPolicy;
        this.mergePolicy = mergePolicy;
    }

    /**
     * Returns the cached environment of a module, loading it first if it was never evaluated.
     *
     * @param name The module to import.
     * @return The environment the module exports.
     * @throws ModuleNotFoundException if the module is neither cached nor available for import.
     */
    public Environment<L> require(ModuleName name) {
        Optional<Environment<L>> cached = cachedEnvironment(name);
        if (cached.isPresent()) {
            LOG.debug("Module {} served from cache", name);
            return cached.get();
        }
        return load(name);
    }

    /**
     * Evaluates every candidate registered under a name and returns their combined exports.
     *
     * @param name The module to load.
     * @return The combined exported environment; empty if the name has no candidates.
     * @throws ModuleNotFoundException if the name is not in the table of modules available for import.
     */
    public Environment<L> load(ModuleName name) {
        List<Module<T>> candidates = evaluator.askModuleTable().lookup(name)
                .orElseThrow(() -> new ModuleNotFoundException(name));

        if (!loading.add(name)) {
            LOG.debug("Circular import of module {} (loading: {}), using partial environment", name, loading);
            return cachedEnvironment(name).orElse(Environment.empty());
        }
        try {
            Environment<L> accumulated = Environment.empty();
            for (Module<T> candidate : candidates) {
                LOG.debug("Loading module {} from {}", name, candidate.path());
                evaluator.raise(new EvaluateModule<>(candidate));

                Environment<L> visible = evaluator.getExports().filter(evaluator.getGlobalEnv(), emptyExportsPolicy);
                evaluator.modifyModuleTable(table -> table.insert(name, visible));
                accumulated = accumulated.merge(visible, mergePolicy);
            }
            return accumulated;
        } finally {
            loading.remove(name);
        }
    }

    /**
     * The cache entry for a name, with all cached environments combined under the merge policy.
     */
    public Optional<Environment<L>> cachedEnvironment(ModuleName name) {
        return evaluator.getModuleTable().lookup(name).map(this::combine);
    }

    private Environment<L> combine(List<Environment<L>> environments) {
        Environment<L> combined = Environment.empty();
        for (Environment<L> environment : environments) {
            combined = combined.merge(environment, mergePolicy);
        }
        return combined;
    }
}
