package org.semantic.analysis;

import org.semantic.data.Environment;
import org.semantic.data.Exports;
import org.semantic.data.Module;
import org.semantic.evaluator.Evaluator;
import org.semantic.term.Node;
import org.semantic.term.Subterm;

import java.util.Set;
import java.util.function.Supplier;

/**
 * An evaluation strategy over terms of type {@code T} producing abstract values of type {@code V}.
 * <p>
 * Implementations supply one algebra for term nodes and one for whole modules. Both receive
 * their children as {@link Subterm}s and decide which ones to force and when. Analyses that wrap
 * other analyses extend {@link CompositeAnalysis}.
 * <p>
 * Implementations must provide a public constructor with signature
 * {@code (IAnalysis inner, com.typesafe.config.Config options)} to be usable as a configured layer
 * (see {@link AnalysisStackBuilder}).
 *
 * @param <L> Address type.
 * @param <T> Term type.
 * @param <V> Abstract value type.
 */
public interface IAnalysis<L, T, V> {

    /**
     * The capabilities this analysis uses. Composite analyses include their inner analysis's set.
     */
    Set<Capability> requiredCapabilities();

    /**
     * Analyzes one term layer. Should only be called by {@link Evaluator#evaluateTerm} and by
     * composite analyses through {@link Lifting}.
     *
     * @param evaluator The evaluator running this analysis.
     * @param node      The term with its children as deferred subterms.
     * @return The value of the term.
     */
    V analyzeTerm(Evaluator<L, T, V> evaluator, Node<T, Subterm<T, V>> node);

    /**
     * Analyzes a module whose body is exposed as a deferred subterm, so the analysis can act before
     * and after the body is evaluated.
     *
     * @param evaluator The evaluator running this analysis.
     * @param module    The module with its body as a deferred subterm.
     * @return The value of the module.
     */
    V analyzeModule(Evaluator<L, T, V> evaluator, Module<Subterm<T, V>> module);

    /**
     * Runs an action with an empty global environment and an empty export set, restoring the
     * caller's environment and exports when the action returns or throws.
     */
    default <A> A isolate(Evaluator<L, T, V> evaluator, Supplier<A> action) {
        return evaluator.withGlobalEnv(Environment.empty(),
                () -> evaluator.withExports(Exports.empty(), action));
    }
}
