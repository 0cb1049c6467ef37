package org.semantic.analysis;

import org.semantic.data.Module;
import org.semantic.evaluator.Evaluator;
import org.semantic.term.Node;
import org.semantic.term.Subterm;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Base class for analyses layered over another analysis.
 * <p>
 * By default every algebra delegates to the inner analysis through {@link Lifting}; subclasses
 * override the algebras they extend and call {@link #liftAnalyzeTerm} / {@link #liftAnalyzeModule}
 * to continue with the inner behavior.
 *
 * @param <L> Address type.
 * @param <T> Term type.
 * @param <V> Abstract value type.
 */
public abstract class CompositeAnalysis<L, T, V> implements IAnalysis<L, T, V> {

    private final Lifting<L, T, V> lifting;

    protected CompositeAnalysis(IAnalysis<L, T, V> inner) {
        this.lifting = new Lifting<>(inner);
    }

    /**
     * Capabilities this layer needs on top of the inner analysis's.
     */
    protected Set<Capability> ownCapabilities() {
        return EnumSet.noneOf(Capability.class);
    }

    @Override
    public final Set<Capability> requiredCapabilities() {
        Set<Capability> required = EnumSet.noneOf(Capability.class);
        required.addAll(lifting.inner().requiredCapabilities());
        required.addAll(ownCapabilities());
        return Collections.unmodifiableSet(required);
    }

    @Override
    public V analyzeTerm(Evaluator<L, T, V> evaluator, Node<T, Subterm<T, V>> node) {
        return liftAnalyzeTerm(evaluator, node);
    }

    @Override
    public V analyzeModule(Evaluator<L, T, V> evaluator, Module<Subterm<T, V>> module) {
        return liftAnalyzeModule(evaluator, module);
    }

    @Override
    public <A> A isolate(Evaluator<L, T, V> evaluator, Supplier<A> action) {
        return lifting.liftIsolate(evaluator, action);
    }

    protected final V liftAnalyzeTerm(Evaluator<L, T, V> evaluator, Node<T, Subterm<T, V>> node) {
        return lifting.liftAnalyzeTerm(evaluator).apply(node);
    }

    protected final V liftAnalyzeModule(Evaluator<L, T, V> evaluator, Module<Subterm<T, V>> module) {
        return lifting.liftAnalyzeModule(evaluator).apply(module);
    }

    public final IAnalysis<L, T, V> inner() {
        return lifting.inner();
    }
}
