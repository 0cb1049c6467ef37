package org.semantic.analysis;

import org.semantic.data.Module;
import org.semantic.evaluator.Evaluator;
import org.semantic.term.Node;
import org.semantic.term.Subterm;
import org.semantic.term.SubtermAlgebra;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Adapter that exposes the algebras of an inner analysis to the analysis wrapping it.
 * <p>
 * A composite analysis that wants "the inner analyzeTerm" must go through this adapter rather
 * than through {@link Evaluator#evaluateTerm}, which always dispatches to the outermost analysis.
 * Subterms handed down keep their deferred values, so forcing a child inside the inner algebra
 * still evaluates it with the full stack, once.
 *
 * @param <L> Address type.
 * @param <T> Term type.
 * @param <V> Abstract value type.
 */
public final class Lifting<L, T, V> {

    private final IAnalysis<L, T, V> inner;

    public Lifting(IAnalysis<L, T, V> inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    /**
     * The inner term algebra, bound to the given evaluator.
     */
    public SubtermAlgebra<Node<T, Subterm<T, V>>, V> liftAnalyzeTerm(Evaluator<L, T, V> evaluator) {
        return node -> inner.analyzeTerm(evaluator, node);
    }

    /**
     * The inner module algebra, bound to the given evaluator.
     */
    public SubtermAlgebra<Module<Subterm<T, V>>, V> liftAnalyzeModule(Evaluator<L, T, V> evaluator) {
        return module -> inner.analyzeModule(evaluator, module);
    }

    /**
     * The inner analysis's isolation of an action.
     */
    public <A> A liftIsolate(Evaluator<L, T, V> evaluator, Supplier<A> action) {
        return inner.isolate(evaluator, action);
    }

    public IAnalysis<L, T, V> inner() {
        return inner;
    }
}
