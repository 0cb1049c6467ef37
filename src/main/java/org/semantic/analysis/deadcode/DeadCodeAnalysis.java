package org.semantic.analysis.deadcode;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.semantic.analysis.CompositeAnalysis;
import org.semantic.analysis.IAnalysis;
import org.semantic.data.Module;
import org.semantic.evaluator.Evaluator;
import org.semantic.term.ITermDecomposer;
import org.semantic.term.Node;
import org.semantic.term.Subterm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Reports code that is never evaluated.
 * <p>
 * On entering a module every term of its body is marked dead; each term is revived when it is
 * analyzed. Terms are tracked by identity, so two structurally equal terms at different places
 * are reported separately.
 *
 * @param <L> Address type.
 * @param <T> Term type.
 * @param <V> Abstract value type.
 */
public class DeadCodeAnalysis<L, T, V> extends CompositeAnalysis<L, T, V> {

    private final Set<T> dead = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<T> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<T> discovered = new ArrayList<>();

    public DeadCodeAnalysis(IAnalysis<L, T, V> inner, Config options) {
        super(inner);
    }

    public DeadCodeAnalysis(IAnalysis<L, T, V> inner) {
        this(inner, ConfigFactory.empty());
    }

    @Override
    public V analyzeModule(Evaluator<L, T, V> evaluator, Module<Subterm<T, V>> module) {
        killAll(module.body().term(), evaluator.getDecomposer());
        return liftAnalyzeModule(evaluator, module);
    }

    @Override
    public V analyzeTerm(Evaluator<L, T, V> evaluator, Node<T, Subterm<T, V>> node) {
        dead.remove(node.term());
        return liftAnalyzeTerm(evaluator, node);
    }

    private void killAll(T root, ITermDecomposer<T> decomposer) {
        Deque<T> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            T term = pending.pop();
            dead.add(term);
            if (seen.add(term)) {
                discovered.add(term);
            }
            List<T> children = decomposer.children(term);
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }

    /**
     * Terms never analyzed so far, in source order of discovery.
     */
    public List<T> getDeadCode() {
        List<T> result = new ArrayList<>();
        for (T term : discovered) {
            if (dead.contains(term)) result.add(term);
        }
        return result;
    }
}
