package org.semantic.analysis.tracing;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.semantic.analysis.Capability;
import org.semantic.analysis.CompositeAnalysis;
import org.semantic.analysis.IAnalysis;
import org.semantic.data.Configuration;
import org.semantic.evaluator.Evaluator;
import org.semantic.term.Node;
import org.semantic.term.Subterm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Records the {@link Configuration} in effect each time a term is analyzed, in evaluation order,
 * then continues with the inner analysis.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code max-entries}: stop recording after this many configurations (0 = unbounded, default).</li>
 * </ul>
 *
 * @param <L> Address type.
 * @param <T> Term type.
 * @param <V> Abstract value type.
 */
public class TracingAnalysis<L, T, V> extends CompositeAnalysis<L, T, V> {

    private final int maxEntries;
    private final List<Configuration<L, T, V>> trace = new ArrayList<>();

    public TracingAnalysis(IAnalysis<L, T, V> inner, Config options) {
        super(inner);
        this.maxEntries = options.hasPath("max-entries") ? options.getInt("max-entries") : 0;
        if (maxEntries < 0) {
            throw new IllegalArgumentException("max-entries must not be negative: " + maxEntries);
        }
    }

    public TracingAnalysis(IAnalysis<L, T, V> inner) {
        this(inner, ConfigFactory.empty());
    }

    @Override
    protected Set<Capability> ownCapabilities() {
        return EnumSet.of(Capability.ENVIRONMENT, Capability.STORE);
    }

    @Override
    public V analyzeTerm(Evaluator<L, T, V> evaluator, Node<T, Subterm<T, V>> node) {
        if (maxEntries == 0 || trace.size() < maxEntries) {
            trace.add(evaluator.getConfiguration(node.term()));
        }
        return liftAnalyzeTerm(evaluator, node);
    }

    /**
     * The recorded configurations, oldest first.
     */
    public List<Configuration<L, T, V>> getTrace() {
        return Collections.unmodifiableList(trace);
    }
}
