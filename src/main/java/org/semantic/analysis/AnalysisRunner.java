package org.semantic.analysis;

import org.semantic.data.Module;
import org.semantic.evaluator.Evaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Entry point for running an assembled analysis to completion.
 * <p>
 * No runtime exception thrown while the program runs escapes: it becomes the
 * {@link AnalysisResult.Failed} outcome of the run, alongside the state the evaluator was in when
 * the failure reached the top. An {@link EvaluationException} is reported as is; any other
 * runtime exception (an analysis bug, a missing module handler) is wrapped in one, with the
 * original as its cause. Only an evaluator that cannot satisfy the analysis's capabilities is
 * rejected with an exception, before anything runs.
 */
public final class AnalysisRunner {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisRunner.class);

    private AnalysisRunner() {
    }

    /**
     * Runs a program against an evaluator.
     *
     * @param evaluator The evaluator carrying the analysis stack.
     * @param program   The computation to run, e.g. {@code ev -> ev.evaluateModules(modules)}.
     * @param <A>       Result type of the program.
     * @return The outcome and the final evaluator state.
     * @throws IllegalStateException if the analysis requires capabilities the evaluator does not provide.
     */
    public static <L, T, V, A> AnalysisResult<L, T, V, A> run(Evaluator<L, T, V> evaluator,
                                                              Function<Evaluator<L, T, V>, A> program) {
        Set<Capability> missing = EnumSet.noneOf(Capability.class);
        missing.addAll(evaluator.getAnalysis().requiredCapabilities());
        missing.removeAll(evaluator.providedCapabilities());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Analysis " + evaluator.getAnalysis().getClass().getSimpleName()
                    + " requires capabilities the evaluator does not provide: " + missing);
        }

        try {
            A value = program.apply(evaluator);
            return new AnalysisResult<>(new AnalysisResult.Completed<>(value), evaluator.snapshot());
        } catch (EvaluationException e) {
            LOG.warn("Analysis run failed: {}", e.getMessage());
            return new AnalysisResult<>(new AnalysisResult.Failed<>(e), evaluator.snapshot());
        } catch (RuntimeException e) {
            LOG.warn("Analysis run failed unexpectedly", e);
            EvaluationException wrapped = new EvaluationException("Unexpected failure during analysis: " + e, e);
            return new AnalysisResult<>(new AnalysisResult.Failed<>(wrapped), evaluator.snapshot());
        }
    }

    /**
     * Evaluates a program given as a list of modules, entry point first.
     */
    public static <L, T, V> AnalysisResult<L, T, V, V> runModules(Evaluator<L, T, V> evaluator, List<Module<T>> modules) {
        return run(evaluator, ev -> ev.evaluateModules(modules));
    }
}
