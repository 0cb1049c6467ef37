package org.semantic.fixture;

import org.semantic.analysis.IAnalysis;
import org.semantic.config.EvaluatorSettings;
import org.semantic.data.Module;
import org.semantic.evaluator.Evaluator;
import org.semantic.term.ITermDecomposer;

/**
 * Shortcuts for building evaluators and modules of the test language.
 */
public final class Toy {

    public static final ITermDecomposer<ToyTerm> DECOMPOSER = ToyTerm::children;

    private Toy() {
    }

    public static Evaluator<Integer, ToyTerm, ToyValue> evaluator(IAnalysis<Integer, ToyTerm, ToyValue> analysis) {
        return new Evaluator<>(analysis, DECOMPOSER);
    }

    public static Evaluator<Integer, ToyTerm, ToyValue> evaluator(IAnalysis<Integer, ToyTerm, ToyValue> analysis,
                                                                  EvaluatorSettings settings) {
        return new Evaluator<>(analysis, DECOMPOSER, settings);
    }

    public static Module<ToyTerm> module(String name, ToyTerm... statements) {
        return Module.of(name, ToyTerm.program(statements));
    }
}
