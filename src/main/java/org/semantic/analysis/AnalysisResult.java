package org.semantic.analysis;

import org.semantic.evaluator.EvaluatorState;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of one analysis run together with the state the evaluator ended in.
 *
 * @param outcome    Whether the run completed, and with which value or error.
 * @param finalState Environment, store and module tables at the end of the run.
 * @param <L>        Address type.
 * @param <T>        Term type.
 * @param <V>        Abstract value type.
 * @param <A>        Result type of the program that was run.
 */
public record AnalysisResult<L, T, V, A>(Outcome<A> outcome, EvaluatorState<L, T, V> finalState) {

    public AnalysisResult {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(finalState, "finalState");
    }

    public sealed interface Outcome<A> permits Completed, Failed {
    }

    /**
     * The program returned a value.
     */
    public record Completed<A>(A value) implements Outcome<A> {
    }

    /**
     * The program failed with an evaluation error.
     */
    public record Failed<A>(EvaluationException error) implements Outcome<A> {
        public Failed {
            Objects.requireNonNull(error, "error");
        }
    }

    public boolean isCompleted() {
        return outcome instanceof Completed<A>;
    }

    /**
     * The value of a completed run.
     *
     * @throws IllegalStateException if the run failed; the failure is attached as the cause.
     */
    public A value() {
        if (outcome instanceof Completed<A> completed) {
            return completed.value();
        }
        Failed<A> failed = (Failed<A>) outcome;
        throw new IllegalStateException("Analysis run failed: " + failed.error().getMessage(), failed.error());
    }

    public Optional<EvaluationException> error() {
        if (outcome instanceof Failed<A> failed) {
            return Optional.of(failed.error());
        }
        return Optional.empty();
    }
}
