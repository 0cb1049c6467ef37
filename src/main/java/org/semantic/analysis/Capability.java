package org.semantic.analysis;

/**
 * Named operation sets a computation may depend on.
 * An analysis declares the ones it needs; the runner refuses to start an analysis whose
 * requirements the evaluator does not provide.
 */
public enum Capability {
    /** Global and local environments and the export set. */
    ENVIRONMENT,
    /** The heap. */
    STORE,
    /** Pending and evaluated module tables. */
    MODULE_TABLE,
    /** Failing the run with an {@link EvaluationException}. */
    FAILURE,
    /** Raising and handling {@link EvaluateModule} signals. */
    MODULE_EVALUATION
}
