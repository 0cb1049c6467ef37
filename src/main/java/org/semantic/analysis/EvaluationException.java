package org.semantic.analysis;

/**
 * Thrown when evaluating a term or module fails.
 * <p>
 * The engine never recovers from an evaluation failure locally; it propagates to
 * {@link AnalysisRunner}, which reports it as the outcome of the run. Analyses signal their own
 * data errors (unbound names, ill-typed operands) with this exception or a subclass.
 */
public class EvaluationException extends RuntimeException {

    /**
     * Creates an EvaluationException with the specified message.
     *
     * @param message Description of the failure
     */
    public EvaluationException(String message) {
        super(message);
    }

    /**
     * Creates an EvaluationException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
