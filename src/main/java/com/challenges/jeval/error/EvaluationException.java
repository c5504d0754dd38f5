package com.challenges.jeval.error;

/**
 * Thrown when a term cannot produce a value: unresolved field, unknown function
 * or variable, or a function rejecting its arguments.
 */
public final class EvaluationException extends JEvalException {

    private static final long serialVersionUID = 1L;

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
