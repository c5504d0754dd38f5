package com.challenges.jeval.error;

/**
 * Base for the exceptions raised by parsing, encoding and evaluating queries.
 * Never thrown directly.
 */
public abstract class JEvalException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected JEvalException(String message) {
        super(message);
    }

    protected JEvalException(String message, Throwable cause) {
        super(message, cause);
    }
}
