package com.challenges.jeval.error;

/** Thrown when a query cannot be encoded to, or decoded from, its wire form. */
public final class SerializationException extends JEvalException {

    private static final long serialVersionUID = 1L;

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
