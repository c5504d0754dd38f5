package com.challenges.jeval.error;

/**
 * Thrown when query text cannot be tokenized or does not follow the grammar.
 * Parsing stops at the first problem.
 */
public final class ParseException extends JEvalException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public ParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    /** Zero-based character offset of the offending input. */
    public int position() {
        return position;
    }
}
