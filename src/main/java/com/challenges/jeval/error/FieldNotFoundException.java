package com.challenges.jeval.error;

/** Signals that a dynamic record has no value for the requested name. */
public class FieldNotFoundException extends Exception {

    private static final long serialVersionUID = 1L;

    public FieldNotFoundException(String name) {
        super("field " + name + " not found");
    }
}
