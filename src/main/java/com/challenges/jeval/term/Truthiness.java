package com.challenges.jeval.term;

import com.challenges.jeval.error.EvaluationException;
import com.challenges.jeval.value.Value;

/**
 * Boolean reading of a value: null is false, booleans pass through, numbers
 * are true when non-zero, collections when non-empty, and text must be a
 * boolean token.
 */
public final class Truthiness {

    private Truthiness() {
    }

    public static boolean isTruthy(Value value) {
        if (value instanceof Value.NullValue) {
            return false;
        }
        if (value instanceof Value.BoolValue b) {
            return b.value();
        }
        if (value instanceof Value.IntValue i) {
            return i.value() != 0;
        }
        if (value instanceof Value.UIntValue u) {
            return u.value() != 0;
        }
        if (value instanceof Value.FloatValue f) {
            return f.value() != 0;
        }
        if (value instanceof Value.DecimalValue d) {
            return d.value().signum() != 0;
        }
        if (value instanceof Value.StringValue s) {
            return parseBoolean(s.value());
        }
        if (value instanceof Value.ListValue list) {
            return !list.elements().isEmpty();
        }
        if (value instanceof Value.MapValue map) {
            return !map.fields().isEmpty();
        }
        return true;
    }

    private static boolean parseBoolean(String text) {
        switch (text) {
            case "1", "t", "T", "TRUE", "true", "True" -> {
                return true;
            }
            case "0", "f", "F", "FALSE", "false", "False" -> {
                return false;
            }
            default -> throw new EvaluationException("cannot read \"" + text + "\" as a boolean");
        }
    }
}
