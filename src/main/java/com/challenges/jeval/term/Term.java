package com.challenges.jeval.term;

import com.challenges.jeval.value.Value;
import com.challenges.jeval.value.Values;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * Value-producing nodes. Unlike boolean expressions, terms report failures
 * (unresolved field, unknown function) instead of answering a default.
 */
public sealed interface Term {

    record FieldTerm(String name) implements Term {
        public FieldTerm {
            Objects.requireNonNull(name, "name");
        }
    }

    record Constant(Value value) implements Term {
        public Constant {
            Objects.requireNonNull(value, "value");
        }

        public static Constant of(Object value) {
            return new Constant(Values.of(value));
        }
    }

    /** The whole input record. */
    record Self() implements Term {}

    /** A named variable from the evaluation {@link Context}. */
    record Variable(String name) implements Term {
        public Variable {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Calls the function registered in the context under {@code name}, falling
     * back to the directly bound {@code function}. Either may be null.
     */
    record FunctionCall(String name, TermFunction function, ImmutableList<Term> args) implements Term {
        public FunctionCall {
            Objects.requireNonNull(args, "args");
        }

        public static FunctionCall named(String name, Term... args) {
            return new FunctionCall(name, null, Lists.immutable.of(args));
        }

        public static FunctionCall bound(TermFunction function, Term... args) {
            return new FunctionCall(null, function, Lists.immutable.of(args));
        }
    }

    /** {@code otherwise} may be null, in which case a false condition yields null. */
    record Conditional(Term condition, Term then, Term otherwise) implements Term {
        public Conditional {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(then, "then");
        }
    }

    record BooleanCoercion(Term term) implements Term {
        public BooleanCoercion {
            Objects.requireNonNull(term, "term");
        }
    }
}
