package com.challenges.jeval.query;

import com.challenges.jeval.term.Term;
import com.challenges.jeval.value.Value;
import com.challenges.jeval.value.Values;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;

/**
 * Boolean-valued query nodes. Trees are immutable and may be evaluated by any
 * number of threads at once.
 */
public sealed interface Expression {

    /** A test of one named field against a literal operand. */
    sealed interface FieldComparison extends Expression {
        String field();

        Value value();
    }

    record Is(String field, Value value) implements FieldComparison {
        public Is {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }
    }

    record IsNot(String field, Value value) implements FieldComparison {
        public IsNot {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }
    }

    record Contains(String field, Value value) implements FieldComparison {
        public Contains {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }
    }

    record IContains(String field, Value value) implements FieldComparison {
        public IContains {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Ordered comparison. The operand's textual form, used against textual
     * fields, is computed once here.
     */
    abstract sealed class Ordered implements FieldComparison
            permits GreaterThan, GreaterOrEqual, LessThan, LessOrEqual {
        private final String field;
        private final Value value;
        private final String operandText;

        Ordered(String field, Value value) {
            this.field = Objects.requireNonNull(field, "field");
            this.value = Objects.requireNonNull(value, "value");
            this.operandText = Values.text(value);
        }

        @Override
        public String field() {
            return field;
        }

        @Override
        public Value value() {
            return value;
        }

        public String operandText() {
            return operandText;
        }

        /** Whether a field-versus-operand comparison result satisfies this node. */
        public abstract boolean accepts(int comparison);

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Ordered other = (Ordered) o;
            return field.equals(other.field) && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getClass(), field, value);
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "[field=" + field + ", value=" + value + "]";
        }
    }

    final class GreaterThan extends Ordered {
        public GreaterThan(String field, Value value) {
            super(field, value);
        }

        @Override
        public boolean accepts(int comparison) {
            return comparison > 0;
        }
    }

    final class GreaterOrEqual extends Ordered {
        public GreaterOrEqual(String field, Value value) {
            super(field, value);
        }

        @Override
        public boolean accepts(int comparison) {
            return comparison >= 0;
        }
    }

    final class LessThan extends Ordered {
        public LessThan(String field, Value value) {
            super(field, value);
        }

        @Override
        public boolean accepts(int comparison) {
            return comparison < 0;
        }
    }

    final class LessOrEqual extends Ordered {
        public LessOrEqual(String field, Value value) {
            super(field, value);
        }

        @Override
        public boolean accepts(int comparison) {
            return comparison <= 0;
        }
    }

    record And(ImmutableList<Query> children) implements Expression {
        public And {
            Objects.requireNonNull(children, "children");
        }
    }

    record Or(ImmutableList<Query> children) implements Expression {
        public Or {
            Objects.requireNonNull(children, "children");
        }
    }

    record Not(Query child) implements Expression {
        public Not {
            Objects.requireNonNull(child, "child");
        }
    }

    enum CompareOp {
        EQ, NEQ, GT, GTE, LT, LTE, CONTAINS, ICONTAINS
    }

    /**
     * Compares two computed terms. Errors from either term abort the enclosing
     * query. Has no wire or text form.
     */
    record Compare(Term lhs, CompareOp op, Term rhs) implements Expression {
        public Compare {
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(rhs, "rhs");
        }
    }
}
