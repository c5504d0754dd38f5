package com.challenges.jeval.query;

import com.challenges.jeval.record.Record;
import com.challenges.jeval.term.Context;
import com.challenges.jeval.term.TermEvaluator;
import com.challenges.jeval.value.Numbers;
import com.challenges.jeval.value.Value;
import com.challenges.jeval.value.Values;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Evaluates queries against records.
 *
 * <p>Field comparisons never fail: an absent field, a value that cannot be
 * coerced to the field's numeric kind, or an unsupported field kind simply does
 * not match. Only {@link Expression.Compare} nodes, through their terms, can
 * raise an {@link com.challenges.jeval.error.EvaluationException}.
 */
public class QueryEvaluator {

    private final TermEvaluator terms = new TermEvaluator();

    /** A {@code null} context evaluates as an empty one. */
    public boolean evaluate(Query query, Record record, Context context) {
        if (query.expression() == null) {
            return false;
        }
        return evaluate(query.expression(), record, context != null ? context : Context.create());
    }

    public boolean evaluate(Expression expression, Record record, Context context) {
        return evaluateNode(expression, record, context != null ? context : Context.create());
    }

    private boolean evaluateNode(Expression expression, Record record, Context context) {
        if (expression instanceof Expression.Is is) {
            return record.field(is.field())
                .map(field -> matches(field, is.value(), context))
                .orElse(false);
        }
        if (expression instanceof Expression.IsNot isNot) {
            // An absent field is not evidence of inequality
            return record.field(isNot.field())
                .map(field -> !matches(field, isNot.value(), context))
                .orElse(false);
        }
        if (expression instanceof Expression.Contains contains) {
            return record.field(contains.field())
                .map(field -> contains(field, contains.value()))
                .orElse(false);
        }
        if (expression instanceof Expression.IContains iContains) {
            return record.field(iContains.field())
                .map(field -> iContains(field, iContains.value()))
                .orElse(false);
        }
        if (expression instanceof Expression.Ordered ordered) {
            return record.field(ordered.field())
                .map(field -> ordered(field, ordered))
                .orElse(false);
        }
        if (expression instanceof Expression.And and) {
            for (Query child : and.children()) {
                if (!evaluate(child, record, context)) {
                    return false;
                }
            }
            return true;
        }
        if (expression instanceof Expression.Or or) {
            for (Query child : or.children()) {
                if (evaluate(child, record, context)) {
                    return true;
                }
            }
            return false;
        }
        if (expression instanceof Expression.Not not) {
            return !evaluate(not.child(), record, context);
        }
        if (expression instanceof Expression.Compare compare) {
            return compare(compare, record, context);
        }
        throw new IllegalArgumentException("Unsupported expression: " + expression);
    }

    private boolean matches(Value field, Value operand, Context context) {
        if (operand instanceof Value.NullValue && isNullish(field)) {
            return true;
        }
        if (Values.same(field, operand)) {
            return true;
        }
        return context.textualEquality() && Values.text(field).equals(Values.text(operand));
    }

    private static boolean isNullish(Value field) {
        if (field instanceof Value.NullValue) {
            return true;
        }
        if (field instanceof Value.ListValue list) {
            return list.elements().isEmpty();
        }
        return field instanceof Value.MapValue map && map.fields().isEmpty();
    }

    private boolean contains(Value field, Value operand) {
        if (field instanceof Value.ListValue list) {
            return list.elements().anySatisfy(
                element -> element.kind() == operand.kind() && Values.same(element, operand));
        }
        if (field instanceof Value.StringValue s) {
            return s.value().contains(Values.text(operand));
        }
        return false;
    }

    private boolean iContains(Value field, Value operand) {
        if (field instanceof Value.StringValue s) {
            return s.value().toLowerCase(Locale.ROOT).contains(Values.text(operand).toLowerCase(Locale.ROOT));
        }
        return false;
    }

    private boolean ordered(Value field, Expression.Ordered node) {
        Value operand = node.value();
        if (field instanceof Value.IntValue i) {
            Optional<Long> n = Numbers.toLong(operand);
            return n.isPresent() && node.accepts(Long.compare(i.value(), n.get()));
        }
        if (field instanceof Value.UIntValue u) {
            Optional<Long> n = Numbers.toUnsigned(operand);
            return n.isPresent() && node.accepts(Long.compareUnsigned(u.value(), n.get()));
        }
        if (field instanceof Value.FloatValue f) {
            OptionalDouble n = Numbers.toDouble(operand);
            if (n.isEmpty() || Double.isNaN(f.value()) || Double.isNaN(n.getAsDouble())) {
                return false;
            }
            return node.accepts(compareDoubles(f.value(), n.getAsDouble()));
        }
        if (field instanceof Value.DecimalValue d) {
            Optional<BigDecimal> n = Numbers.toDecimal(operand);
            return n.isPresent() && node.accepts(d.value().compareTo(n.get()));
        }
        if (field instanceof Value.StringValue s) {
            return node.accepts(Values.compareText(s.value(), node.operandText()));
        }
        return false;
    }

    private boolean compare(Expression.Compare compare, Record record, Context context) {
        Value lhs = terms.evaluate(compare.lhs(), record, context);
        Value rhs = terms.evaluate(compare.rhs(), record, context);

        return switch (compare.op()) {
            case EQ -> compareValues(lhs, rhs) == 0;
            case NEQ -> compareValues(lhs, rhs) != 0;
            case GT -> compareValues(lhs, rhs) > 0;
            case GTE -> compareValues(lhs, rhs) >= 0;
            case LT -> compareValues(lhs, rhs) < 0;
            case LTE -> compareValues(lhs, rhs) <= 0;
            case CONTAINS -> Values.text(lhs).contains(Values.text(rhs));
            case ICONTAINS -> Values.text(lhs).toLowerCase(Locale.ROOT)
                .contains(Values.text(rhs).toLowerCase(Locale.ROOT));
        };
    }

    /** Numeric order when both sides read as numbers, text order otherwise. */
    private static int compareValues(Value a, Value b) {
        OptionalDouble x = Numbers.toDouble(a);
        OptionalDouble y = Numbers.toDouble(b);
        if (x.isPresent() && y.isPresent()) {
            return compareDoubles(x.getAsDouble(), y.getAsDouble());
        }
        return Values.compareText(Values.text(a), Values.text(b));
    }

    // -0.0 and 0.0 are equal here, unlike Double.compare
    private static int compareDoubles(double a, double b) {
        if (a < b) {
            return -1;
        }
        return a > b ? 1 : 0;
    }
}
