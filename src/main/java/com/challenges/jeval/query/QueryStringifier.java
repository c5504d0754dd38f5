package com.challenges.jeval.query;

import com.challenges.jeval.value.Value;
import com.challenges.jeval.value.Values;

import java.math.BigDecimal;

/**
 * Renders queries in canonical text form: every {@code and}/{@code or} group in
 * parentheses, strings in double quotes, floats with a decimal point. Parsing
 * the output yields an equivalent tree.
 *
 * <p>Strings are written verbatim; a string containing {@code "} does not
 * survive the trip back through {@link QueryParser}.
 */
public class QueryStringifier {

    public String stringify(Query query) {
        if (query.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        append(sb, query.expression());
        return sb.toString();
    }

    private void append(StringBuilder sb, Expression expression) {
        if (expression instanceof Expression.And and) {
            appendGroup(sb, and.children(), " and ");
        } else if (expression instanceof Expression.Or or) {
            appendGroup(sb, or.children(), " or ");
        } else if (expression instanceof Expression.Not not) {
            sb.append("not ");
            appendChild(sb, not.child());
        } else if (expression instanceof Expression.FieldComparison leaf) {
            sb.append(leaf.field()).append(' ').append(operator(leaf)).append(' ');
            appendValue(sb, leaf.value());
        } else {
            throw new IllegalArgumentException("expression has no text form: " + expression);
        }
    }

    private void appendGroup(StringBuilder sb, Iterable<Query> children, String separator) {
        sb.append('(');
        boolean first = true;
        for (Query child : children) {
            if (!first) {
                sb.append(separator);
            }
            first = false;
            appendChild(sb, child);
        }
        sb.append(')');
    }

    private void appendChild(StringBuilder sb, Query child) {
        if (!child.isEmpty()) {
            append(sb, child.expression());
        }
    }

    private static String operator(Expression.FieldComparison leaf) {
        if (leaf instanceof Expression.Is) {
            return "is";
        }
        if (leaf instanceof Expression.IsNot) {
            return "is not";
        }
        if (leaf instanceof Expression.Contains) {
            return "contains";
        }
        if (leaf instanceof Expression.GreaterThan) {
            return ">";
        }
        if (leaf instanceof Expression.GreaterOrEqual) {
            return ">=";
        }
        if (leaf instanceof Expression.LessThan) {
            return "<";
        }
        if (leaf instanceof Expression.LessOrEqual) {
            return "<=";
        }
        // IContains has no keyword
        throw new IllegalArgumentException("expression has no text form: " + leaf);
    }

    private static void appendValue(StringBuilder sb, Value value) {
        if (value instanceof Value.StringValue s) {
            sb.append('"').append(s.value()).append('"');
        } else if (value instanceof Value.FloatValue f && Double.isFinite(f.value())) {
            String plain = BigDecimal.valueOf(f.value()).stripTrailingZeros().toPlainString();
            sb.append(plain);
            if (plain.indexOf('.') < 0) {
                sb.append(".0");
            }
        } else {
            sb.append(Values.text(value));
        }
    }
}
