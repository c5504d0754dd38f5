package com.challenges.jeval.query;

import com.challenges.jeval.record.Records;
import com.challenges.jeval.term.Context;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Owns one expression, or none. A query without an expression never matches.
 * Queries are the unit nested inside {@code and}/{@code or}/{@code not} and the
 * unit of serialization.
 */
public record Query(Expression expression) {

    public static final Query EMPTY = new Query(null);

    private static final QueryEvaluator EVALUATOR = new QueryEvaluator();

    public static Query of(Expression expression) {
        return new Query(expression);
    }

    public static Query and(Query... children) {
        return new Query(new Expression.And(Lists.immutable.of(children)));
    }

    public static Query or(Query... children) {
        return new Query(new Expression.Or(Lists.immutable.of(children)));
    }

    public static Query not(Query child) {
        return new Query(new Expression.Not(child));
    }

    public boolean isEmpty() {
        return expression == null;
    }

    public boolean evaluate(Object input) {
        return evaluate(input, Context.create());
    }

    /**
     * Evaluates against {@code input}, adapted with {@link Records#of(Object)}.
     * A {@code null} context acts as an empty one.
     *
     * @throws com.challenges.jeval.error.EvaluationException if a term inside the
     *         query fails
     */
    public boolean evaluate(Object input, Context context) {
        return EVALUATOR.evaluate(this, Records.of(input), context);
    }
}
