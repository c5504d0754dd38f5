package com.challenges.jeval.term;

import com.challenges.jeval.error.EvaluationException;
import com.challenges.jeval.record.Record;
import com.challenges.jeval.value.Value;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Evaluates {@link Term}s against a record. Every failure surfaces as an
 * {@link EvaluationException} and aborts the evaluation.
 */
public class TermEvaluator {

    public Value evaluate(Term term, Record input, Context context) {
        if (term instanceof Term.FieldTerm f) {
            return field(f, input);
        }
        if (term instanceof Term.Constant c) {
            return c.value();
        }
        if (term instanceof Term.Self) {
            return input.snapshot();
        }
        if (term instanceof Term.Variable v) {
            return context.variable(v.name())
                .orElseThrow(() -> new EvaluationException("variable " + v.name() + " not defined"));
        }
        if (term instanceof Term.FunctionCall call) {
            return call(call, input, context);
        }
        if (term instanceof Term.Conditional cond) {
            if (Truthiness.isTruthy(evaluate(cond.condition(), input, context))) {
                return evaluate(cond.then(), input, context);
            }
            return cond.otherwise() != null ? evaluate(cond.otherwise(), input, context) : Value.NULL;
        }
        if (term instanceof Term.BooleanCoercion b) {
            return Value.of(Truthiness.isTruthy(evaluate(b.term(), input, context)));
        }
        throw new IllegalArgumentException("Unsupported term: " + term);
    }

    private Value field(Term.FieldTerm term, Record input) {
        if (input == Record.ABSENT) {
            throw new EvaluationException("cannot dereference value");
        }
        return input.field(term.name())
            .orElseThrow(() -> new EvaluationException("field " + term.name() + " not found"));
    }

    private Value call(Term.FunctionCall call, Record input, Context context) {
        TermFunction function = null;
        if (call.name() != null && !call.name().isEmpty()) {
            function = context.function(call.name()).orElse(null);
        }
        if (function == null) {
            function = call.function();
        }
        if (function == null) {
            throw new EvaluationException("function \"" + (call.name() == null ? "" : call.name()) + "\" not found");
        }

        MutableList<Value> args = Lists.mutable.withInitialCapacity(call.args().size());
        for (Term arg : call.args()) {
            args.add(evaluate(arg, input, context));
        }
        Value result = function.call(args.asUnmodifiable());
        return result == null ? Value.NULL : result;
    }
}
