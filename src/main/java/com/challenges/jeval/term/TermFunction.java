package com.challenges.jeval.term;

import com.challenges.jeval.error.EvaluationException;
import com.challenges.jeval.value.Value;

import java.util.List;

/** A function callable from a {@link Term.FunctionCall}. */
@FunctionalInterface
public interface TermFunction {

    /**
     * @param args the evaluated arguments, in order
     * @throws EvaluationException if the arguments are not acceptable
     */
    Value call(List<Value> args);
}
