package com.challenges.jeval.term;

import com.challenges.jeval.error.EvaluationException;
import com.challenges.jeval.record.Record;
import com.challenges.jeval.record.Records;
import com.challenges.jeval.value.Numbers;
import com.challenges.jeval.value.Value;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TermEvaluatorTest {

    private final TermEvaluator evaluator = new TermEvaluator();

    private static final TermFunction SUM = args -> Value.of(
        args.stream().mapToLong(arg -> Numbers.toLong(arg).orElseThrow(
            () -> new EvaluationException("not a number: " + arg))).sum());

    private Value evaluate(Term term, Object input) {
        return evaluator.evaluate(term, Records.of(input), Context.create());
    }

    private Value evaluate(Term term, Object input, Context context) {
        return evaluator.evaluate(term, Records.of(input), context);
    }

    // ============================================================
    // Leaves
    // ============================================================

    @Test
    public void testFieldAndConstant() {
        assertEquals(Value.of("bob"), evaluate(new Term.FieldTerm("name"), Map.of("name", "bob")));
        assertEquals(Value.of(7), evaluate(Term.Constant.of(7), Map.of()));
    }

    @Test
    public void testMissingFieldFails() {
        EvaluationException e = assertThrows(EvaluationException.class,
            () -> evaluate(new Term.FieldTerm("age"), Map.of("name", "bob")));
        assertEquals("field age not found", e.getMessage());
    }

    @Test
    public void testFieldOfAbsentRecordFails() {
        EvaluationException e = assertThrows(EvaluationException.class,
            () -> evaluator.evaluate(new Term.FieldTerm("x"), Record.ABSENT, Context.create()));
        assertEquals("cannot dereference value", e.getMessage());
    }

    @Test
    public void testSelf() {
        assertEquals(new Value.MapValue(Maps.immutable.of("a", Value.of(1))),
            evaluate(new Term.Self(), Map.of("a", 1)));
    }

    @Test
    public void testVariables() {
        Context context = Context.create().withVariable("limit", 10);
        assertEquals(Value.of(10), evaluate(new Term.Variable("limit"), Map.of(), context));
        assertThrows(EvaluationException.class, () -> evaluate(new Term.Variable("other"), Map.of(), context));
    }

    // ============================================================
    // Functions
    // ============================================================

    @Test
    public void testBoundFunction() {
        Term call = Term.FunctionCall.bound(SUM, new Term.FieldTerm("a"), Term.Constant.of(2));
        assertEquals(Value.of(5), evaluate(call, Map.of("a", 3)));
    }

    @Test
    public void testRegistryTakesPriorityOverBoundFunction() {
        Term call = new Term.FunctionCall("pick", args -> Value.of("bound"), Lists.immutable.empty());
        Context context = Context.create().withFunction("pick", args -> Value.of("registered"));
        assertEquals(Value.of("registered"), evaluate(call, Map.of(), context));
        assertEquals(Value.of("bound"), evaluate(call, Map.of()));
    }

    @Test
    public void testUnknownFunctionFails() {
        EvaluationException e = assertThrows(EvaluationException.class,
            () -> evaluate(Term.FunctionCall.named("nope"), Map.of()));
        assertEquals("function \"nope\" not found", e.getMessage());
    }

    @Test
    public void testFunctionErrorsPropagate() {
        Term call = Term.FunctionCall.bound(SUM, Term.Constant.of("x"));
        assertThrows(EvaluationException.class, () -> evaluate(call, Map.of()));
    }

    @Test
    public void testFunctionReceivesArgumentsInOrder() {
        List<Value> seen = new ArrayList<>();
        TermFunction capture = args -> {
            seen.addAll(args);
            return Value.NULL;
        };
        evaluate(Term.FunctionCall.bound(capture, Term.Constant.of("a"), new Term.FieldTerm("n")), Map.of("n", 1));
        assertEquals(List.of(Value.of("a"), Value.of(1)), seen);
    }

    @Test
    public void testNullResultBecomesNull() {
        assertEquals(Value.NULL, evaluate(Term.FunctionCall.bound(args -> null), Map.of()));
    }

    // ============================================================
    // Conditionals and coercion
    // ============================================================

    @Test
    public void testConditional() {
        Term cond = new Term.Conditional(new Term.FieldTerm("flag"), Term.Constant.of("yes"), Term.Constant.of("no"));
        assertEquals(Value.of("yes"), evaluate(cond, Map.of("flag", "T")));
        assertEquals(Value.of("no"), evaluate(cond, Map.of("flag", 0)));
    }

    @Test
    public void testConditionalWithoutElse() {
        Term cond = new Term.Conditional(Term.Constant.of(false), Term.Constant.of("yes"), null);
        assertEquals(Value.NULL, evaluate(cond, Map.of()));
    }

    @Test
    public void testBooleanCoercion() {
        assertEquals(Value.TRUE, evaluate(new Term.BooleanCoercion(Term.Constant.of(List.of(1))), Map.of()));
        assertEquals(Value.FALSE, evaluate(new Term.BooleanCoercion(Term.Constant.of(Map.of())), Map.of()));
    }
}
