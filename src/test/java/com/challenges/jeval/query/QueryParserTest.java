package com.challenges.jeval.query;

import com.challenges.jeval.error.ParseException;
import com.challenges.jeval.value.Value;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class QueryParserTest {

    private final QueryParser parser = new QueryParser();

    private static Query is(String field, Value value) {
        return Query.of(new Expression.Is(field, value));
    }

    private static Query and(Query left, Query right) {
        return Query.and(left, right);
    }

    private static Query or(Query left, Query right) {
        return Query.or(left, right);
    }

    private Value literal(String text) {
        Expression.FieldComparison leaf = (Expression.FieldComparison) parser.parse("x is " + text).expression();
        return leaf.value();
    }

    // ============================================================
    // Tree shape
    // ============================================================

    @Test
    public void testSingleComparison() {
        assertEquals(is("Name", Value.of("bob")), parser.parse("Name is \"bob\""));
    }

    @Test
    public void testOperators() {
        assertEquals(new Expression.IsNot("a", Value.of(1)), parser.parse("a is not 1").expression());
        assertEquals(new Expression.Contains("a", Value.of("x")), parser.parse("a contains \"x\"").expression());
        assertEquals(new Expression.GreaterThan("a", Value.of(1)), parser.parse("a > 1").expression());
        assertEquals(new Expression.GreaterOrEqual("a", Value.of(1)), parser.parse("a >= 1").expression());
        assertEquals(new Expression.LessThan("a", Value.of(1)), parser.parse("a < 1").expression());
        assertEquals(new Expression.LessOrEqual("a", Value.of(1)), parser.parse("a <= 1").expression());
    }

    @Test
    public void testChainsFoldLeft() {
        Query a = is("a", Value.of(1));
        Query b = is("b", Value.of(2));
        Query c = is("c", Value.of(3));
        Query d = is("d", Value.of(4));
        assertEquals(and(and(a, b), c), parser.parse("a is 1 and b is 2 and c is 3"));
        assertEquals(or(or(or(a, b), c), d), parser.parse("a is 1 or b is 2 or c is 3 or d is 4"));
    }

    @Test
    public void testPrecedence() {
        Query a = is("a", Value.of(1));
        Query b = is("b", Value.of(2));
        Query c = is("c", Value.of(3));
        assertEquals(or(a, and(b, c)), parser.parse("a is 1 or b is 2 and c is 3"));
        assertEquals(and(Query.not(a), b), parser.parse("not a is 1 and b is 2"));
        assertEquals(Query.not(Query.not(a)), parser.parse("not not a is 1"));
    }

    @Test
    public void testParentheses() {
        Query a = is("a", Value.of(1));
        Query b = is("b", Value.of(2));
        Query c = is("c", Value.of(3));
        assertEquals(and(or(a, b), c), parser.parse("(a is 1 or b is 2) and c is 3"));
        assertEquals(Query.not(or(a, b)), parser.parse("not (a is 1 or b is 2)"));
        assertEquals(a, parser.parse("((a is 1))"));
    }

    // ============================================================
    // Literals
    // ============================================================

    @Test
    public void testLiteralTyping() {
        assertEquals(Value.TRUE, literal("true"));
        assertEquals(Value.FALSE, literal("false"));
        assertEquals(Value.of(42), literal("42"));
        assertEquals(Value.of(-7), literal("-7"));
        assertEquals(Value.of(4.5), literal("4.5"));
        assertEquals(Value.of(0.5), literal(".5"));
        assertEquals(Value.of(1e20), literal("100000000000000000000"));
        assertEquals(Value.of("42"), literal("\"42\""));
        assertEquals(Value.of("true"), literal("\"true\""));
        assertEquals(Value.of("abc"), literal("abc"));
        assertEquals(Value.of("1.2.3"), literal("1.2.3"));
        assertEquals(Value.of("null"), literal("null"));
        assertEquals(Value.of("True"), literal("True"));
    }

    // ============================================================
    // Errors
    // ============================================================

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "''                | 0 | expected identifier but found end of input",
        "a                 | 1 | expected operator but found end of input",
        "a is              | 4 | expected value but found end of input",
        "a is and          | 5 | expected value but found \"and\"",
        "is is 1           | 0 | expected identifier but found \"is\"",
        "a b 1             | 2 | expected operator but found \"b\"",
        "(a is 1           | 7 | expected ) but found end of input",
        "a is 1 b          | 7 | unexpected token \"b\"",
        "a is 1)           | 6 | unexpected token \")\"",
        "a is 1 and        | 10 | expected identifier but found end of input",
        "not               | 3 | expected identifier but found end of input",
    })
    public void testErrorsCarryPositions(String text, int position, String message) {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse(text));
        assertEquals(position, e.position());
        assertEquals(message + " at position " + position, e.getMessage());
    }

    @Test
    public void testUnterminatedString() {
        assertThrows(ParseException.class, () -> parser.parse("Name is \"bob"));
    }

    // ============================================================
    // Parse then evaluate
    // ============================================================

    @Test
    public void testParsedQueriesEvaluate() {
        Query query = parser.parse("Name is \"bob\" and Age > 30");
        assertTrue(query.evaluate(Map.of("Name", "bob", "Age", 35)));
        assertFalse(query.evaluate(Map.of("Name", "bob", "Age", 20)));

        Query tags = parser.parse("Tags contains \"go\"");
        assertTrue(tags.evaluate(Map.of("Tags", List.of("go", "news"))));
        assertFalse(tags.evaluate(Map.of("Tags", List.of("news"))));

        assertTrue(parser.parse("not (Name is \"alice\")").evaluate(Map.of("Name", "bob")));
        assertFalse(parser.parse("Missing > 1").evaluate(Map.of("Name", "bob")));
    }
}
