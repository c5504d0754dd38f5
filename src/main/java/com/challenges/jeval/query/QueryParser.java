package com.challenges.jeval.query;

import com.challenges.jeval.error.ParseException;
import com.challenges.jeval.value.Numbers;
import com.challenges.jeval.value.Value;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for the textual query language.
 *
 * <pre>
 * expr       := orExpr
 * orExpr     := andExpr ("or" andExpr)*
 * andExpr    := unary ("and" unary)*
 * unary      := "not" unary | primary
 * primary    := "(" expr ")" | comparison
 * comparison := IDENT operator value
 * operator   := "is not" | "is" | "contains" | ">=" | "&lt;=" | ">" | "&lt;"
 * value      := STRING | NUMBER | IDENT
 * </pre>
 *
 * Chains of {@code and}/{@code or} fold to the left, so {@code a and b and c}
 * becomes {@code And(And(a, b), c)}. The first error aborts parsing.
 */
public class QueryParser {

    private static final Logger log = LoggerFactory.getLogger(QueryParser.class);

    public Query parse(String text) {
        ImmutableList<Token> tokens = new QueryLexer(text).tokenize();
        Cursor cursor = new Cursor(tokens);
        Query query = parseOr(cursor);
        Token trailing = cursor.peek();
        if (trailing.type() != TokenType.EOF) {
            throw new ParseException("unexpected token " + trailing.describe(), trailing.position());
        }
        log.debug("Parsed query text '{}' into {} tokens", text, tokens.size());
        return query;
    }

    private Query parseOr(Cursor cursor) {
        Query left = parseAnd(cursor);
        while (cursor.peek().type() == TokenType.OR) {
            cursor.next();
            Query right = parseAnd(cursor);
            left = Query.of(new Expression.Or(Lists.immutable.of(left, right)));
        }
        return left;
    }

    private Query parseAnd(Cursor cursor) {
        Query left = parseUnary(cursor);
        while (cursor.peek().type() == TokenType.AND) {
            cursor.next();
            Query right = parseUnary(cursor);
            left = Query.of(new Expression.And(Lists.immutable.of(left, right)));
        }
        return left;
    }

    private Query parseUnary(Cursor cursor) {
        if (cursor.peek().type() == TokenType.NOT) {
            cursor.next();
            return Query.not(parseUnary(cursor));
        }
        return parsePrimary(cursor);
    }

    private Query parsePrimary(Cursor cursor) {
        if (cursor.peek().type() != TokenType.LPAREN) {
            return parseComparison(cursor);
        }
        cursor.next();
        Query inner = parseOr(cursor);
        Token close = cursor.next();
        if (close.type() != TokenType.RPAREN) {
            throw new ParseException("expected ) but found " + close.describe(), close.position());
        }
        return inner;
    }

    private Query parseComparison(Cursor cursor) {
        Token field = cursor.next();
        if (field.type() != TokenType.IDENT) {
            throw new ParseException("expected identifier but found " + field.describe(), field.position());
        }
        Token operator = cursor.next();
        if (!operator.type().isComparisonOperator()) {
            throw new ParseException("expected operator but found " + operator.describe(), operator.position());
        }
        Token operand = cursor.next();
        if (!operand.type().isValue()) {
            throw new ParseException("expected value but found " + operand.describe(), operand.position());
        }

        String name = field.text();
        Value value = literal(operand);
        Expression expression = switch (operator.type()) {
            case IS -> new Expression.Is(name, value);
            case IS_NOT -> new Expression.IsNot(name, value);
            case CONTAINS -> new Expression.Contains(name, value);
            case GT -> new Expression.GreaterThan(name, value);
            case GTE -> new Expression.GreaterOrEqual(name, value);
            case LT -> new Expression.LessThan(name, value);
            case LTE -> new Expression.LessOrEqual(name, value);
            default -> throw new ParseException("unsupported operator " + operator.describe(), operator.position());
        };
        return Query.of(expression);
    }

    /**
     * Quoted strings stay text. Bare words and numbers become booleans, longs
     * or finite doubles when they read as one, and text otherwise.
     */
    static Value literal(Token token) {
        String text = token.text();
        if (token.type() == TokenType.STRING) {
            return Value.of(text);
        }
        if (text.equals("true")) {
            return Value.TRUE;
        }
        if (text.equals("false")) {
            return Value.FALSE;
        }
        if (Numbers.isDecimal(text)) {
            try {
                return Value.of(Long.parseLong(text));
            } catch (NumberFormatException e) {
                double d = Double.parseDouble(text);
                if (Double.isInfinite(d)) {
                    // beyond double range; the digits stay text
                    return Value.of(text);
                }
                // -0.0 has no text form distinct from 0.0
                return Value.of(d == 0 ? 0.0 : d);
            }
        }
        return Value.of(text);
    }

    /** Position in the token list; {@code next} never moves past EOF. */
    private static final class Cursor {
        private final ImmutableList<Token> tokens;
        private int index;

        Cursor(ImmutableList<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            Token token = tokens.get(index);
            if (token.type() != TokenType.EOF) {
                index++;
            }
            return token;
        }
    }
}
