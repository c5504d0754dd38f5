package com.challenges.jeval.query;

import com.challenges.jeval.error.ParseException;
import org.eclipse.collections.api.list.ImmutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QueryLexerTest {

    private ImmutableList<Token> lex(String text) {
        return new QueryLexer(text).tokenize();
    }

    private List<TokenType> types(String text) {
        return lex(text).collect(Token::type).castToList();
    }

    @Test
    public void testSimpleComparison() {
        ImmutableList<Token> tokens = lex("Name is \"bob\"");
        assertEquals(new Token(TokenType.IDENT, "Name", 0), tokens.get(0));
        assertEquals(new Token(TokenType.IS, "is", 5), tokens.get(1));
        assertEquals(new Token(TokenType.STRING, "bob", 8), tokens.get(2));
        assertEquals(new Token(TokenType.EOF, "", 13), tokens.get(3));
        assertEquals(4, tokens.size());
    }

    @Test
    public void testOperatorsAndParentheses() {
        assertEquals(List.of(TokenType.LPAREN, TokenType.IDENT, TokenType.GTE, TokenType.NUMBER, TokenType.RPAREN,
                TokenType.OR, TokenType.IDENT, TokenType.LTE, TokenType.NUMBER, TokenType.EOF),
            types("(a>=1) or b<=2"));
        assertEquals(List.of(TokenType.IDENT, TokenType.GT, TokenType.NUMBER, TokenType.AND,
                TokenType.IDENT, TokenType.LT, TokenType.NUMBER, TokenType.EOF),
            types("a > 1 and b < 2"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a is not b", "a is   not b", "a is\tnot b", "a is\nnot b"})
    public void testIsNot(String text) {
        ImmutableList<Token> tokens = lex(text);
        assertEquals(TokenType.IS_NOT, tokens.get(1).type());
        assertEquals(TokenType.IDENT, tokens.get(2).type());
        assertEquals(2, tokens.get(1).position());
    }

    @Test
    public void testIsFollowedByWordStartingWithNot() {
        assertEquals(List.of(TokenType.IDENT, TokenType.IS, TokenType.IDENT, TokenType.EOF), types("a is notable"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"android", "order", "not_x", "isx", "contains2", "AND", "Is"})
    public void testKeywordsNeedADelimiter(String word) {
        ImmutableList<Token> tokens = lex(word);
        assertEquals(new Token(TokenType.IDENT, word, 0), tokens.get(0));
    }

    @Test
    public void testKeywordsBeforePunctuationAndEnd() {
        assertEquals(List.of(TokenType.NOT, TokenType.LPAREN, TokenType.IDENT, TokenType.CONTAINS,
                TokenType.STRING, TokenType.RPAREN, TokenType.AND, TokenType.EOF),
            types("not(a contains \"x\")and"));
    }

    @Test
    public void testNumbers() {
        assertEquals(new Token(TokenType.NUMBER, ".5", 4), lex("x < .5").get(2));
        assertEquals(new Token(TokenType.NUMBER, "1.2.3", 4), lex("x < 1.2.3").get(2));
        assertEquals(new Token(TokenType.NUMBER, "-3", 4), lex("x > -3").get(2));
        assertEquals(new Token(TokenType.NUMBER, "-.5", 4), lex("x > -.5").get(2));
    }

    @Test
    public void testNumberStopsAtLetters() {
        assertEquals(List.of(TokenType.NUMBER, TokenType.IDENT, TokenType.EOF), types("1e5"));
    }

    @Test
    public void testStringsAreVerbatim() {
        assertEquals(new Token(TokenType.STRING, "a and \\b", 0), lex("\"a and \\b\"").get(0));
        assertEquals(new Token(TokenType.STRING, "", 0), lex("\"\"").get(0));
    }

    @Test
    public void testUnterminatedString() {
        ParseException e = assertThrows(ParseException.class, () -> lex("Name is \"bob"));
        assertEquals(8, e.position());
        assertEquals("unterminated string at position 8", e.getMessage());
    }

    @Test
    public void testUnexpectedCharacter() {
        ParseException e = assertThrows(ParseException.class, () -> lex("x @ 1"));
        assertEquals(2, e.position());
        assertThrows(ParseException.class, () -> lex("x > --3"));
        assertThrows(ParseException.class, () -> lex("x = 1"));
    }

    @Test
    public void testEmptyInput() {
        assertEquals(List.of(TokenType.EOF), types(""));
        assertEquals(new Token(TokenType.EOF, "", 3), lex("   ").get(0));
    }
}
