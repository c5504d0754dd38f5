package com.challenges.jeval.query;

import com.challenges.jeval.error.ParseException;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Splits query text into tokens. Keywords are lowercase and only count when
 * followed by a delimiter, so {@code android} is an identifier. The token list
 * always ends with {@link TokenType#EOF}.
 */
public final class QueryLexer {

    private final String text;
    private int pos;

    public QueryLexer(String text) {
        this.text = text;
    }

    public ImmutableList<Token> tokenize() {
        MutableList<Token> tokens = Lists.mutable.empty();
        pos = 0;
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens.toImmutable();
            }
            tokens.add(nextToken());
        }
    }

    private Token nextToken() {
        int start = pos;

        // "is not" before "is"
        int isNotEnd = matchIsNot();
        if (isNotEnd > 0) {
            pos = isNotEnd;
            return new Token(TokenType.IS_NOT, "is not", start);
        }
        if (matchKeyword("and")) {
            return new Token(TokenType.AND, "and", start);
        }
        if (matchKeyword("or")) {
            return new Token(TokenType.OR, "or", start);
        }
        if (matchKeyword("not")) {
            return new Token(TokenType.NOT, "not", start);
        }
        if (matchKeyword("is")) {
            return new Token(TokenType.IS, "is", start);
        }
        if (matchKeyword("contains")) {
            return new Token(TokenType.CONTAINS, "contains", start);
        }

        char ch = text.charAt(pos);
        if (ch == '>') {
            return operator(peek(1) == '=' ? TokenType.GTE : TokenType.GT, start);
        }
        if (ch == '<') {
            return operator(peek(1) == '=' ? TokenType.LTE : TokenType.LT, start);
        }
        if (ch == '(') {
            pos++;
            return new Token(TokenType.LPAREN, "(", start);
        }
        if (ch == ')') {
            pos++;
            return new Token(TokenType.RPAREN, ")", start);
        }
        if (ch == '"') {
            return scanString(start);
        }
        if (isNumberStart(pos)) {
            return scanNumber(start);
        }
        while (pos < text.length() && isWordChar(text.charAt(pos))) {
            pos++;
        }
        if (pos == start) {
            throw new ParseException("unexpected character '" + ch + "'", start);
        }
        return new Token(TokenType.IDENT, text.substring(start, pos), start);
    }

    private Token operator(TokenType type, int start) {
        int length = type == TokenType.GTE || type == TokenType.LTE ? 2 : 1;
        pos += length;
        return new Token(type, text.substring(start, pos), start);
    }

    private Token scanString(int start) {
        int close = text.indexOf('"', start + 1);
        if (close < 0) {
            throw new ParseException("unterminated string", start);
        }
        pos = close + 1;
        return new Token(TokenType.STRING, text.substring(start + 1, close), start);
    }

    /** A run of digits and dots, with an optional leading minus sign. */
    private Token scanNumber(int start) {
        if (text.charAt(pos) == '-') {
            pos++;
        }
        while (pos < text.length() && (isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
            pos++;
        }
        return new Token(TokenType.NUMBER, text.substring(start, pos), start);
    }

    private boolean isNumberStart(int at) {
        char ch = text.charAt(at);
        if (ch == '-') {
            return at + 1 < text.length() && text.charAt(at + 1) != '-' && isNumberStart(at + 1);
        }
        if (isDigit(ch)) {
            return true;
        }
        return ch == '.' && at + 1 < text.length() && isDigit(text.charAt(at + 1));
    }

    private boolean matchKeyword(String keyword) {
        if (!text.startsWith(keyword, pos) || !isDelimiter(pos + keyword.length())) {
            return false;
        }
        pos += keyword.length();
        return true;
    }

    /** Returns the end offset of an "is", whitespace, "not" sequence, or -1. */
    private int matchIsNot() {
        if (!text.startsWith("is", pos)) {
            return -1;
        }
        int i = pos + 2;
        if (i >= text.length() || !Character.isWhitespace(text.charAt(i))) {
            return -1;
        }
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        if (!text.startsWith("not", i) || !isDelimiter(i + 3)) {
            return -1;
        }
        return i + 3;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private boolean isDelimiter(int at) {
        return at >= text.length() || !isWordChar(text.charAt(at));
    }

    private char peek(int offset) {
        int at = pos + offset;
        return at < text.length() ? text.charAt(at) : '\0';
    }

    private static boolean isWordChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }
}
