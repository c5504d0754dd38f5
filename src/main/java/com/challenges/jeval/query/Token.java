package com.challenges.jeval.query;

/**
 * A lexical token. {@code position} is the zero-based offset of its first
 * character; for {@link TokenType#STRING} the text excludes the quotes.
 */
public record Token(TokenType type, String text, int position) {

    /** How the token reads in an error message. */
    String describe() {
        return type == TokenType.EOF ? "end of input" : "\"" + text + "\"";
    }
}
