package com.challenges.jeval.query;

public enum TokenType {
    IDENT,
    STRING,
    NUMBER,
    AND,
    OR,
    NOT,
    IS,
    IS_NOT,
    CONTAINS,
    GT,
    GTE,
    LT,
    LTE,
    LPAREN,
    RPAREN,
    EOF;

    public boolean isComparisonOperator() {
        return this == IS || this == IS_NOT || this == CONTAINS
            || this == GT || this == GTE || this == LT || this == LTE;
    }

    public boolean isValue() {
        return this == IDENT || this == STRING || this == NUMBER;
    }
}
