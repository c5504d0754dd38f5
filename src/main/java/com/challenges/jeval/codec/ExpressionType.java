package com.challenges.jeval.codec;

import com.challenges.jeval.error.SerializationException;
import com.challenges.jeval.query.Expression;
import com.challenges.jeval.value.Value;

import java.util.Optional;

/**
 * Wire discriminants. The names are part of the serialized format and must not
 * change.
 */
public enum ExpressionType {
    IS("Is"),
    IS_NOT("IsNot"),
    CONTAINS("Contains"),
    ICONTAINS("IContains"),
    AND("And"),
    OR("Or"),
    NOT("Not"),
    GT("GT"),
    GTE("GTE"),
    LT("LT"),
    LTE("LTE");

    private final String wireName;

    ExpressionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ExpressionType> fromWireName(String name) {
        for (ExpressionType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public boolean isLeaf() {
        return this != AND && this != OR && this != NOT;
    }

    public static ExpressionType of(Expression expression) {
        if (expression instanceof Expression.Is) {
            return IS;
        }
        if (expression instanceof Expression.IsNot) {
            return IS_NOT;
        }
        if (expression instanceof Expression.Contains) {
            return CONTAINS;
        }
        if (expression instanceof Expression.IContains) {
            return ICONTAINS;
        }
        if (expression instanceof Expression.GreaterThan) {
            return GT;
        }
        if (expression instanceof Expression.GreaterOrEqual) {
            return GTE;
        }
        if (expression instanceof Expression.LessThan) {
            return LT;
        }
        if (expression instanceof Expression.LessOrEqual) {
            return LTE;
        }
        if (expression instanceof Expression.And) {
            return AND;
        }
        if (expression instanceof Expression.Or) {
            return OR;
        }
        if (expression instanceof Expression.Not) {
            return NOT;
        }
        throw new SerializationException("expression has no wire form: " + expression);
    }

    /** Builds the leaf node this discriminant names. */
    Expression leaf(String field, Value value) {
        return switch (this) {
            case IS -> new Expression.Is(field, value);
            case IS_NOT -> new Expression.IsNot(field, value);
            case CONTAINS -> new Expression.Contains(field, value);
            case ICONTAINS -> new Expression.IContains(field, value);
            case GT -> new Expression.GreaterThan(field, value);
            case GTE -> new Expression.GreaterOrEqual(field, value);
            case LT -> new Expression.LessThan(field, value);
            case LTE -> new Expression.LessOrEqual(field, value);
            default -> throw new IllegalStateException(wireName + " is not a leaf");
        };
    }
}
