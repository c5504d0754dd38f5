package com.challenges.jeval.value;

import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Field contents and literal operands. Values are immutable snapshots; nothing
 * here refers back to the host object a value was read from.
 */
public sealed interface Value {

    NullValue NULL = new NullValue();
    BoolValue TRUE = new BoolValue(true);
    BoolValue FALSE = new BoolValue(false);

    enum Kind {
        INT, UINT, FLOAT, DECIMAL, STRING, BOOL, NULL, LIST, MAP;

        public boolean isNumeric() {
            return this == INT || this == UINT || this == FLOAT || this == DECIMAL;
        }
    }

    Kind kind();

    record StringValue(String value) implements Value {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }
    }

    sealed interface NumberValue extends Value {
        String toText();
        Number numberValue();
    }

    record IntValue(long value) implements NumberValue {
        @Override
        public Kind kind() {
            return Kind.INT;
        }

        @Override
        public String toText() {
            return Long.toString(value);
        }

        @Override
        public Number numberValue() {
            return value;
        }
    }

    /** Unsigned 64-bit integer; {@code value} holds the raw bits. */
    record UIntValue(long value) implements NumberValue {
        @Override
        public Kind kind() {
            return Kind.UINT;
        }

        @Override
        public String toText() {
            return Long.toUnsignedString(value);
        }

        @Override
        public Number numberValue() {
            return toBigInteger();
        }

        public BigInteger toBigInteger() {
            return value >= 0
                ? BigInteger.valueOf(value)
                : BigInteger.valueOf(value & Long.MAX_VALUE).setBit(63);
        }
    }

    record FloatValue(double value) implements NumberValue {
        @Override
        public Kind kind() {
            return Kind.FLOAT;
        }

        @Override
        public String toText() {
            // Whole numbers print without a fraction
            if (value == (long) value && !Double.isInfinite(value) && !Double.isNaN(value)) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }

        @Override
        public Number numberValue() {
            return value;
        }
    }

    /** Untyped numeric literal, such as a host {@link BigDecimal}. */
    record DecimalValue(BigDecimal value) implements NumberValue {
        public DecimalValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.DECIMAL;
        }

        @Override
        public String toText() {
            return value.toPlainString();
        }

        @Override
        public Number numberValue() {
            return value;
        }
    }

    record BoolValue(boolean value) implements Value {
        @Override
        public Kind kind() {
            return Kind.BOOL;
        }
    }

    record NullValue() implements Value {
        @Override
        public Kind kind() {
            return Kind.NULL;
        }
    }

    record ListValue(ImmutableList<Value> elements) implements Value {
        public ListValue {
            Objects.requireNonNull(elements, "elements");
        }

        public static ListValue empty() {
            return new ListValue(Lists.immutable.empty());
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }
    }

    record MapValue(ImmutableMap<String, Value> fields) implements Value {
        public MapValue {
            Objects.requireNonNull(fields, "fields");
        }

        public static MapValue empty() {
            return new MapValue(Maps.immutable.empty());
        }

        public MapValue with(String key, Value value) {
            return new MapValue(fields.newWithKeyValue(key, value));
        }

        @Override
        public Kind kind() {
            return Kind.MAP;
        }
    }

    static Value of(String value) {
        return new StringValue(value);
    }

    static Value of(long value) {
        return new IntValue(value);
    }

    static Value of(double value) {
        return new FloatValue(value);
    }

    static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Value list(Value... elements) {
        return new ListValue(Lists.immutable.of(elements));
    }
}
