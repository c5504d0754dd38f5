package com.challenges.jeval.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Numeric coercion, one function per target kind. Each accepts any numeric
 * value, a textual decimal number and a {@link Value.DecimalValue}; anything else
 * yields an empty result. Conversions behave like numeric casts: fractions are
 * truncated toward zero and out-of-range values wrap or saturate the way the
 * corresponding primitive cast does.
 */
public final class Numbers {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d{1,4})?");
    private static final BigInteger TWO_TO_64 = BigInteger.ONE.shiftLeft(64);
    private static final double TWO_TO_63 = 0x1p63;

    private Numbers() {
    }

    public static Optional<Long> toLong(Value value) {
        if (value instanceof Value.IntValue i) {
            return Optional.of(i.value());
        }
        if (value instanceof Value.UIntValue u) {
            return Optional.of(u.value());
        }
        if (value instanceof Value.FloatValue f) {
            return Optional.of((long) f.value());
        }
        if (value instanceof Value.DecimalValue d) {
            return Optional.of(d.value().longValue());
        }
        if (value instanceof Value.StringValue s) {
            return parseDecimal(s.value()).map(BigDecimal::longValue);
        }
        return Optional.empty();
    }

    /** Coerces to an unsigned 64-bit integer, returned as raw bits. */
    public static Optional<Long> toUnsigned(Value value) {
        if (value instanceof Value.IntValue i) {
            return Optional.of(i.value());
        }
        if (value instanceof Value.UIntValue u) {
            return Optional.of(u.value());
        }
        if (value instanceof Value.FloatValue f) {
            return Optional.of(unsignedBits(f.value()));
        }
        if (value instanceof Value.DecimalValue d) {
            return Optional.of(unsignedBits(d.value()));
        }
        if (value instanceof Value.StringValue s) {
            return parseDecimal(s.value()).map(Numbers::unsignedBits);
        }
        return Optional.empty();
    }

    public static OptionalDouble toDouble(Value value) {
        if (value instanceof Value.IntValue i) {
            return OptionalDouble.of(i.value());
        }
        if (value instanceof Value.UIntValue u) {
            return OptionalDouble.of(u.toBigInteger().doubleValue());
        }
        if (value instanceof Value.FloatValue f) {
            return OptionalDouble.of(f.value());
        }
        if (value instanceof Value.DecimalValue d) {
            return OptionalDouble.of(d.value().doubleValue());
        }
        if (value instanceof Value.StringValue s) {
            Optional<BigDecimal> parsed = parseDecimal(s.value());
            return parsed.isPresent() ? OptionalDouble.of(parsed.get().doubleValue()) : OptionalDouble.empty();
        }
        return OptionalDouble.empty();
    }

    public static Optional<BigDecimal> toDecimal(Value value) {
        if (value instanceof Value.IntValue i) {
            return Optional.of(BigDecimal.valueOf(i.value()));
        }
        if (value instanceof Value.UIntValue u) {
            return Optional.of(new BigDecimal(u.toBigInteger()));
        }
        if (value instanceof Value.FloatValue f) {
            double d = f.value();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Optional.empty();
            }
            return Optional.of(BigDecimal.valueOf(d));
        }
        if (value instanceof Value.DecimalValue d) {
            return Optional.of(d.value());
        }
        if (value instanceof Value.StringValue s) {
            return parseDecimal(s.value());
        }
        return Optional.empty();
    }

    /**
     * Parses plain decimal notation only; {@code NaN}, {@code Infinity}, hex and
     * type suffixes are not numbers here.
     */
    public static Optional<BigDecimal> parseDecimal(String text) {
        if (!DECIMAL.matcher(text).matches()) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(text));
    }

    /** True if {@code text} is plain decimal notation. */
    public static boolean isDecimal(String text) {
        return DECIMAL.matcher(text).matches();
    }

    private static long unsignedBits(double d) {
        if (d >= TWO_TO_63) {
            return (long) (d - TWO_TO_63) | Long.MIN_VALUE;
        }
        return (long) d;
    }

    private static long unsignedBits(BigDecimal d) {
        return d.toBigInteger().mod(TWO_TO_64).longValue();
    }
}
