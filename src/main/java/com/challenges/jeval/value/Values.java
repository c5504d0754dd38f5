package com.challenges.jeval.value;

import com.challenges.jeval.output.ValueFormatter;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Helpers over {@link Value}: projection of host objects, textual forms,
 * equality and text ordering.
 */
public final class Values {

    private static final ValueFormatter TEXT_FORMATTER = new ValueFormatter();

    private Values() {
    }

    /**
     * Projects a host object into a value. Records and objects with public
     * fields become maps; other unknown types fall back to their
     * {@code toString()} form. A reference back to a map, collection, array or
     * object that is still being projected reads as {@link Value#NULL}, so
     * cyclic object graphs project to finite values.
     */
    public static Value of(Object o) {
        return of(o, null);
    }

    public static Value of(BigInteger bi) {
        if (bi.bitLength() < 64) {
            return new Value.IntValue(bi.longValue());
        }
        if (bi.signum() > 0 && bi.bitLength() == 64) {
            return new Value.UIntValue(bi.longValue());
        }
        return new Value.DecimalValue(new BigDecimal(bi));
    }

    private static Value of(Object o, Set<Object> enclosing) {
        if (o == null) {
            return Value.NULL;
        }
        if (o instanceof Value v) {
            return v;
        }
        if (o instanceof CharSequence || o instanceof Character) {
            return new Value.StringValue(o.toString());
        }
        if (o instanceof Boolean b) {
            return Value.of(b.booleanValue());
        }
        if (o instanceof Long || o instanceof Integer || o instanceof Short || o instanceof Byte
                || o instanceof AtomicInteger || o instanceof AtomicLong) {
            return new Value.IntValue(((Number) o).longValue());
        }
        if (o instanceof Double || o instanceof Float) {
            return new Value.FloatValue(((Number) o).doubleValue());
        }
        if (o instanceof BigInteger bi) {
            return of(bi);
        }
        if (o instanceof BigDecimal bd) {
            return new Value.DecimalValue(bd);
        }
        if (o instanceof Number n) {
            return Numbers.parseDecimal(n.toString())
                .<Value>map(Value.DecimalValue::new)
                .orElseGet(() -> new Value.FloatValue(n.doubleValue()));
        }
        if (o instanceof Enum<?> e) {
            return new Value.StringValue(e.name());
        }
        if (o instanceof Optional<?> opt) {
            return opt.isPresent() ? of(opt.get(), enclosing) : Value.NULL;
        }
        if (o instanceof OptionalLong opt) {
            return opt.isPresent() ? new Value.IntValue(opt.getAsLong()) : Value.NULL;
        }
        if (o instanceof OptionalInt opt) {
            return opt.isPresent() ? new Value.IntValue(opt.getAsInt()) : Value.NULL;
        }
        if (o instanceof OptionalDouble opt) {
            return opt.isPresent() ? new Value.FloatValue(opt.getAsDouble()) : Value.NULL;
        }

        Set<Object> path = enclosing != null ? enclosing : Collections.newSetFromMap(new IdentityHashMap<>());
        if (!path.add(o)) {
            return Value.NULL;
        }
        try {
            return ofComposite(o, path);
        } finally {
            path.remove(o);
        }
    }

    private static Value ofComposite(Object o, Set<Object> path) {
        if (o instanceof Map<?, ?> map) {
            MutableMap<String, Value> fields = Maps.mutable.ofInitialCapacity(map.size());
            map.forEach((k, v) -> fields.put(String.valueOf(k), of(v, path)));
            return new Value.MapValue(fields.toImmutable());
        }
        if (o instanceof Collection<?> collection) {
            MutableList<Value> elements = Lists.mutable.withInitialCapacity(collection.size());
            for (Object element : collection) {
                elements.add(of(element, path));
            }
            return new Value.ListValue(elements.toImmutable());
        }
        if (o.getClass().isArray()) {
            int length = Array.getLength(o);
            MutableList<Value> elements = Lists.mutable.withInitialCapacity(length);
            for (int i = 0; i < length; i++) {
                elements.add(of(Array.get(o, i), path));
            }
            return new Value.ListValue(elements.toImmutable());
        }
        ImmutableMap<String, Members.Accessor> members = Members.of(o.getClass());
        if (members.isEmpty()) {
            return new Value.StringValue(o.toString());
        }
        MutableMap<String, Value> fields = Maps.mutable.ofInitialCapacity(members.size());
        members.forEachKeyValue((name, accessor) -> fields.put(name, of(accessor.read(o), path)));
        return new Value.MapValue(fields.toImmutable());
    }

    /**
     * Default textual form: strings as-is, numbers in their shortest decimal
     * form, {@code true}/{@code false}, {@code null}, and compact JSON with sorted
     * keys for lists and maps.
     */
    public static String text(Value value) {
        if (value instanceof Value.StringValue s) {
            return s.value();
        }
        if (value instanceof Value.NumberValue n) {
            return n.toText();
        }
        if (value instanceof Value.BoolValue b) {
            return Boolean.toString(b.value());
        }
        if (value instanceof Value.NullValue) {
            return "null";
        }
        return TEXT_FORMATTER.format(value);
    }

    /**
     * Structural equality. Beyond {@code equals}, signed and unsigned integers
     * denoting the same number are equal, and so are floats and decimals
     * denoting the same decimal.
     */
    public static boolean same(Value a, Value b) {
        if (a.equals(b)) {
            return true;
        }
        if (a instanceof Value.IntValue i && b instanceof Value.UIntValue u) {
            return i.value() >= 0 && i.value() == u.value();
        }
        if (a instanceof Value.UIntValue u && b instanceof Value.IntValue i) {
            return i.value() >= 0 && i.value() == u.value();
        }
        if (a instanceof Value.FloatValue f && b instanceof Value.DecimalValue d) {
            return sameDecimal(f, d);
        }
        if (a instanceof Value.DecimalValue d && b instanceof Value.FloatValue f) {
            return sameDecimal(f, d);
        }
        if (a instanceof Value.DecimalValue x && b instanceof Value.DecimalValue y) {
            return x.value().compareTo(y.value()) == 0;
        }
        if (a instanceof Value.ListValue x && b instanceof Value.ListValue y) {
            return x.elements().size() == y.elements().size()
                && x.elements().zip(y.elements()).allSatisfy(pair -> same(pair.getOne(), pair.getTwo()));
        }
        if (a instanceof Value.MapValue x && b instanceof Value.MapValue y) {
            return x.fields().size() == y.fields().size()
                && x.fields().keyValuesView().allSatisfy(entry -> {
                    Value other = y.fields().get(entry.getOne());
                    return other != null && same(entry.getTwo(), other);
                });
        }
        return false;
    }

    private static boolean sameDecimal(Value.FloatValue f, Value.DecimalValue d) {
        return Numbers.toDecimal(f)
            .map(decimal -> decimal.compareTo(d.value()) == 0)
            .orElse(false);
    }

    /**
     * Orders strings by Unicode code point, which is the same order as comparing
     * their UTF-8 encodings byte by byte.
     */
    public static int compareText(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Boolean.compare(i < a.length(), j < b.length());
    }
}
