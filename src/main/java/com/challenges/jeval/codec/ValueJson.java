package com.challenges.jeval.codec;

import com.challenges.jeval.value.Value;
import com.challenges.jeval.value.Values;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;

/**
 * Maps {@link Value}s to and from JSON literals.
 *
 * <p>Writing is canonical: map keys are sorted, and a decimal that a double
 * represents exactly is written the way the double would be. Reading expects a
 * tree parsed with {@code USE_BIG_DECIMAL_FOR_FLOATS} so no digits are lost
 * before a number's kind is chosen.
 */
final class ValueJson {

    private ValueJson() {
    }

    static void write(JsonGenerator gen, Value value) throws IOException {
        if (value instanceof Value.StringValue s) {
            gen.writeString(s.value());
        } else if (value instanceof Value.IntValue i) {
            gen.writeNumber(i.value());
        } else if (value instanceof Value.UIntValue u) {
            if (u.value() >= 0) {
                gen.writeNumber(u.value());
            } else {
                gen.writeNumber(u.toBigInteger());
            }
        } else if (value instanceof Value.FloatValue f) {
            gen.writeNumber(f.value());
        } else if (value instanceof Value.DecimalValue d) {
            writeDecimal(gen, d.value());
        } else if (value instanceof Value.BoolValue b) {
            gen.writeBoolean(b.value());
        } else if (value instanceof Value.NullValue) {
            gen.writeNull();
        } else if (value instanceof Value.ListValue list) {
            gen.writeStartArray();
            for (Value element : list.elements()) {
                write(gen, element);
            }
            gen.writeEndArray();
        } else if (value instanceof Value.MapValue map) {
            gen.writeStartObject();
            for (String key : map.fields().keysView().toSortedList()) {
                gen.writeFieldName(key);
                write(gen, map.fields().get(key));
            }
            gen.writeEndObject();
        }
    }

    private static void writeDecimal(JsonGenerator gen, BigDecimal decimal) throws IOException {
        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            gen.writeNumber(stripped.toBigIntegerExact());
            return;
        }
        double d = stripped.doubleValue();
        if (representsExactly(d, stripped)) {
            gen.writeNumber(d);
        } else {
            gen.writeNumber(stripped.toPlainString());
        }
    }

    static Value read(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Value.NULL;
        }
        if (node.isTextual()) {
            return Value.of(node.textValue());
        }
        if (node.isBoolean()) {
            return Value.of(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return Values.of(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            BigDecimal decimal = node.decimalValue();
            double d = decimal.doubleValue();
            return representsExactly(d, decimal) ? Value.of(d) : new Value.DecimalValue(decimal);
        }
        if (node.isArray()) {
            MutableList<Value> elements = Lists.mutable.withInitialCapacity(node.size());
            for (JsonNode element : node) {
                elements.add(read(element));
            }
            return new Value.ListValue(elements.toImmutable());
        }
        if (node.isObject()) {
            MutableMap<String, Value> fields = Maps.mutable.ofInitialCapacity(node.size());
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                fields.put(entry.getKey(), read(entry.getValue()));
            }
            return new Value.MapValue(fields.toImmutable());
        }
        // Binary and POJO nodes never come out of a parsed document
        return Value.of(node.asText());
    }

    private static boolean representsExactly(double d, BigDecimal decimal) {
        return !Double.isInfinite(d) && new BigDecimal(Double.toString(d)).compareTo(decimal) == 0;
    }
}
