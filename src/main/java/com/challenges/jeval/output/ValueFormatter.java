package com.challenges.jeval.output;

import com.challenges.jeval.value.Value;

/**
 * Renders values as compact JSON with object keys in sorted order, so equal
 * values always render to the same text.
 */
public class ValueFormatter {

    public String format(Value value) {
        StringBuilder sb = new StringBuilder();
        format(value, sb);
        return sb.toString();
    }

    private void format(Value value, StringBuilder sb) {
        if (value instanceof Value.MapValue map) {
            sb.append('{');
            boolean first = true;
            for (String key : map.fields().keysView().toSortedList()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                appendString(key, sb);
                sb.append(':');
                format(map.fields().get(key), sb);
            }
            sb.append('}');
        } else if (value instanceof Value.ListValue list) {
            sb.append('[');
            boolean first = true;
            for (Value element : list.elements()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                format(element, sb);
            }
            sb.append(']');
        } else if (value instanceof Value.StringValue s) {
            appendString(s.value(), sb);
        } else if (value instanceof Value.NumberValue n) {
            sb.append(n.toText());
        } else if (value instanceof Value.BoolValue b) {
            sb.append(b.value());
        } else {
            sb.append("null");
        }
    }

    private static void appendString(String s, StringBuilder sb) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\').append(c);
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c < 0x20) {
                sb.append(String.format("\\u%04x", (int) c));
            } else {
                sb.append(c);
            }
        }
        sb.append('"');
    }
}
