package com.challenges.jeval.json;

import com.challenges.jeval.value.Value;
import com.challenges.jeval.value.Values;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Streams documents into {@link Value}s. The same reader handles JSON, JSON
 * Lines (a sequence of root-level values) and YAML, depending on the factory.
 */
public class ValueReader {
    private final JsonFactory factory;

    public ValueReader(JsonFactory factory) {
        this.factory = factory;
    }

    public static ValueReader json() {
        return new ValueReader(new JsonFactory());
    }

    public static ValueReader yaml() {
        return new ValueReader(new YAMLFactory());
    }

    /** Calls {@code sink} for every root-level value in {@code input}. */
    public void readEach(InputStream input, Consumer<Value> sink) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token;
            while ((token = parser.nextToken()) != null) {
                sink.accept(parseValue(parser, token));
            }
        }
    }

    /** Reads the first document, ignoring whatever follows it. */
    public Optional<Value> readFirst(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                return Optional.empty();
            }
            return Optional.of(parseValue(parser, token));
        }
    }

    private Value parseValue(JsonParser parser, JsonToken token) throws IOException {
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> Value.of(parser.getText());
            case VALUE_NUMBER_INT -> parseInteger(parser);
            case VALUE_NUMBER_FLOAT -> Value.of(parser.getDoubleValue());
            case VALUE_TRUE -> Value.TRUE;
            case VALUE_FALSE -> Value.FALSE;
            case VALUE_NULL -> Value.NULL;
            default -> throw new IOException("Unexpected token " + token + " at " + parser.currentLocation());
        };
    }

    private Value parseInteger(JsonParser parser) throws IOException {
        if (parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
            return Values.of(parser.getBigIntegerValue());
        }
        return Value.of(parser.getLongValue());
    }

    private Value.MapValue parseObject(JsonParser parser) throws IOException {
        MutableMap<String, Value> fields = Maps.mutable.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            fields.put(fieldName, parseValue(parser, parser.nextToken()));
        }

        return new Value.MapValue(fields.toImmutable());
    }

    private Value.ListValue parseArray(JsonParser parser) throws IOException {
        MutableList<Value> elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token));
        }

        return new Value.ListValue(elements.toImmutable());
    }
}
