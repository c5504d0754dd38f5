package com.challenges.jeval.codec;

import com.challenges.jeval.error.SerializationException;
import com.challenges.jeval.query.Expression;
import com.challenges.jeval.query.Query;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Encodes query trees as tagged JSON and decodes them back.
 *
 * <pre>
 * {"Expression":{"Type":"And","Expression":{"Expressions":[
 *     {"Expression":{"Type":"Is","Expression":{"Field":"Name","Value":"bob"}}},
 *     {"Expression":{"Type":"GT","Expression":{"Field":"Age","Value":30}}}]}}}
 * </pre>
 *
 * <p>A decoded tree always evaluates like the tree that was encoded. It is also
 * equal to it when every literal is an integer, float, string, boolean, null,
 * list or map. Unsigned and decimal literals are written as plain JSON numbers
 * and read back as the narrowest kind that holds them, so {@code UIntValue(5)}
 * returns as {@code IntValue(5)} and {@code DecimalValue(0.5)} as
 * {@code FloatValue(0.5)}.
 *
 * <p>Instances are thread-safe.
 */
public class QueryCodec {

    private static final Logger log = LoggerFactory.getLogger(QueryCodec.class);

    private static final String EXPRESSION = "Expression";
    private static final String EXPRESSIONS = "Expressions";
    private static final String TYPE = "Type";
    private static final String FIELD = "Field";
    private static final String VALUE = "Value";

    private final ObjectMapper mapper = JsonMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .build();

    public byte[] encode(Query query) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (JsonGenerator gen = mapper.getFactory().createGenerator(out, JsonEncoding.UTF8)) {
            writeQuery(gen, query);
        } catch (IOException e) {
            throw new SerializationException("failed to encode query: " + e.getMessage(), e);
        }
        byte[] bytes = out.toByteArray();
        log.debug("Encoded query into {} bytes", bytes.length);
        return bytes;
    }

    public String encodeToString(Query query) {
        return new String(encode(query), StandardCharsets.UTF_8);
    }

    public Query decode(String json) {
        return decode(json.getBytes(StandardCharsets.UTF_8));
    }

    public Query decode(byte[] json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (IOException e) {
            throw new SerializationException("malformed query JSON: " + e.getMessage(), e);
        }
        Query query = readQuery(root, "$");
        log.debug("Decoded query from {} bytes", json.length);
        return query;
    }

    // ---- encoding ----

    private void writeQuery(JsonGenerator gen, Query query) throws IOException {
        gen.writeStartObject();
        gen.writeFieldName(EXPRESSION);
        if (query.isEmpty()) {
            gen.writeNull();
        } else {
            writeTyped(gen, query.expression());
        }
        gen.writeEndObject();
    }

    private void writeTyped(JsonGenerator gen, Expression expression) throws IOException {
        ExpressionType type = ExpressionType.of(expression);
        gen.writeStartObject();
        gen.writeStringField(TYPE, type.wireName());
        gen.writeFieldName(EXPRESSION);
        gen.writeStartObject();
        if (expression instanceof Expression.FieldComparison leaf) {
            gen.writeStringField(FIELD, leaf.field());
            gen.writeFieldName(VALUE);
            ValueJson.write(gen, leaf.value());
        } else if (expression instanceof Expression.And and) {
            writeChildren(gen, and.children());
        } else if (expression instanceof Expression.Or or) {
            writeChildren(gen, or.children());
        } else if (expression instanceof Expression.Not not) {
            gen.writeFieldName(EXPRESSION);
            writeQuery(gen, not.child());
        }
        gen.writeEndObject();
        gen.writeEndObject();
    }

    private void writeChildren(JsonGenerator gen, Iterable<Query> children) throws IOException {
        gen.writeArrayFieldStart(EXPRESSIONS);
        for (Query child : children) {
            writeQuery(gen, child);
        }
        gen.writeEndArray();
    }

    // ---- decoding ----

    private Query readQuery(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new SerializationException("expected a query object at " + path);
        }
        JsonNode typed = node.get(EXPRESSION);
        if (typed == null || typed.isNull()) {
            return Query.EMPTY;
        }
        return Query.of(readTyped(typed, path + "." + EXPRESSION));
    }

    private Expression readTyped(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new SerializationException("expected a typed expression object at " + path);
        }
        JsonNode typeNode = node.get(TYPE);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new SerializationException("missing or non-textual Type at " + path);
        }
        ExpressionType type = ExpressionType.fromWireName(typeNode.textValue())
            .orElseThrow(() -> new SerializationException(
                "unrecognized expression type \"" + typeNode.textValue() + "\" at " + path));

        String payloadPath = path + "." + EXPRESSION;
        JsonNode payload = node.get(EXPRESSION);
        if (payload == null || !payload.isObject()) {
            throw new SerializationException("missing " + type.wireName() + " payload at " + payloadPath);
        }

        return switch (type) {
            case AND -> new Expression.And(readChildren(payload, payloadPath));
            case OR -> new Expression.Or(readChildren(payload, payloadPath));
            case NOT -> {
                JsonNode child = payload.get(EXPRESSION);
                if (child == null || child.isNull()) {
                    throw new SerializationException("Not requires an operand at " + payloadPath);
                }
                yield new Expression.Not(readQuery(child, payloadPath + "." + EXPRESSION));
            }
            default -> readLeaf(type, payload, payloadPath);
        };
    }

    private ImmutableList<Query> readChildren(JsonNode payload, String path) {
        JsonNode children = payload.get(EXPRESSIONS);
        if (children == null || !children.isArray()) {
            throw new SerializationException("expected an Expressions array at " + path);
        }
        MutableList<Query> queries = Lists.mutable.withInitialCapacity(children.size());
        for (int i = 0; i < children.size(); i++) {
            queries.add(readQuery(children.get(i), path + "." + EXPRESSIONS + "[" + i + "]"));
        }
        return queries.toImmutable();
    }

    private Expression readLeaf(ExpressionType type, JsonNode payload, String path) {
        JsonNode field = payload.get(FIELD);
        if (field == null || !field.isTextual()) {
            throw new SerializationException("missing or non-textual Field at " + path);
        }
        if (!payload.has(VALUE)) {
            throw new SerializationException("missing Value at " + path);
        }
        return type.leaf(field.textValue(), ValueJson.read(payload.get(VALUE)));
    }
}
