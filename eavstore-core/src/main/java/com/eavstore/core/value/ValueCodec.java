package com.eavstore.core.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts attribute values to and from their stored form.
 *
 * Strings are stored verbatim with no type tag. Every other kind is written
 * as JSON and tagged with {@link AttrValue#type()}.
 */
public class ValueCodec {

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private final ObjectMapper mapper;

    public ValueCodec() {
        this(createMapper());
    }

    public ValueCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Create and configure the ObjectMapper used for stored JSON.
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setNodeFactory(NODES);
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        return mapper;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public EncodedValue serialize(AttrValue value) {
        if (value == null) {
            value = AttrValue.nullValue();
        }
        if (value instanceof AttrValue.Str s) {
            return new EncodedValue(null, s.value());
        }
        try {
            return new EncodedValue(value.type(), mapper.writeValueAsString(toJson(value)));
        } catch (JsonProcessingException e) {
            throw new ValueCodecException("Failed to serialize " + value.type() + " value", e);
        }
    }

    /**
     * Serialize a plain Java value.
     *
     * @throws ValueCodecException if the value's type has no mapping
     */
    public EncodedValue serialize(Object value) {
        return serialize(AttrValue.from(value));
    }

    public AttrValue deserialize(String text, String type) {
        if (isStringTag(type)) {
            return text == null ? AttrValue.nullValue() : new AttrValue.Str(text);
        }
        if (text == null) {
            return AttrValue.nullValue();
        }
        try {
            return fromJson(mapper.readTree(text));
        } catch (JsonProcessingException e) {
            throw new ValueCodecException("Stored " + type + " value is not valid JSON: " + text, e);
        }
    }

    private static boolean isStringTag(String type) {
        // "str" is accepted for rows written by older writers
        return type == null || type.isEmpty() || AttrValue.STRING.equals(type) || "str".equals(type);
    }

    // ==================== JSON tree mapping ====================

    public JsonNode toJson(AttrValue value) {
        if (value instanceof AttrValue.Str s) return NODES.textNode(s.value());
        if (value instanceof AttrValue.Num n) return NODES.numberNode(n.value());
        if (value instanceof AttrValue.Bool b) return NODES.booleanNode(b.value());
        if (value instanceof AttrValue.Arr a) {
            ArrayNode node = NODES.arrayNode();
            for (AttrValue v : a.values()) {
                node.add(toJson(v));
            }
            return node;
        }
        if (value instanceof AttrValue.Obj o) {
            ObjectNode node = NODES.objectNode();
            o.entries().forEach((k, v) -> node.set(k, toJson(v)));
            return node;
        }
        return NODES.nullNode();
    }

    public AttrValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return AttrValue.nullValue();
        }
        if (node.isTextual()) {
            return new AttrValue.Str(node.textValue());
        }
        if (node.isNumber()) {
            return new AttrValue.Num(node.decimalValue());
        }
        if (node.isBoolean()) {
            return new AttrValue.Bool(node.booleanValue());
        }
        if (node.isArray()) {
            List<AttrValue> values = new ArrayList<>(node.size());
            for (JsonNode child : node) {
                values.add(fromJson(child));
            }
            return new AttrValue.Arr(values);
        }
        if (node.isObject()) {
            Map<String, AttrValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), fromJson(field.getValue()));
            }
            return new AttrValue.Obj(entries);
        }
        throw new ValueCodecException("No attribute mapping for JSON node type " + node.getNodeType());
    }
}
