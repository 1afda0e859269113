package com.convkit.codec;

import com.convkit.shared.error.DecodeException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Built-in {@link FieldType}s. Numbers and booleans pass through without coercion. */
public final class FieldTypes {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public static final FieldType<String> STRING = new FieldType<>() {
        @Override
        public String decode(JsonNode node, String path) {
            if (!node.isTextual()) throw DecodeException.wrongType(path, "string", node);
            return node.textValue();
        }

        @Override
        public JsonNode encode(String value) {
            return NODES.textNode(value);
        }
    };

    public static final FieldType<Boolean> BOOLEAN = new FieldType<>() {
        @Override
        public Boolean decode(JsonNode node, String path) {
            if (!node.isBoolean()) throw DecodeException.wrongType(path, "boolean", node);
            return node.booleanValue();
        }

        @Override
        public JsonNode encode(Boolean value) {
            return NODES.booleanNode(value);
        }
    };

    public static final FieldType<Integer> INT = new FieldType<>() {
        @Override
        public Integer decode(JsonNode node, String path) {
            if (!node.isIntegralNumber() || !node.canConvertToInt()) {
                throw DecodeException.wrongType(path, "32-bit integer", node);
            }
            return node.intValue();
        }

        @Override
        public JsonNode encode(Integer value) {
            return NODES.numberNode(value.intValue());
        }
    };

    public static final FieldType<Long> LONG = new FieldType<>() {
        @Override
        public Long decode(JsonNode node, String path) {
            if (!node.isIntegralNumber() || !node.canConvertToLong()) {
                throw DecodeException.wrongType(path, "64-bit integer", node);
            }
            return node.longValue();
        }

        @Override
        public JsonNode encode(Long value) {
            return NODES.numberNode(value.longValue());
        }
    };

    public static final FieldType<Double> DOUBLE = new FieldType<>() {
        @Override
        public Double decode(JsonNode node, String path) {
            if (!node.isNumber()) throw DecodeException.wrongType(path, "number", node);
            return node.doubleValue();
        }

        @Override
        public JsonNode encode(Double value) {
            return NODES.numberNode(value.doubleValue());
        }
    };

    /** Any JSON value, kept as an independent copy. */
    public static final FieldType<JsonNode> JSON = new FieldType<>() {
        @Override
        public JsonNode decode(JsonNode node, String path) {
            return node.deepCopy();
        }

        @Override
        public JsonNode encode(JsonNode value) {
            return value.deepCopy();
        }
    };

    /** A JSON object whose shape the schema does not fix (output, context, metadata). */
    public static final FieldType<Map<String, JsonNode>> JSON_OBJECT = new FieldType<>() {
        @Override
        public Map<String, JsonNode> decode(JsonNode node, String path) {
            if (!node.isObject()) throw DecodeException.wrongType(path, "object", node);
            var map = new LinkedHashMap<String, JsonNode>();
            node.fields().forEachRemaining(e -> map.put(e.getKey(), e.getValue().deepCopy()));
            return Collections.unmodifiableMap(map);
        }

        @Override
        public JsonNode encode(Map<String, JsonNode> value) {
            var out = NODES.objectNode();
            value.forEach((k, v) -> out.set(k, v == null ? NODES.nullNode() : v.deepCopy()));
            return out;
        }
    };

    private FieldTypes() {}

    /** An array decoded element-wise; the first failing element fails the whole array. */
    public static <E> FieldType<List<E>> listOf(FieldType<E> element) {
        return new FieldType<>() {
            @Override
            public List<E> decode(JsonNode node, String path) {
                if (!node.isArray()) throw DecodeException.wrongType(path, "array", node);
                var out = new ArrayList<E>(node.size());
                for (int i = 0; i < node.size(); i++) {
                    var item = node.get(i);
                    var itemPath = path + "[" + i + "]";
                    if (item.isNull()) throw DecodeException.wrongType(itemPath, "array element", item);
                    out.add(element.decode(item, itemPath));
                }
                return Collections.unmodifiableList(out);
            }

            @Override
            public JsonNode encode(List<E> value) {
                var out = NODES.arrayNode(value.size());
                for (var item : value) out.add(element.encode(item));
                return out;
            }
        };
    }

    public static <E extends Enum<E> & WireEnum> FieldType<EnumValue<E>> enumOf(Class<E> type) {
        return new FieldType<>() {
            @Override
            public EnumValue<E> decode(JsonNode node, String path) {
                if (!node.isTextual()) throw DecodeException.wrongType(path, "string", node);
                return EnumValue.parse(type, node.textValue());
            }

            @Override
            public JsonNode encode(EnumValue<E> value) {
                return NODES.textNode(value.wire());
            }
        };
    }
}
