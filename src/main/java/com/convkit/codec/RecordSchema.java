package com.convkit.codec;

import com.convkit.shared.error.DecodeException;
import com.convkit.shared.error.EncodeException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Maps a JSON object to a typed record and back.
 *
 * <p>Known fields are looked up by wire key. When the schema has an extension accessor, every
 * other key of the object is kept verbatim in the record's extension bag and written back after
 * the known fields; otherwise unknown keys are dropped. JSON {@code null} on a known field means
 * "no value", exactly like an absent key.
 */
public final class RecordSchema<T> implements FieldType<T> {

    private final String name;
    private final List<Field<T, ?>> fields;
    private final Set<String> knownKeys;
    private final Function<T, Map<String, JsonNode>> extensions;
    private final Function<FieldValues, T> factory;

    private RecordSchema(Builder<T> builder, Function<FieldValues, T> factory) {
        this.name = builder.name;
        this.fields = List.copyOf(builder.fields);
        var keys = new LinkedHashSet<String>();
        for (var field : fields) keys.add(field.wireKey());
        this.knownKeys = Collections.unmodifiableSet(keys);
        this.extensions = builder.extensions;
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public static <T> Builder<T> builder(Class<T> type) {
        return new Builder<>(type.getSimpleName());
    }

    public String name() { return name; }

    public List<Field<T, ?>> fields() { return fields; }

    public Set<String> knownKeys() { return knownKeys; }

    /** Whether unknown keys are preserved in an extension bag. */
    public boolean isOpen() { return extensions != null; }

    public T decode(JsonNode node) {
        return decode(node, name);
    }

    @Override
    public T decode(JsonNode node, String path) {
        if (node == null || !node.isObject()) throw DecodeException.wrongType(path, "object", node);

        var values = new HashMap<Field<?, ?>, Object>();
        for (var field : fields) {
            var raw = node.get(field.wireKey());
            var fieldPath = path + "." + field.wireKey();
            if (raw == null || raw.isNull()) {
                if (field.isRequired()) throw DecodeException.missing(fieldPath);
                continue;
            }
            values.put(field, field.type().decode(raw, fieldPath));
        }
        return factory.apply(new FieldValues(values, collectExtensions(node)));
    }

    @Override
    public ObjectNode encode(T record) {
        var out = JsonNodeFactory.instance.objectNode();
        for (var field : fields) {
            encodeField(out, field, record);
        }
        if (extensions != null) {
            var bag = extensions.apply(record);
            if (bag != null) {
                for (var entry : bag.entrySet()) {
                    if (knownKeys.contains(entry.getKey()) || out.has(entry.getKey())) {
                        throw EncodeException.duplicateKey(name + "." + entry.getKey());
                    }
                    var value = entry.getValue();
                    out.set(entry.getKey(), value == null
                            ? JsonNodeFactory.instance.nullNode()
                            : value.deepCopy());
                }
            }
        }
        return out;
    }

    private <V> void encodeField(ObjectNode out, Field<T, V> field, T record) {
        V value = field.read(record);
        if (value == null) {
            if (field.isRequired()) throw EncodeException.missing(name + "." + field.wireKey());
            return;
        }
        out.set(field.wireKey(), field.type().encode(value));
    }

    private Map<String, JsonNode> collectExtensions(JsonNode node) {
        if (extensions == null) return Map.of();
        var bag = new LinkedHashMap<String, JsonNode>();
        var it = node.fields();
        while (it.hasNext()) {
            var entry = it.next();
            if (!knownKeys.contains(entry.getKey())) {
                bag.put(entry.getKey(), entry.getValue().deepCopy());
            }
        }
        return bag;
    }

    @Override
    public String toString() {
        return "RecordSchema[" + name + "]";
    }

    public static final class Builder<T> {

        private final String name;
        private final List<Field<T, ?>> fields = new ArrayList<>();
        private Function<T, Map<String, JsonNode>> extensions;

        private Builder(String name) {
            this.name = name;
        }

        public Builder<T> field(Field<T, ?> field) {
            for (var existing : fields) {
                if (existing.wireKey().equals(field.wireKey())) {
                    throw new IllegalArgumentException("Duplicate wire key in " + name + ": " + field.wireKey());
                }
            }
            fields.add(field);
            return this;
        }

        public Builder<T> extensions(Function<T, Map<String, JsonNode>> accessor) {
            this.extensions = Objects.requireNonNull(accessor, "accessor");
            return this;
        }

        public RecordSchema<T> build(Function<FieldValues, T> factory) {
            return new RecordSchema<>(this, factory);
        }
    }
}
