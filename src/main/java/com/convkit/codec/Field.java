package com.convkit.codec;

import java.util.Objects;
import java.util.function.Function;

/** One known field of a record: wire key, type, presence rule and accessor. */
public final class Field<T, V> {

    private final String wireKey;
    private final FieldType<V> type;
    private final boolean required;
    private final Function<T, V> accessor;

    private Field(String wireKey, FieldType<V> type, boolean required, Function<T, V> accessor) {
        this.wireKey = Objects.requireNonNull(wireKey, "wireKey");
        this.type = Objects.requireNonNull(type, "type");
        this.required = required;
        this.accessor = Objects.requireNonNull(accessor, "accessor");
    }

    public static <T, V> Field<T, V> required(String wireKey, FieldType<V> type, Function<T, V> accessor) {
        return new Field<>(wireKey, type, true, accessor);
    }

    public static <T, V> Field<T, V> optional(String wireKey, FieldType<V> type, Function<T, V> accessor) {
        return new Field<>(wireKey, type, false, accessor);
    }

    public String wireKey() { return wireKey; }

    public FieldType<V> type() { return type; }

    public boolean isRequired() { return required; }

    V read(T record) {
        return accessor.apply(record);
    }

    @Override
    public String toString() {
        return (required ? "required " : "optional ") + wireKey;
    }
}
