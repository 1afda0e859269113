package com.convkit.codec;

import java.util.Objects;

/**
 * A string-keyed enumeration value that keeps strings the client does not know yet.
 * {@code known} is {@code null} when {@code wire} matches none of the constants.
 */
public record EnumValue<E extends Enum<E> & WireEnum>(E known, String wire) {

    public EnumValue {
        Objects.requireNonNull(wire, "wire");
    }

    public static <E extends Enum<E> & WireEnum> EnumValue<E> of(E constant) {
        return new EnumValue<>(constant, constant.wireValue());
    }

    public static <E extends Enum<E> & WireEnum> EnumValue<E> parse(Class<E> type, String wire) {
        for (var constant : type.getEnumConstants()) {
            if (constant.wireValue().equals(wire)) return new EnumValue<>(constant, wire);
        }
        return new EnumValue<>(null, wire);
    }

    public boolean isRecognized() {
        return known != null;
    }

    public boolean is(E constant) {
        return known == constant;
    }

    @Override
    public String toString() {
        return wire;
    }
}
