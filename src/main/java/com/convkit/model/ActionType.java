package com.convkit.model;

import com.convkit.codec.WireEnum;

public enum ActionType implements WireEnum {
    CLIENT("client"),
    SERVER("server");

    private final String wireValue;

    ActionType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
