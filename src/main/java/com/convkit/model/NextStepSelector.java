package com.convkit.model;

import com.convkit.codec.WireEnum;

public enum NextStepSelector implements WireEnum {
    CONDITION("condition"),
    CLIENT("client"),
    USER_INPUT("user_input"),
    BODY("body");

    private final String wireValue;

    NextStepSelector(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
