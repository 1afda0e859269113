package com.convkit.model;

import com.convkit.codec.WireEnum;

public enum NextStepBehavior implements WireEnum {
    JUMP_TO("jump_to");

    private final String wireValue;

    NextStepBehavior(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
