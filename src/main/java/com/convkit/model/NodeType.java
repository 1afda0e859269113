package com.convkit.model;

import com.convkit.codec.WireEnum;

/** How a dialog node is processed. */
public enum NodeType implements WireEnum {
    STANDARD("standard"),
    EVENT_HANDLER("event_handler"),
    FRAME("frame"),
    SLOT("slot"),
    RESPONSE_CONDITION("response_condition");

    private final String wireValue;

    NodeType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
