package com.convkit.model;

import com.convkit.codec.WireEnum;

/** How an {@code event_handler} node is processed. */
public enum EventName implements WireEnum {
    FOCUS("focus"),
    INPUT("input"),
    FILLED("filled"),
    VALIDATE("validate"),
    FILLED_MULTIPLE("filled_multiple"),
    GENERIC("generic"),
    NOMATCH("nomatch"),
    NOMATCH_RESPONSES_DEPLETED("nomatch_responses_depleted");

    private final String wireValue;

    EventName(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
