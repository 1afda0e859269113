package com.convkit.model;

import com.convkit.codec.WireEnum;

/** Training state reported with an exported workspace. */
public enum WorkspaceStatus implements WireEnum {
    NON_EXISTENT("Non Existent"),
    TRAINING("Training"),
    FAILED("Failed"),
    AVAILABLE("Available"),
    UNAVAILABLE("Unavailable");

    private final String wireValue;

    WorkspaceStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
