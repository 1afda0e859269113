package com.convkit.model;

import com.convkit.codec.WireEnum;

public enum LogLevel implements WireEnum {
    INFO("info"),
    ERROR("error"),
    WARN("warn");

    private final String wireValue;

    LogLevel(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
