package com.convkit.codec;

/** An enum constant with a fixed string on the wire. */
public interface WireEnum {

    String wireValue();
}
