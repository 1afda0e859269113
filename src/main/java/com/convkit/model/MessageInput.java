package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

public record MessageInput(String text) {

    private static final Field<MessageInput, String> TEXT =
            Field.optional("text", FieldTypes.STRING, MessageInput::text);

    public static final RecordSchema<MessageInput> SCHEMA = RecordSchema.builder(MessageInput.class)
            .field(TEXT)
            .build(v -> new MessageInput(v.get(TEXT)));
}
