package com.convkit.model;

import com.convkit.codec.EnumValue;
import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

public record DialogNodeNextStep(
        EnumValue<NextStepBehavior> behavior,
        String dialogNode,
        EnumValue<NextStepSelector> selector
) {

    private static final Field<DialogNodeNextStep, EnumValue<NextStepBehavior>> BEHAVIOR =
            Field.required("behavior", FieldTypes.enumOf(NextStepBehavior.class), DialogNodeNextStep::behavior);
    private static final Field<DialogNodeNextStep, String> DIALOG_NODE =
            Field.optional("dialog_node", FieldTypes.STRING, DialogNodeNextStep::dialogNode);
    private static final Field<DialogNodeNextStep, EnumValue<NextStepSelector>> SELECTOR =
            Field.optional("selector", FieldTypes.enumOf(NextStepSelector.class), DialogNodeNextStep::selector);

    public static final RecordSchema<DialogNodeNextStep> SCHEMA = RecordSchema.builder(DialogNodeNextStep.class)
            .field(BEHAVIOR)
            .field(DIALOG_NODE)
            .field(SELECTOR)
            .build(v -> new DialogNodeNextStep(v.get(BEHAVIOR), v.get(DIALOG_NODE), v.get(SELECTOR)));

    public static DialogNodeNextStep jumpTo(String dialogNode, NextStepSelector selector) {
        return new DialogNodeNextStep(EnumValue.of(NextStepBehavior.JUMP_TO), dialogNode, EnumValue.of(selector));
    }
}
