package com.convkit.model;

import com.convkit.codec.EnumValue;
import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record DialogNodeAction(
        String name,
        EnumValue<ActionType> actionType,
        Map<String, JsonNode> parameters,
        String resultVariable
) {

    private static final Field<DialogNodeAction, String> NAME =
            Field.required("name", FieldTypes.STRING, DialogNodeAction::name);
    private static final Field<DialogNodeAction, EnumValue<ActionType>> ACTION_TYPE =
            Field.optional("type", FieldTypes.enumOf(ActionType.class), DialogNodeAction::actionType);
    private static final Field<DialogNodeAction, Map<String, JsonNode>> PARAMETERS =
            Field.optional("parameters", FieldTypes.JSON_OBJECT, DialogNodeAction::parameters);
    private static final Field<DialogNodeAction, String> RESULT_VARIABLE =
            Field.required("result_variable", FieldTypes.STRING, DialogNodeAction::resultVariable);

    public static final RecordSchema<DialogNodeAction> SCHEMA = RecordSchema.builder(DialogNodeAction.class)
            .field(NAME)
            .field(ACTION_TYPE)
            .field(PARAMETERS)
            .field(RESULT_VARIABLE)
            .build(v -> new DialogNodeAction(
                    v.get(NAME),
                    v.get(ACTION_TYPE),
                    v.get(PARAMETERS),
                    v.get(RESULT_VARIABLE)));

    public DialogNodeAction {
        parameters = ModelSupport.json(parameters);
    }
}
