package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/** Replacement content for a workspace; absent fields are left unchanged by the service. */
public record UpdateWorkspace(
        String name,
        String description,
        String language,
        List<CreateIntent> intents,
        List<CreateEntity> entities,
        List<CreateDialogNode> dialogNodes,
        List<CreateCounterexample> counterexamples,
        Map<String, JsonNode> metadata,
        Boolean learningOptOut
) {

    private static final Field<UpdateWorkspace, String> NAME =
            Field.optional("name", FieldTypes.STRING, UpdateWorkspace::name);
    private static final Field<UpdateWorkspace, String> DESCRIPTION =
            Field.optional("description", FieldTypes.STRING, UpdateWorkspace::description);
    private static final Field<UpdateWorkspace, String> LANGUAGE =
            Field.optional("language", FieldTypes.STRING, UpdateWorkspace::language);
    private static final Field<UpdateWorkspace, List<CreateIntent>> INTENTS =
            Field.optional("intents", FieldTypes.listOf(CreateIntent.SCHEMA), UpdateWorkspace::intents);
    private static final Field<UpdateWorkspace, List<CreateEntity>> ENTITIES =
            Field.optional("entities", FieldTypes.listOf(CreateEntity.SCHEMA), UpdateWorkspace::entities);
    private static final Field<UpdateWorkspace, List<CreateDialogNode>> DIALOG_NODES =
            Field.optional("dialog_nodes", FieldTypes.listOf(CreateDialogNode.SCHEMA), UpdateWorkspace::dialogNodes);
    private static final Field<UpdateWorkspace, List<CreateCounterexample>> COUNTEREXAMPLES =
            Field.optional("counterexamples", FieldTypes.listOf(CreateCounterexample.SCHEMA), UpdateWorkspace::counterexamples);
    private static final Field<UpdateWorkspace, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, UpdateWorkspace::metadata);
    private static final Field<UpdateWorkspace, Boolean> LEARNING_OPT_OUT =
            Field.optional("learning_opt_out", FieldTypes.BOOLEAN, UpdateWorkspace::learningOptOut);

    public static final RecordSchema<UpdateWorkspace> SCHEMA = RecordSchema.builder(UpdateWorkspace.class)
            .field(NAME)
            .field(DESCRIPTION)
            .field(LANGUAGE)
            .field(INTENTS)
            .field(ENTITIES)
            .field(DIALOG_NODES)
            .field(COUNTEREXAMPLES)
            .field(METADATA)
            .field(LEARNING_OPT_OUT)
            .build(v -> new UpdateWorkspace(
                    v.get(NAME),
                    v.get(DESCRIPTION),
                    v.get(LANGUAGE),
                    v.get(INTENTS),
                    v.get(ENTITIES),
                    v.get(DIALOG_NODES),
                    v.get(COUNTEREXAMPLES),
                    v.get(METADATA),
                    v.get(LEARNING_OPT_OUT)));

    public UpdateWorkspace {
        intents = ModelSupport.list(intents);
        entities = ModelSupport.list(entities);
        dialogNodes = ModelSupport.list(dialogNodes);
        counterexamples = ModelSupport.list(counterexamples);
        metadata = ModelSupport.json(metadata);
    }

    public UpdateWorkspace(String name, String description, String language) {
        this(name, description, language, null, null, null, null, null, null);
    }
}
