package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

public record CreateWorkspace(
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

    private static final Field<CreateWorkspace, String> NAME =
            Field.optional("name", FieldTypes.STRING, CreateWorkspace::name);
    private static final Field<CreateWorkspace, String> DESCRIPTION =
            Field.optional("description", FieldTypes.STRING, CreateWorkspace::description);
    private static final Field<CreateWorkspace, String> LANGUAGE =
            Field.optional("language", FieldTypes.STRING, CreateWorkspace::language);
    private static final Field<CreateWorkspace, List<CreateIntent>> INTENTS =
            Field.optional("intents", FieldTypes.listOf(CreateIntent.SCHEMA), CreateWorkspace::intents);
    private static final Field<CreateWorkspace, List<CreateEntity>> ENTITIES =
            Field.optional("entities", FieldTypes.listOf(CreateEntity.SCHEMA), CreateWorkspace::entities);
    private static final Field<CreateWorkspace, List<CreateDialogNode>> DIALOG_NODES =
            Field.optional("dialog_nodes", FieldTypes.listOf(CreateDialogNode.SCHEMA), CreateWorkspace::dialogNodes);
    private static final Field<CreateWorkspace, List<CreateCounterexample>> COUNTEREXAMPLES =
            Field.optional("counterexamples", FieldTypes.listOf(CreateCounterexample.SCHEMA), CreateWorkspace::counterexamples);
    private static final Field<CreateWorkspace, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, CreateWorkspace::metadata);
    private static final Field<CreateWorkspace, Boolean> LEARNING_OPT_OUT =
            Field.optional("learning_opt_out", FieldTypes.BOOLEAN, CreateWorkspace::learningOptOut);

    public static final RecordSchema<CreateWorkspace> SCHEMA = RecordSchema.builder(CreateWorkspace.class)
            .field(NAME)
            .field(DESCRIPTION)
            .field(LANGUAGE)
            .field(INTENTS)
            .field(ENTITIES)
            .field(DIALOG_NODES)
            .field(COUNTEREXAMPLES)
            .field(METADATA)
            .field(LEARNING_OPT_OUT)
            .build(v -> new CreateWorkspace(
                    v.get(NAME),
                    v.get(DESCRIPTION),
                    v.get(LANGUAGE),
                    v.get(INTENTS),
                    v.get(ENTITIES),
                    v.get(DIALOG_NODES),
                    v.get(COUNTEREXAMPLES),
                    v.get(METADATA),
                    v.get(LEARNING_OPT_OUT)));

    public CreateWorkspace {
        intents = ModelSupport.list(intents);
        entities = ModelSupport.list(entities);
        dialogNodes = ModelSupport.list(dialogNodes);
        counterexamples = ModelSupport.list(counterexamples);
        metadata = ModelSupport.json(metadata);
    }

    public CreateWorkspace(String name, String description, String language) {
        this(name, description, language, null, null, null, null, null, null);
    }
}
