package com.convkit.model;

import com.convkit.codec.EnumValue;
import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/** A workspace with its content, as returned when exporting. */
public record WorkspaceExport(
        String name,
        String language,
        String created,
        String updated,
        String workspaceId,
        String description,
        Map<String, JsonNode> metadata,
        Boolean learningOptOut,
        EnumValue<WorkspaceStatus> status,
        List<IntentExport> intents,
        List<EntityExport> entities,
        List<Counterexample> counterexamples,
        List<DialogNode> dialogNodes
) {

    private static final Field<WorkspaceExport, String> NAME =
            Field.required("name", FieldTypes.STRING, WorkspaceExport::name);
    private static final Field<WorkspaceExport, String> LANGUAGE =
            Field.required("language", FieldTypes.STRING, WorkspaceExport::language);
    private static final Field<WorkspaceExport, String> CREATED =
            Field.optional("created", FieldTypes.STRING, WorkspaceExport::created);
    private static final Field<WorkspaceExport, String> UPDATED =
            Field.optional("updated", FieldTypes.STRING, WorkspaceExport::updated);
    private static final Field<WorkspaceExport, String> WORKSPACE_ID =
            Field.required("workspace_id", FieldTypes.STRING, WorkspaceExport::workspaceId);
    private static final Field<WorkspaceExport, String> DESCRIPTION =
            Field.optional("description", FieldTypes.STRING, WorkspaceExport::description);
    private static final Field<WorkspaceExport, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, WorkspaceExport::metadata);
    private static final Field<WorkspaceExport, Boolean> LEARNING_OPT_OUT =
            Field.optional("learning_opt_out", FieldTypes.BOOLEAN, WorkspaceExport::learningOptOut);
    private static final Field<WorkspaceExport, EnumValue<WorkspaceStatus>> STATUS =
            Field.optional("status", FieldTypes.enumOf(WorkspaceStatus.class), WorkspaceExport::status);
    private static final Field<WorkspaceExport, List<IntentExport>> INTENTS =
            Field.optional("intents", FieldTypes.listOf(IntentExport.SCHEMA), WorkspaceExport::intents);
    private static final Field<WorkspaceExport, List<EntityExport>> ENTITIES =
            Field.optional("entities", FieldTypes.listOf(EntityExport.SCHEMA), WorkspaceExport::entities);
    private static final Field<WorkspaceExport, List<Counterexample>> COUNTEREXAMPLES =
            Field.optional("counterexamples", FieldTypes.listOf(Counterexample.SCHEMA), WorkspaceExport::counterexamples);
    private static final Field<WorkspaceExport, List<DialogNode>> DIALOG_NODES =
            Field.optional("dialog_nodes", FieldTypes.listOf(DialogNode.SCHEMA), WorkspaceExport::dialogNodes);

    public static final RecordSchema<WorkspaceExport> SCHEMA = RecordSchema.builder(WorkspaceExport.class)
            .field(NAME)
            .field(LANGUAGE)
            .field(CREATED)
            .field(UPDATED)
            .field(WORKSPACE_ID)
            .field(DESCRIPTION)
            .field(METADATA)
            .field(LEARNING_OPT_OUT)
            .field(STATUS)
            .field(INTENTS)
            .field(ENTITIES)
            .field(COUNTEREXAMPLES)
            .field(DIALOG_NODES)
            .build(v -> new WorkspaceExport(
                    v.get(NAME),
                    v.get(LANGUAGE),
                    v.get(CREATED),
                    v.get(UPDATED),
                    v.get(WORKSPACE_ID),
                    v.get(DESCRIPTION),
                    v.get(METADATA),
                    v.get(LEARNING_OPT_OUT),
                    v.get(STATUS),
                    v.get(INTENTS),
                    v.get(ENTITIES),
                    v.get(COUNTEREXAMPLES),
                    v.get(DIALOG_NODES)));

    public WorkspaceExport {
        metadata = ModelSupport.json(metadata);
        intents = ModelSupport.list(intents);
        entities = ModelSupport.list(entities);
        counterexamples = ModelSupport.list(counterexamples);
        dialogNodes = ModelSupport.list(dialogNodes);
    }
}
