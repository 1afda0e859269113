package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record Workspace(
        String name,
        String language,
        String created,
        String updated,
        String workspaceId,
        String description,
        Map<String, JsonNode> metadata,
        Boolean learningOptOut
) {

    private static final Field<Workspace, String> NAME =
            Field.required("name", FieldTypes.STRING, Workspace::name);
    private static final Field<Workspace, String> LANGUAGE =
            Field.required("language", FieldTypes.STRING, Workspace::language);
    private static final Field<Workspace, String> CREATED =
            Field.optional("created", FieldTypes.STRING, Workspace::created);
    private static final Field<Workspace, String> UPDATED =
            Field.optional("updated", FieldTypes.STRING, Workspace::updated);
    private static final Field<Workspace, String> WORKSPACE_ID =
            Field.required("workspace_id", FieldTypes.STRING, Workspace::workspaceId);
    private static final Field<Workspace, String> DESCRIPTION =
            Field.optional("description", FieldTypes.STRING, Workspace::description);
    private static final Field<Workspace, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, Workspace::metadata);
    private static final Field<Workspace, Boolean> LEARNING_OPT_OUT =
            Field.optional("learning_opt_out", FieldTypes.BOOLEAN, Workspace::learningOptOut);

    public static final RecordSchema<Workspace> SCHEMA = RecordSchema.builder(Workspace.class)
            .field(NAME)
            .field(LANGUAGE)
            .field(CREATED)
            .field(UPDATED)
            .field(WORKSPACE_ID)
            .field(DESCRIPTION)
            .field(METADATA)
            .field(LEARNING_OPT_OUT)
            .build(v -> new Workspace(
                    v.get(NAME),
                    v.get(LANGUAGE),
                    v.get(CREATED),
                    v.get(UPDATED),
                    v.get(WORKSPACE_ID),
                    v.get(DESCRIPTION),
                    v.get(METADATA),
                    v.get(LEARNING_OPT_OUT)));

    public Workspace {
        metadata = ModelSupport.json(metadata);
    }
}
