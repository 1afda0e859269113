package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

import java.util.List;

public record WorkspaceCollection(List<Workspace> workspaces, Pagination pagination) {

    private static final Field<WorkspaceCollection, List<Workspace>> WORKSPACES =
            Field.required("workspaces", FieldTypes.listOf(Workspace.SCHEMA), WorkspaceCollection::workspaces);
    private static final Field<WorkspaceCollection, Pagination> PAGINATION =
            Field.required("pagination", Pagination.SCHEMA, WorkspaceCollection::pagination);

    public static final RecordSchema<WorkspaceCollection> SCHEMA = RecordSchema.builder(WorkspaceCollection.class)
            .field(WORKSPACES)
            .field(PAGINATION)
            .build(v -> new WorkspaceCollection(v.get(WORKSPACES), v.get(PAGINATION)));

    public WorkspaceCollection {
        workspaces = ModelSupport.list(workspaces);
    }
}
