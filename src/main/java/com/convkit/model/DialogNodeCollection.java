package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

import java.util.List;

public record DialogNodeCollection(List<DialogNode> dialogNodes, Pagination pagination) {

    private static final Field<DialogNodeCollection, List<DialogNode>> DIALOG_NODES =
            Field.required("dialog_nodes", FieldTypes.listOf(DialogNode.SCHEMA), DialogNodeCollection::dialogNodes);
    private static final Field<DialogNodeCollection, Pagination> PAGINATION =
            Field.required("pagination", Pagination.SCHEMA, DialogNodeCollection::pagination);

    public static final RecordSchema<DialogNodeCollection> SCHEMA = RecordSchema.builder(DialogNodeCollection.class)
            .field(DIALOG_NODES)
            .field(PAGINATION)
            .build(v -> new DialogNodeCollection(v.get(DIALOG_NODES), v.get(PAGINATION)));

    public DialogNodeCollection {
        dialogNodes = ModelSupport.list(dialogNodes);
    }
}
