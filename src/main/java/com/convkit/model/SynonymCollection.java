package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

import java.util.List;

public record SynonymCollection(List<Synonym> synonyms, Pagination pagination) {

    private static final Field<SynonymCollection, List<Synonym>> SYNONYMS =
            Field.required("synonyms", FieldTypes.listOf(Synonym.SCHEMA), SynonymCollection::synonyms);
    private static final Field<SynonymCollection, Pagination> PAGINATION =
            Field.required("pagination", Pagination.SCHEMA, SynonymCollection::pagination);

    public static final RecordSchema<SynonymCollection> SCHEMA = RecordSchema.builder(SynonymCollection.class)
            .field(SYNONYMS)
            .field(PAGINATION)
            .build(v -> new SynonymCollection(v.get(SYNONYMS), v.get(PAGINATION)));

    public SynonymCollection {
        synonyms = ModelSupport.list(synonyms);
    }
}
