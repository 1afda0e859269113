package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

import java.util.List;

public record CounterexampleCollection(List<Counterexample> counterexamples, Pagination pagination) {

    private static final Field<CounterexampleCollection, List<Counterexample>> COUNTEREXAMPLES =
            Field.required("counterexamples", FieldTypes.listOf(Counterexample.SCHEMA), CounterexampleCollection::counterexamples);
    private static final Field<CounterexampleCollection, Pagination> PAGINATION =
            Field.required("pagination", Pagination.SCHEMA, CounterexampleCollection::pagination);

    public static final RecordSchema<CounterexampleCollection> SCHEMA = RecordSchema.builder(CounterexampleCollection.class)
            .field(COUNTEREXAMPLES)
            .field(PAGINATION)
            .build(v -> new CounterexampleCollection(v.get(COUNTEREXAMPLES), v.get(PAGINATION)));

    public CounterexampleCollection {
        counterexamples = ModelSupport.list(counterexamples);
    }
}
