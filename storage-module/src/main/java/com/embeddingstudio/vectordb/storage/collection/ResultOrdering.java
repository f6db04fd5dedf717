package com.embeddingstudio.vectordb.storage.collection;

import com.embeddingstudio.vectordb.common.model.SortByOptions;
import com.embeddingstudio.vectordb.common.model.SortOrder;
import com.embeddingstudio.vectordb.common.payload.PayloadValue;
import com.embeddingstudio.vectordb.common.query.FieldRef;

import java.util.Comparator;
import java.util.Optional;

/**
 * Result orderings. Ties always fall back to insertion order, then object id.
 */
final class ResultOrdering {

    private static final Comparator<ObjectRow> INSERTION_ORDER = Comparator
            .comparingLong(ObjectRow::insertSeq)
            .thenComparing(ObjectRow::objectId);

    private ResultOrdering() {
    }

    /** Payload searches: by the sort field when given, else insertion order */
    static Comparator<ObjectRow> forRows(SortByOptions sortBy) {
        if (sortBy == null) {
            return INSERTION_ORDER;
        }
        return byField(sortBy).thenComparing(INSERTION_ORDER);
    }

    /** Similarity searches: by the sort field when given, then closest first */
    static Comparator<ScoredObject> forScored(SortByOptions sortBy) {
        Comparator<ScoredObject> byDistance = Comparator.comparingDouble(ScoredObject::distance)
                .thenComparing(ScoredObject::row, INSERTION_ORDER);
        if (sortBy == null) {
            return byDistance;
        }
        return Comparator.comparing(ScoredObject::row, byField(sortBy)).thenComparing(byDistance);
    }

    private static Comparator<ObjectRow> byField(SortByOptions sortBy) {
        FieldRef field = FieldRef.of(sortBy.field(), sortBy.forceNotPayload());
        Comparator<PayloadValue> values = ResultOrdering::compareValues;
        Comparator<PayloadValue> ordered = sortBy.order() == SortOrder.DESC ? values.reversed() : values;
        return Comparator.comparing((ObjectRow row) -> row.resolve(field), missingLast(ordered));
    }

    private static Comparator<Optional<PayloadValue>> missingLast(Comparator<PayloadValue> values) {
        return (a, b) -> {
            if (a.isEmpty() || b.isEmpty()) {
                return Boolean.compare(a.isEmpty(), b.isEmpty());
            }
            return values.compare(a.get(), b.get());
        };
    }

    /** Numbers, then booleans, then strings, then anything else; compared within the same kind */
    static int compareValues(PayloadValue a, PayloadValue b) {
        int byKind = Integer.compare(kindRank(a), kindRank(b));
        if (byKind != 0) {
            return byKind;
        }
        if (a instanceof PayloadValue.NumberValue x && b instanceof PayloadValue.NumberValue y) {
            return x.value().compareTo(y.value());
        }
        if (a instanceof PayloadValue.BoolValue x && b instanceof PayloadValue.BoolValue y) {
            return Boolean.compare(x.value(), y.value());
        }
        return a.asText().compareTo(b.asText());
    }

    private static int kindRank(PayloadValue value) {
        if (value instanceof PayloadValue.NumberValue) {
            return 0;
        }
        if (value instanceof PayloadValue.BoolValue) {
            return 1;
        }
        if (value instanceof PayloadValue.StringValue) {
            return 2;
        }
        return 3;
    }
}
