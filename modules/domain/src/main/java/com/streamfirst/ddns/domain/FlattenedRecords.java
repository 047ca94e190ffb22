package com.streamfirst.ddns.domain;

import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;
import lombok.Value;

/**
 * Parallel (type, value, ttl) arrays: the shape in which a record set is written to the fast
 * ledger in a single batch.
 */
@Value
public class FlattenedRecords {
    List<String> types;
    List<String> values;
    List<Integer> ttls;

    public FlattenedRecords(
            @NonNull List<String> types, @NonNull List<String> values, @NonNull List<Integer> ttls) {
        if (types.size() != values.size() || types.size() != ttls.size()) {
            throw new IllegalArgumentException(String.format(
                    "Record arrays differ in length: types=%d values=%d ttls=%d",
                    types.size(), values.size(), ttls.size()));
        }
        this.types = List.copyOf(types);
        this.values = List.copyOf(values);
        this.ttls = List.copyOf(ttls);
    }

    public int size() {
        return types.size();
    }

    public boolean isEmpty() {
        return types.isEmpty();
    }

    /** Returns a copy with one more entry appended. */
    public FlattenedRecords plus(String type, String value, int ttl) {
        List<String> t = new ArrayList<>(types);
        List<String> v = new ArrayList<>(values);
        List<Integer> l = new ArrayList<>(ttls);
        t.add(type);
        v.add(value);
        l.add(ttl);
        return new FlattenedRecords(t, v, l);
    }
}
