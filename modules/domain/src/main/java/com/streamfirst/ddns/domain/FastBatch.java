package com.streamfirst.ddns.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Batch read from the fast ledger: one slot per requested type, in request order. Slots for types
 * the ledger does not hold contain a null value, a zero ttl and a null timestamp.
 *
 * @param contentRef aggregate content reference of the domain's last batch write
 */
public record FastBatch(
        List<String> values, List<Integer> ttls, List<Instant> timestamps, ContentRef contentRef) {
    public FastBatch {
        Objects.requireNonNull(values, "values cannot be null");
        Objects.requireNonNull(ttls, "ttls cannot be null");
        Objects.requireNonNull(timestamps, "timestamps cannot be null");
        Objects.requireNonNull(contentRef, "Content reference cannot be null, use ContentRef.NONE");
        if (values.size() != ttls.size() || values.size() != timestamps.size()) {
            throw new IllegalArgumentException("Batch arrays differ in length");
        }
        // slots may hold nulls, so List.copyOf is not an option
        values = Collections.unmodifiableList(values);
        ttls = Collections.unmodifiableList(ttls);
        timestamps = Collections.unmodifiableList(timestamps);
    }
}
