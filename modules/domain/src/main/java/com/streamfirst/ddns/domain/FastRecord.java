package com.streamfirst.ddns.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Point read from the fast ledger.
 *
 * @param value the stored value, null when the fast ledger holds nothing for the type
 * @param ttl stored ttl in seconds
 * @param timestamp when the value was written, null when absent
 * @param contentRef content reference the value was synced from, {@link ContentRef#NONE} if unknown
 */
public record FastRecord(String value, int ttl, Instant timestamp, ContentRef contentRef) {
    public FastRecord {
        Objects.requireNonNull(contentRef, "Content reference cannot be null, use ContentRef.NONE");
    }

    public static FastRecord empty() {
        return new FastRecord(null, 0, null, ContentRef.NONE);
    }

    public boolean hasValue() {
        return value != null && !value.isEmpty();
    }
}
