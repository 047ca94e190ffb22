package com.streamfirst.ddns.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One DNS-style record.
 *
 * @param type record type tag (e.g., "A", "MX")
 * @param value record value, possibly a serialized structured value
 * @param ttl time to live in seconds
 * @param timestamp when the record was written
 */
public record ResolvedRecord(String type, String value, int ttl, Instant timestamp) {

    public ResolvedRecord {
        Objects.requireNonNull(type, "Record type cannot be null");
        if (ttl <= 0) {
            ttl = RecordSet.DEFAULT_TTL_SECONDS;
        }
    }
}
