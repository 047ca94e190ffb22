package com.streamfirst.ddns.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Full set of DNS-style records for one domain at a point in time, as stored in the content
 * store. Values are strings; structured values (MX preference/exchange pairs and the like) are
 * kept in their canonical JSON form.
 *
 * <p>A record set that did not come from the content store, but was synthesized because the real
 * one could not be retrieved, has {@code reliable == false}.
 */
@Value
@Builder(toBuilder = true)
public class RecordSet {

    /** TTL applied when the source does not specify one. */
    public static final int DEFAULT_TTL_SECONDS = 3600;

    String domain;

    /** Record type to values, in document order */
    @Singular Map<String, List<String>> records;

    /** TTL in seconds applied to every record of the set, null when the document has none */
    Integer ttl;

    Instant timestamp;

    @Builder.Default boolean reliable = true;

    /** TTL every record of this set resolves with. */
    public int effectiveTtl() {
        return ttl != null && ttl > 0 ? ttl : DEFAULT_TTL_SECONDS;
    }

    public List<String> values(String type) {
        return records.getOrDefault(type, List.of());
    }

    /** Projection used by point lookups: the first value of a multi-valued type. */
    public Optional<String> firstValue(String type) {
        return values(type).stream().findFirst();
    }

    /** The record a point lookup of {@code type} answers with, if the set holds one. */
    public Optional<ResolvedRecord> record(String type) {
        return firstValue(type).map(value -> new ResolvedRecord(type, value, effectiveTtl(), timestamp));
    }

    public boolean isEmpty() {
        return records.values().stream().allMatch(List::isEmpty);
    }

    /**
     * Flattens the set into parallel arrays, one entry per value, in document order. A type with
     * several values (multiple A records, say) contributes one entry per value.
     */
    public FlattenedRecords flatten() {
        List<String> types = new ArrayList<>();
        List<String> values = new ArrayList<>();
        List<Integer> ttls = new ArrayList<>();
        int recordTtl = effectiveTtl();
        records.forEach((type, typeValues) -> {
            for (String value : typeValues) {
                types.add(type);
                values.add(value);
                ttls.add(recordTtl);
            }
        });
        return new FlattenedRecords(types, values, ttls);
    }
}
