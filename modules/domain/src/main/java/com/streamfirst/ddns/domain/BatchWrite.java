package com.streamfirst.ddns.domain;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

/**
 * One atomic write of all record types of a domain to the fast ledger. The content reference the
 * records were derived from travels with the write so readers can later verify provenance.
 */
@Value
public class BatchWrite {
    @NonNull DomainKey domainKey;
    @NonNull ContentRef contentRef;
    @NonNull FlattenedRecords records;

    public static BatchWrite of(DomainKey domainKey, ContentRef contentRef, FlattenedRecords records) {
        return new BatchWrite(domainKey, contentRef, records);
    }

    public List<String> types() {
        return records.getTypes();
    }

    public List<String> values() {
        return records.getValues();
    }

    public List<Integer> ttls() {
        return records.getTtls();
    }
}
