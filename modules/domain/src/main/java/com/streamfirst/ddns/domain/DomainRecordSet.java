package com.streamfirst.ddns.domain;

import java.time.Instant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Authoritative snapshot of one domain as held by the authoritative ledger. A snapshot without an
 * owner describes an unregistered domain and carries no valid records.
 */
@Value
@Builder
public class DomainRecordSet {

    /** Current owner identity, null when the domain is not registered */
    String owner;

    /** Pointer to the domain's record set in the content store */
    @NonNull @Builder.Default ContentRef contentRef = ContentRef.NONE;

    /** When the content reference was last changed */
    Instant lastUpdated;

    /** Instant from which the registration is no longer valid */
    Instant expiry;

    public static DomainRecordSet unregistered() {
        return DomainRecordSet.builder().build();
    }

    public boolean isRegistered() {
        return owner != null && !owner.isBlank();
    }

    /** A registration is expired from its expiry instant onwards. */
    public boolean isExpiredAt(@NonNull Instant now) {
        return expiry != null && !now.isBefore(expiry);
    }
}
