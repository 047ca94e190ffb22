package com.streamfirst.ddns.domain;

import java.time.Instant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A cached resolution, valid for reads while {@code now < storedAt + ttl}.
 */
@Value
@Builder
public class CacheEntry {
    @NonNull String value;

    /** Seconds the entry stays valid after {@link #storedAt} */
    int ttl;

    @NonNull @Builder.Default ContentRef contentRef = ContentRef.NONE;

    /** Tier that originally produced the value */
    @NonNull ResolutionSource source;

    @NonNull Instant storedAt;

    public Instant expiresAt() {
        return storedAt.plusSeconds(ttl);
    }

    public boolean isLiveAt(@NonNull Instant now) {
        return now.isBefore(expiresAt());
    }
}
