package com.streamfirst.ddns.domain;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Terminal answer to "what is record type T for domain D". Always returned, never thrown: an
 * unregistered or expired domain, or a total failure, is an empty result rather than an
 * exception.
 */
@Value
@Builder(toBuilder = true)
public class ResolutionResult {

    /** Error text attached to results for expired registrations. */
    public static final String EXPIRED = "expired";

    /** Resolved value, null when there is none */
    String value;

    /** Seconds the value may be cached, 0 for empty results */
    int ttl;

    @NonNull ResolutionSource source;

    @NonNull @Builder.Default ContentRef contentRef = ContentRef.NONE;

    /** When the answering tier recorded the value, if it reports one */
    Instant timestamp;

    /** Domain owner, known only for authoritative answers */
    String owner;

    /** Registration expiry, known only for authoritative answers */
    Instant expiry;

    /** Error detail for expired domains and failed resolutions */
    String error;

    /** Set when the fast tier disagreed with the authoritative tier and was overruled */
    boolean consistencyWarning;

    @NonNull @Builder.Default Duration latency = Duration.ZERO;

    public static ResolutionResult failure(String error) {
        return ResolutionResult.builder().source(ResolutionSource.ERROR).error(error).build();
    }

    public boolean hasValue() {
        return value != null;
    }

    public boolean isError() {
        return source == ResolutionSource.ERROR;
    }
}
