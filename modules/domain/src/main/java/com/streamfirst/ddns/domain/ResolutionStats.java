package com.streamfirst.ddns.domain;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time snapshot of the resolution engine's counters, with derived averages.
 */
@Value
@Builder
public class ResolutionStats {
    long totalQueries;
    long cacheHits;
    long fastQueries;
    long authoritativeQueries;
    long fastErrors;
    long authoritativeErrors;
    long tierTimeouts;
    long consistencyWarnings;
    /** Cumulative latency of successful fast-tier calls */
    Duration fastLatency;
    /** Cumulative latency of successful authoritative-tier calls */
    Duration authoritativeLatency;

    public Duration averageFastLatency() {
        return average(fastLatency, fastQueries - fastErrors);
    }

    public Duration averageAuthoritativeLatency() {
        return average(authoritativeLatency, authoritativeQueries - authoritativeErrors);
    }

    /** Percentage of queries answered from cache. */
    public double cacheHitRate() {
        return totalQueries > 0 ? (cacheHits * 100.0) / totalQueries : 0.0;
    }

    /**
     * Percentage by which the fast tier is quicker than the authoritative tier on average. Zero
     * until both tiers have at least one successful sample.
     */
    public double latencyReduction() {
        long authoritativeNanos = averageAuthoritativeLatency().toNanos();
        long fastNanos = averageFastLatency().toNanos();
        if (fastQueries - fastErrors <= 0
                || authoritativeQueries - authoritativeErrors <= 0
                || authoritativeNanos == 0) {
            return 0.0;
        }
        return ((authoritativeNanos - fastNanos) * 100.0) / authoritativeNanos;
    }

    private static Duration average(Duration total, long samples) {
        if (total == null || samples <= 0) {
            return Duration.ZERO;
        }
        return total.dividedBy(samples);
    }
}
