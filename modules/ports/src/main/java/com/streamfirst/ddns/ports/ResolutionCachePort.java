package com.streamfirst.ddns.ports;

import com.streamfirst.ddns.domain.CacheEntry;
import com.streamfirst.ddns.domain.DomainKey;

import java.time.Instant;
import java.util.Optional;

/**
 * Port for the lookaside cache of resolutions, keyed by domain and record type. Entries expire by
 * TTL only; there is no size-based eviction.
 */
public interface ResolutionCachePort {

    /**
     * Gets the entry for a domain and type if it is still live at {@code now}. Expired entries are
     * reported as absent.
     */
    Optional<CacheEntry> get(DomainKey domainKey, String type, Instant now);

    /** Stores an entry, replacing any previous one for the same domain and type. */
    void put(DomainKey domainKey, String type, CacheEntry entry);

    /** Drops every entry. */
    void clear();

    /** Number of stored entries, expired ones included. */
    int size();
}
