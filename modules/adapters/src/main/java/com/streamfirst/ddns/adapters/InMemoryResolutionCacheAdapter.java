package com.streamfirst.ddns.adapters;

import com.streamfirst.ddns.domain.CacheEntry;
import com.streamfirst.ddns.domain.DomainKey;
import com.streamfirst.ddns.ports.ResolutionCachePort;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of ResolutionCachePort.
 * Entries are immutable and replaced as a whole, so a reader never sees a half-written entry.
 * Expired entries are skipped on read and left in place until overwritten or cleared.
 */
@Slf4j
public class InMemoryResolutionCacheAdapter implements ResolutionCachePort {

    private final Map<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry> get(DomainKey domainKey, String type, Instant now) {
        CacheEntry entry = entries.get(new CacheKey(domainKey, type));
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isLiveAt(now)) {
            log.debug("Cache entry for {} {} expired at {}", domainKey, type, entry.expiresAt());
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public void put(DomainKey domainKey, String type, CacheEntry entry) {
        Objects.requireNonNull(entry, "Cache entry cannot be null");
        entries.put(new CacheKey(domainKey, type), entry);
    }

    @Override
    public void clear() {
        log.info("Clearing {} cache entries", entries.size());
        entries.clear();
    }

    @Override
    public int size() {
        return entries.size();
    }

    private record CacheKey(DomainKey domainKey, String type) {
        CacheKey {
            Objects.requireNonNull(domainKey, "Domain key cannot be null");
            Objects.requireNonNull(type, "Record type cannot be null");
        }
    }
}
