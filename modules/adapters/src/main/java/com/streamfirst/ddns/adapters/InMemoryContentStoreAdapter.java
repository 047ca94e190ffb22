package com.streamfirst.ddns.adapters;

import com.streamfirst.ddns.domain.RecordSet;
import com.streamfirst.ddns.ports.ContentStorePort;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of ContentStorePort for testing and development.
 * Record sets are stored directly under their locator.
 */
@Slf4j
public class InMemoryContentStoreAdapter implements ContentStorePort {

    private final Map<String, RecordSet> documents = new ConcurrentHashMap<>();
    private final AtomicInteger fetchCount = new AtomicInteger();

    @Override
    public Optional<RecordSet> fetch(String locator) {
        fetchCount.incrementAndGet();
        RecordSet recordSet = documents.get(locator);
        if (recordSet == null) {
            log.debug("No record set stored under {}", locator);
        }
        return Optional.ofNullable(recordSet);
    }

    /**
     * Stores a record set under a locator, replacing any previous one.
     */
    public void put(String locator, RecordSet recordSet) {
        documents.put(locator, recordSet);
    }

    /**
     * Gets how many fetches have been served, hits and misses alike.
     */
    public int getFetchCount() {
        return fetchCount.get();
    }
}
