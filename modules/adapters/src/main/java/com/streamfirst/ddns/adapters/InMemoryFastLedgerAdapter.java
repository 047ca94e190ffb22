package com.streamfirst.ddns.adapters;

import com.streamfirst.ddns.domain.*;
import com.streamfirst.ddns.ports.FastLedgerPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory simulation of the fast resolver ledger for testing and development.
 * A batch write replaces every record the domain held, along with its content reference, so
 * types left out of the write no longer resolve. Writing the same batch twice leaves the same
 * state. Writes are confirmed immediately.
 */
@Slf4j
public class InMemoryFastLedgerAdapter implements FastLedgerPort {

    private final Clock clock;
    private final AtomicLong height = new AtomicLong();
    private final Map<DomainKey, StoredDomain> domains = new ConcurrentHashMap<>();
    private final List<BatchWrite> submittedWrites = new CopyOnWriteArrayList<>();

    public InMemoryFastLedgerAdapter() {
        this(Clock.systemUTC());
    }

    public InMemoryFastLedgerAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public FastRecord getRecord(DomainKey domainKey, String type) {
        StoredDomain domain = domains.get(domainKey);
        if (domain == null) {
            return FastRecord.empty();
        }
        StoredType stored = domain.types().get(type);
        if (stored == null || stored.values().isEmpty()) {
            return FastRecord.empty();
        }
        return new FastRecord(stored.values().get(0), stored.ttl(), stored.timestamp(), domain.contentRef());
    }

    @Override
    public FastBatch getBatchRecords(DomainKey domainKey, List<String> types) {
        StoredDomain domain = domains.get(domainKey);
        List<String> values = new ArrayList<>(types.size());
        List<Integer> ttls = new ArrayList<>(types.size());
        List<Instant> timestamps = new ArrayList<>(types.size());
        for (String type : types) {
            StoredType stored = domain == null ? null : domain.types().get(type);
            if (stored == null || stored.values().isEmpty()) {
                values.add(null);
                ttls.add(0);
                timestamps.add(null);
            } else {
                values.add(stored.values().get(0));
                ttls.add(stored.ttl());
                timestamps.add(stored.timestamp());
            }
        }
        return new FastBatch(values, ttls, timestamps, domain == null ? ContentRef.NONE : domain.contentRef());
    }

    @Override
    public PendingWrite submitBatchWrite(BatchWrite write) {
        if (write.getRecords().isEmpty()) {
            throw new IllegalArgumentException("Batch write for " + write.getDomainKey() + " has no records");
        }
        Instant now = clock.instant();
        Map<String, StoredType> written = new LinkedHashMap<>();
        for (int i = 0; i < write.types().size(); i++) {
            String type = write.types().get(i);
            StoredType previous = written.get(type);
            List<String> values = previous == null ? new ArrayList<>() : new ArrayList<>(previous.values());
            values.add(write.values().get(i));
            written.put(type, new StoredType(List.copyOf(values), write.ttls().get(i), now));
        }
        domains.put(write.getDomainKey(), new StoredDomain(write.getContentRef(), Map.copyOf(written)));
        submittedWrites.add(write);
        long includedAt = height.incrementAndGet();
        String transactionId = "0x" + UUID.randomUUID().toString().replace("-", "");
        log.debug("Applied batch write {} for {} with {} records at height {}",
                 transactionId, write.getDomainKey(), write.getRecords().size(), includedAt);
        return new ConfirmedWrite(transactionId, includedAt);
    }

    /**
     * Gets every batch write accepted so far, in submission order.
     */
    public List<BatchWrite> getSubmittedWrites() {
        return List.copyOf(submittedWrites);
    }

    /**
     * Gets all values held for a record type, not just the first.
     */
    public List<String> getAllValues(DomainKey domainKey, String type) {
        StoredDomain domain = domains.get(domainKey);
        if (domain == null || !domain.types().containsKey(type)) {
            return List.of();
        }
        return domain.types().get(type).values();
    }

    private record StoredType(List<String> values, int ttl, Instant timestamp) {}

    private record StoredDomain(ContentRef contentRef, Map<String, StoredType> types) {}

    private record ConfirmedWrite(String transactionId, long height) implements PendingWrite {
        @Override
        public WriteConfirmation awaitConfirmations(int depth) {
            return new WriteConfirmation(transactionId, height, Math.max(depth, 1));
        }
    }
}
