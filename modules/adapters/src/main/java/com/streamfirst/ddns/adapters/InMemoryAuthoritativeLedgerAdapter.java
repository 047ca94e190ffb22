package com.streamfirst.ddns.adapters;

import com.streamfirst.ddns.domain.*;
import com.streamfirst.ddns.ports.AuthoritativeLedgerPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory simulation of the authoritative registry ledger for testing and development.
 * Every mutation is mined into its own block: the height advances by one and the matching event
 * is recorded at the new height. Data is lost when the application stops.
 */
@Slf4j
public class InMemoryAuthoritativeLedgerAdapter implements AuthoritativeLedgerPort {

    private final Clock clock;
    private final AtomicLong height;
    private final Map<DomainKey, DomainRecordSet> domains = new ConcurrentHashMap<>();
    private final List<DomainUpdatedEvent> updateEvents = new CopyOnWriteArrayList<>();
    private final List<DomainRegisteredEvent> registerEvents = new CopyOnWriteArrayList<>();

    public InMemoryAuthoritativeLedgerAdapter() {
        this(Clock.systemUTC(), 0L);
    }

    public InMemoryAuthoritativeLedgerAdapter(Clock clock, long genesisHeight) {
        this.clock = clock;
        this.height = new AtomicLong(genesisHeight);
    }

    @Override
    public long currentHeight() {
        return height.get();
    }

    @Override
    public List<DomainUpdatedEvent> queryUpdateEvents(long fromHeight, long toHeight) {
        List<DomainUpdatedEvent> events = updateEvents.stream()
                .filter(e -> e.height() >= fromHeight && e.height() <= toHeight)
                .toList();
        log.debug("Found {} update events in [{}, {}]", events.size(), fromHeight, toHeight);
        return events;
    }

    @Override
    public List<DomainRegisteredEvent> queryRegisterEvents(long fromHeight, long toHeight) {
        List<DomainRegisteredEvent> events = registerEvents.stream()
                .filter(e -> e.height() >= fromHeight && e.height() <= toHeight)
                .toList();
        log.debug("Found {} register events in [{}, {}]", events.size(), fromHeight, toHeight);
        return events;
    }

    @Override
    public DomainRecordSet getDomainRecord(DomainKey domainKey) {
        return domains.getOrDefault(domainKey, DomainRecordSet.unregistered());
    }

    /**
     * Registers a domain without content.
     *
     * @return the height the registration was mined at
     * @throws IllegalStateException if the domain is registered and not expired
     */
    public synchronized long registerDomain(DomainKey domainKey, String owner, Duration term) {
        Instant now = clock.instant();
        DomainRecordSet existing = domains.get(domainKey);
        if (existing != null && existing.isRegistered() && !existing.isExpiredAt(now)) {
            throw new IllegalStateException("Domain already registered: " + domainKey);
        }
        long minedAt = height.incrementAndGet();
        domains.put(domainKey, DomainRecordSet.builder()
                .owner(owner)
                .contentRef(ContentRef.NONE)
                .lastUpdated(now)
                .expiry(now.plus(term))
                .build());
        registerEvents.add(new DomainRegisteredEvent(domainKey, owner, minedAt));
        log.info("Registered domain {} for {} at height {}", domainKey, owner, minedAt);
        return minedAt;
    }

    /**
     * Points a registered domain at new content.
     *
     * @return the height the update was mined at
     * @throws IllegalStateException if the domain is not registered
     */
    public synchronized long updateDomain(DomainKey domainKey, ContentRef contentRef) {
        DomainRecordSet existing = domains.get(domainKey);
        if (existing == null || !existing.isRegistered()) {
            throw new IllegalStateException("Domain not registered: " + domainKey);
        }
        long minedAt = height.incrementAndGet();
        domains.put(domainKey, DomainRecordSet.builder()
                .owner(existing.getOwner())
                .contentRef(contentRef)
                .lastUpdated(clock.instant())
                .expiry(existing.getExpiry())
                .build());
        updateEvents.add(new DomainUpdatedEvent(domainKey, contentRef, minedAt));
        log.info("Updated domain {} to content {} at height {}", domainKey, contentRef, minedAt);
        return minedAt;
    }

    /**
     * Extends a registration. The expiry only ever moves forward.
     */
    public synchronized void renewDomain(DomainKey domainKey, Duration extension) {
        DomainRecordSet existing = domains.get(domainKey);
        if (existing == null || !existing.isRegistered()) {
            throw new IllegalStateException("Domain not registered: " + domainKey);
        }
        height.incrementAndGet();
        domains.put(domainKey, DomainRecordSet.builder()
                .owner(existing.getOwner())
                .contentRef(existing.getContentRef())
                .lastUpdated(existing.getLastUpdated())
                .expiry(existing.getExpiry().plus(extension))
                .build());
    }

    /**
     * Overwrites a domain's record without emitting events. Lets tests set up states the event
     * history could not produce, such as an already-expired registration.
     */
    public void putDomainRecord(DomainKey domainKey, DomainRecordSet record) {
        domains.put(domainKey, record);
    }

    /**
     * Mines empty blocks.
     *
     * @return the new height
     */
    public long mineBlocks(long count) {
        return height.addAndGet(count);
    }
}
