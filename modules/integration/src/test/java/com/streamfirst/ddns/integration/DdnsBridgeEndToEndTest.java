package com.streamfirst.ddns.integration;

import com.streamfirst.ddns.adapters.*;
import com.streamfirst.ddns.application.*;
import com.streamfirst.ddns.domain.*;
import com.streamfirst.ddns.ports.*;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test of the bridge: domains are registered and updated on the authoritative
 * ledger, synchronized into the fast ledger, and resolved through the tiered router.
 *
 * All ports are backed by the in-memory adapters, so the whole pipeline runs in-process.
 */
@Slf4j
public class DdnsBridgeEndToEndTest {

    private static final String DOMAIN = "example.eth";
    private static final DomainKey KEY = DomainKeys.keyOf(DOMAIN);
    private static final String OWNER = "0x00000000000000000000000000000000000000aa";

    // ENS contenthash and the CIDv0 it decodes to
    private static final ContentRef CONTENT_HASH = ContentRef.of(
            "0xe3010170122029f2d17be6139079dc48696d1f582a8530eb9805b561eda517e22a892c7e3f1f");
    private static final String CID = "QmRAQB6YaCyidP37UdDnjFY5vQuiBrcqdyoW1CuDgwxkD4";

    // Adapters
    private InMemoryAuthoritativeLedgerAdapter authoritativeLedger;
    private InMemoryFastLedgerAdapter fastLedger;
    private InMemorySyncQueueAdapter syncQueue;
    private InMemoryContentStoreAdapter contentStore;
    private InMemoryResolutionCacheAdapter resolutionCache;

    // Application services
    private ContentResolver contentResolver;
    private TierCallExecutor tierCallExecutor;
    private SyncOrchestrator syncOrchestrator;
    private ResolutionRouter resolutionRouter;

    private final Clock clock = Clock.systemUTC();

    @BeforeEach
    void setupBridge() {
        log.info("Setting up bridge with in-memory ledgers");

        authoritativeLedger = new InMemoryAuthoritativeLedgerAdapter(clock, 0L);
        fastLedger = new InMemoryFastLedgerAdapter(clock);
        syncQueue = new InMemorySyncQueueAdapter();
        contentStore = new InMemoryContentStoreAdapter();
        resolutionCache = new InMemoryResolutionCacheAdapter();

        contentResolver = new ContentResolver(
            contentStore, new EnsContentHashDecoder(), new PlaceholderRecordSetProvider(clock));
        tierCallExecutor = new TierCallExecutor(Duration.ofSeconds(2), 4);

        syncOrchestrator = newSyncOrchestrator(SyncSettings.builder()
            .pollInterval(Duration.ofHours(1))
            .applyInterval(Duration.ofHours(1))
            .build());
        resolutionRouter = newResolutionRouter(fastLedger);
    }

    @AfterEach
    void tearDown() {
        syncOrchestrator.stop();
        tierCallExecutor.close();
    }

    private SyncOrchestrator newSyncOrchestrator(SyncSettings settings) {
        return new SyncOrchestrator(
            authoritativeLedger, fastLedger, syncQueue, contentResolver, settings, clock);
    }

    private ResolutionRouter newResolutionRouter(FastLedgerPort fast) {
        return new ResolutionRouter(
            authoritativeLedger, fast, contentResolver, resolutionCache, tierCallExecutor,
            ResolutionSettings.defaults(), clock);
    }

    private void syncAll() {
        syncOrchestrator.pollOnce();
        while (syncQueue.size() > 0) {
            syncOrchestrator.applyOnce();
        }
    }

    /**
     * Register, point at content, sync, resolve.
     *
     * Flow:
     * 1. Register the domain without content; polling queues nothing
     * 2. Update it to an ENS contenthash whose record set holds one A record
     * 3. Poll and apply once; the fast ledger receives a single batch
     * 4. Resolve through the router, verified against the authoritative ledger
     */
    @Test
    void testRegisterUpdateSyncAndResolve() {
        authoritativeLedger.registerDomain(KEY, OWNER, Duration.ofDays(365));
        assertEquals(0, syncOrchestrator.pollOnce(), "Registration without content should not be queued");
        assertEquals(0, syncQueue.size());

        contentStore.put(CID, RecordSet.builder().record("A", List.of("1.2.3.4")).build());
        authoritativeLedger.updateDomain(KEY, CONTENT_HASH);

        assertEquals(1, syncOrchestrator.pollOnce(), "Update should queue one task");
        SyncTask task = syncQueue.snapshot().get(0);
        assertEquals(SyncTask.Kind.UPDATE, task.getKind());
        assertEquals(0, task.getRetryCount());

        assertEquals(1, syncOrchestrator.applyOnce());

        List<BatchWrite> writes = fastLedger.getSubmittedWrites();
        assertEquals(1, writes.size(), "One batch write per task");
        assertEquals(List.of("A"), writes.get(0).types());
        assertEquals(List.of("1.2.3.4"), writes.get(0).values());
        assertEquals(List.of(3600), writes.get(0).ttls());

        FastRecord record = fastLedger.getRecord(KEY, "A");
        assertEquals("1.2.3.4", record.value());
        assertEquals(3600, record.ttl());
        assertNotNull(record.timestamp());

        ResolutionResult result = resolutionRouter.resolve(DOMAIN, "A",
            ResolveOptions.builder().verify(true).build());
        assertEquals(ResolutionSource.FAST, result.getSource());
        assertEquals("1.2.3.4", result.getValue());
        assertFalse(result.isConsistencyWarning(), "Synced data should verify");

        ResolutionResult cached = resolutionRouter.resolve(DOMAIN, "A", null);
        assertEquals(ResolutionSource.CACHE, cached.getSource());

        SyncStats stats = syncOrchestrator.getStats();
        assertEquals(2, stats.getEventsProcessed());
        assertEquals(1, stats.getUpdatesSynced());
        assertEquals(0, stats.totalErrors());
    }

    /**
     * An expired registration resolves to nothing, and its content is never fetched.
     */
    @Test
    void testExpiredDomainResolvesEmpty() {
        contentStore.put(CID, RecordSet.builder().record("A", List.of("1.2.3.4")).build());
        Instant now = clock.instant();
        authoritativeLedger.putDomainRecord(KEY, DomainRecordSet.builder()
            .owner(OWNER)
            .contentRef(CONTENT_HASH)
            .lastUpdated(now.minus(Duration.ofDays(400)))
            .expiry(now.minus(Duration.ofDays(1)))
            .build());

        ResolutionResult result = resolutionRouter.resolve(DOMAIN, "A",
            ResolveOptions.builder().forceAuthoritative(true).build());

        assertNull(result.getValue());
        assertEquals(ResolutionSource.AUTHORITATIVE, result.getSource());
        assertEquals("expired", result.getError());
        assertEquals(0, contentStore.getFetchCount(), "Expired domains must not hit the content store");
    }

    /**
     * Content that cannot be fetched is synced as a tagged placeholder; once the real content is
     * available, verification replaces the placeholder answer with the authoritative one.
     */
    @Test
    void testPlaceholderIsOverruledByVerification() {
        authoritativeLedger.registerDomain(KEY, OWNER, Duration.ofDays(365));
        authoritativeLedger.updateDomain(KEY, CONTENT_HASH);

        syncOrchestrator.pollOnce();
        syncOrchestrator.applyOnce();

        assertEquals("fallback", fastLedger.getRecord(KEY, "_source").value());
        assertEquals(1, syncOrchestrator.getStats().getFallbackApplies());
        String placeholder = fastLedger.getRecord(KEY, "A").value();
        assertTrue(placeholder.startsWith("192.168.1."), "Placeholder A record expected");

        contentStore.put(CID, RecordSet.builder().record("A", List.of("1.2.3.4")).build());
        ResolutionResult verified = resolutionRouter.resolve(DOMAIN, "A",
            ResolveOptions.builder().verify(true).skipCache(true).build());

        assertEquals(ResolutionSource.AUTHORITATIVE, verified.getSource());
        assertEquals("1.2.3.4", verified.getValue());
        assertTrue(verified.isConsistencyWarning());
        assertEquals(1, resolutionRouter.getStats().getConsistencyWarnings());
    }

    /**
     * A reliable sync after a placeholder sync leaves nothing of the placeholder behind.
     *
     * Flow:
     * 1. Sync a contenthash whose record set is missing; the placeholder fills A, AAAA, TXT and MX
     * 2. Point the domain at a record set holding only an A record and sync again
     * 3. Verified lookups see the real A record, and the placeholder AAAA and marker are gone
     */
    @Test
    void testReliableSyncReplacesPlaceholderRecords() {
        authoritativeLedger.registerDomain(KEY, OWNER, Duration.ofDays(365));
        authoritativeLedger.updateDomain(KEY, CONTENT_HASH);
        syncAll();
        assertNotNull(fastLedger.getRecord(KEY, "AAAA").value(), "Placeholder AAAA record expected");

        contentStore.put("QmRealRecords", RecordSet.builder().record("A", List.of("1.2.3.4")).build());
        authoritativeLedger.updateDomain(KEY, ContentRef.of("QmRealRecords"));
        syncAll();

        ResolveOptions verify = ResolveOptions.builder().verify(true).skipCache(true).build();
        ResolutionResult a = resolutionRouter.resolve(DOMAIN, "A", verify);
        ResolutionResult aaaa = resolutionRouter.resolve(DOMAIN, "AAAA", verify);

        assertEquals("1.2.3.4", a.getValue());
        assertEquals(ResolutionSource.FAST, a.getSource());
        assertFalse(a.isConsistencyWarning());
        assertNull(aaaa.getValue(), "Placeholder AAAA must not survive a reliable sync");
        assertNull(fastLedger.getRecord(KEY, "_source").value());
        assertEquals(0, resolutionRouter.getStats().getConsistencyWarnings());
    }

    /**
     * With the fast ledger down, queries are still answered by the authoritative ledger.
     */
    @Test
    void testFastTierOutageFallsBackToAuthoritative() {
        contentStore.put(CID, RecordSet.builder().record("A", List.of("1.2.3.4")).ttl(120).build());
        authoritativeLedger.registerDomain(KEY, OWNER, Duration.ofDays(365));
        authoritativeLedger.updateDomain(KEY, CONTENT_HASH);

        InMemoryFastLedgerAdapter down = new InMemoryFastLedgerAdapter(clock) {
            @Override
            public FastRecord getRecord(DomainKey domainKey, String type) {
                throw new LedgerUnavailableException("fast ledger offline");
            }
        };
        resolutionRouter = newResolutionRouter(down);

        ResolutionResult result = resolutionRouter.resolve(DOMAIN, "A", null);

        assertEquals(ResolutionSource.AUTHORITATIVE, result.getSource());
        assertEquals("1.2.3.4", result.getValue());
        assertEquals(120, result.getTtl());
        assertEquals(OWNER, result.getOwner());
        assertEquals(1, resolutionRouter.getStats().getFastErrors());
    }

    /**
     * The scheduled cycles pick up an update without manual ticks and stop cleanly.
     */
    @Test
    void testScheduledSyncAndStop() throws Exception {
        syncOrchestrator = newSyncOrchestrator(SyncSettings.builder()
            .pollInterval(Duration.ofMillis(50))
            .applyInterval(Duration.ofMillis(10))
            .build());
        contentStore.put(CID, RecordSet.builder().record("A", List.of("1.2.3.4")).build());
        authoritativeLedger.registerDomain(KEY, OWNER, Duration.ofDays(365));
        authoritativeLedger.updateDomain(KEY, CONTENT_HASH);

        assertTrue(syncOrchestrator.start(), "Sync engine should start");

        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!fastLedger.getRecord(KEY, "A").hasValue() && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertEquals("1.2.3.4", fastLedger.getRecord(KEY, "A").value());

        assertTrue(syncOrchestrator.stop(), "Stop should complete within the grace period");
        assertFalse(syncOrchestrator.isRunning());
        assertEquals(0, syncOrchestrator.getStats().getInFlight());
    }
}
