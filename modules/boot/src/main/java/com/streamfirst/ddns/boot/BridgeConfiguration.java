package com.streamfirst.ddns.boot;

import com.streamfirst.ddns.adapters.InMemoryAuthoritativeLedgerAdapter;
import com.streamfirst.ddns.adapters.InMemoryContentStoreAdapter;
import com.streamfirst.ddns.adapters.InMemoryFastLedgerAdapter;
import com.streamfirst.ddns.adapters.InMemoryResolutionCacheAdapter;
import com.streamfirst.ddns.adapters.InMemorySyncQueueAdapter;
import com.streamfirst.ddns.adapters.content.ipfs.IpfsGatewayContentStoreAdapter;
import com.streamfirst.ddns.application.ContentRefDecoder;
import com.streamfirst.ddns.application.ContentResolver;
import com.streamfirst.ddns.application.DomainKeys;
import com.streamfirst.ddns.application.EnsContentHashDecoder;
import com.streamfirst.ddns.application.FallbackRecordSetProvider;
import com.streamfirst.ddns.application.PlaceholderRecordSetProvider;
import com.streamfirst.ddns.application.ResolutionRouter;
import com.streamfirst.ddns.application.SyncOrchestrator;
import com.streamfirst.ddns.application.TierCallExecutor;
import com.streamfirst.ddns.domain.ContentRef;
import com.streamfirst.ddns.domain.DomainKey;
import com.streamfirst.ddns.domain.RecordSet;
import com.streamfirst.ddns.ports.AuthoritativeLedgerPort;
import com.streamfirst.ddns.ports.ContentStorePort;
import com.streamfirst.ddns.ports.FastLedgerPort;
import com.streamfirst.ddns.ports.ResolutionCachePort;
import com.streamfirst.ddns.ports.SyncQueuePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires the bridge: ledgers, content store, sync engine and resolution engine.
 * The ledgers are the in-memory simulations; the content store is an IPFS gateway when
 * {@code ddns.ipfs.gateway} is set and in-memory otherwise.
 */
@Slf4j
@Configuration
public class BridgeConfiguration {

    // --- Adapter beans ---

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InMemoryAuthoritativeLedgerAdapter authoritativeLedger(Clock clock) {
        log.info("Creating authoritative ledger (in-memory)");
        return new InMemoryAuthoritativeLedgerAdapter(clock, 0L);
    }

    @Bean
    public InMemoryFastLedgerAdapter fastLedger(Clock clock) {
        log.info("Creating fast ledger (in-memory)");
        return new InMemoryFastLedgerAdapter(clock);
    }

    @Bean
    public SyncQueuePort syncQueue() {
        return new InMemorySyncQueueAdapter();
    }

    @Bean
    public ResolutionCachePort resolutionCache() {
        return new InMemoryResolutionCacheAdapter();
    }

    @Bean
    public ContentStorePort contentStore(BridgeProperties properties) {
        BridgeProperties.Ipfs ipfs = properties.getIpfs();
        if (ipfs.getGateway() == null || ipfs.getGateway().isBlank()) {
            log.info("No IPFS gateway configured, keeping content in memory");
            return new InMemoryContentStoreAdapter();
        }
        log.info("Fetching content from IPFS gateway {}", ipfs.getGateway());
        return new IpfsGatewayContentStoreAdapter(URI.create(ipfs.getGateway()), ipfs.getRequestTimeout());
    }

    // --- Application service beans ---

    @Bean
    public ContentRefDecoder contentRefDecoder() {
        return new EnsContentHashDecoder();
    }

    @Bean
    public FallbackRecordSetProvider fallbackRecordSetProvider(Clock clock) {
        return new PlaceholderRecordSetProvider(clock);
    }

    @Bean
    public ContentResolver contentResolver(
            ContentStorePort contentStore, ContentRefDecoder decoder, FallbackRecordSetProvider fallback) {
        return new ContentResolver(contentStore, decoder, fallback);
    }

    @Bean(destroyMethod = "stop")
    public SyncOrchestrator syncOrchestrator(
            AuthoritativeLedgerPort authoritativeLedger,
            FastLedgerPort fastLedger,
            SyncQueuePort syncQueue,
            ContentResolver contentResolver,
            BridgeProperties properties,
            Clock clock) {
        return new SyncOrchestrator(authoritativeLedger, fastLedger, syncQueue, contentResolver,
                properties.getSync().toSettings(), clock);
    }

    @Bean(destroyMethod = "close")
    public TierCallExecutor tierCallExecutor(BridgeProperties properties) {
        BridgeProperties.Resolution resolution = properties.getResolution();
        return new TierCallExecutor(resolution.getTierTimeout(), resolution.getTierThreads());
    }

    @Bean
    public ResolutionRouter resolutionRouter(
            AuthoritativeLedgerPort authoritativeLedger,
            FastLedgerPort fastLedger,
            ContentResolver contentResolver,
            ResolutionCachePort resolutionCache,
            TierCallExecutor tierCallExecutor,
            BridgeProperties properties,
            Clock clock) {
        return new ResolutionRouter(authoritativeLedger, fastLedger, contentResolver, resolutionCache,
                tierCallExecutor, properties.getResolution().toSettings(), clock);
    }

    // --- Startup ---

    @Bean
    public CommandLineRunner bridgeRunner(
            BridgeProperties properties,
            SyncOrchestrator syncOrchestrator,
            InMemoryAuthoritativeLedgerAdapter authoritativeLedger,
            ContentStorePort contentStore) {
        return args -> {
            if (properties.getDemo().isEnabled()) {
                seedDemoDomain(properties.getDemo().getDomain(), authoritativeLedger, contentStore);
            }
            if (properties.getSync().isAutoStart()) {
                boolean started = syncOrchestrator.start();
                log.info("Sync engine {}", started ? "started" : "failed to start");
            }
        };
    }

    private static void seedDemoDomain(
            String domain, InMemoryAuthoritativeLedgerAdapter authoritativeLedger, ContentStorePort contentStore) {
        String locator = "QmRAQB6YaCyidP37UdDnjFY5vQuiBrcqdyoW1CuDgwxkD4";
        if (contentStore instanceof InMemoryContentStoreAdapter store) {
            store.put(locator, RecordSet.builder()
                    .domain(domain)
                    .record("A", List.of("192.0.2.10"))
                    .record("TXT", List.of("demo record set"))
                    .ttl(3600)
                    .build());
        }
        DomainKey key = DomainKeys.keyOf(domain);
        authoritativeLedger.registerDomain(key, "0x000000000000000000000000000000000000dEaD", Duration.ofDays(365));
        // ENS contenthash of the locator above
        authoritativeLedger.updateDomain(key, ContentRef.of(
                "0xe3010170122029f2d17be6139079dc48696d1f582a8530eb9805b561eda517e22a892c7e3f1f"));
        log.info("Seeded demo domain {} ({})", domain, key);
    }
}
