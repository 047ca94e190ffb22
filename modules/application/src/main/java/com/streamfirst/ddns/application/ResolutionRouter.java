package com.streamfirst.ddns.application;

import com.streamfirst.ddns.domain.BatchResolutionResult;
import com.streamfirst.ddns.domain.CacheEntry;
import com.streamfirst.ddns.domain.ContentRef;
import com.streamfirst.ddns.domain.DomainKey;
import com.streamfirst.ddns.domain.DomainRecordSet;
import com.streamfirst.ddns.domain.FastBatch;
import com.streamfirst.ddns.domain.FastRecord;
import com.streamfirst.ddns.domain.RecordSet;
import com.streamfirst.ddns.domain.ResolutionResult;
import com.streamfirst.ddns.domain.ResolutionSource;
import com.streamfirst.ddns.domain.ResolutionStats;
import com.streamfirst.ddns.domain.ResolvedRecord;
import com.streamfirst.ddns.ports.AuthoritativeLedgerPort;
import com.streamfirst.ddns.ports.FastLedgerPort;
import com.streamfirst.ddns.ports.ResolutionCachePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Answers domain record queries from the cheapest source that can be trusted.
 * Consults the cache first, then the fast ledger, and falls back to the authoritative
 * ledger when the fast tier fails or times out. Fast answers can optionally be verified
 * against the authoritative ledger, in which case the authoritative answer wins on mismatch.
 *
 * <p>Queries never throw for infrastructure problems; failures come back as results with
 * {@link ResolutionSource#ERROR}. Only invalid arguments raise {@link IllegalArgumentException}.
 */
@Slf4j
@RequiredArgsConstructor
public class ResolutionRouter {

    private static final String FAST_TIER = "fast";
    private static final String AUTHORITATIVE_TIER = "authoritative";

    private final AuthoritativeLedgerPort authoritativeLedger;
    private final FastLedgerPort fastLedger;
    private final ContentResolver contentResolver;
    private final ResolutionCachePort cache;
    private final TierCallExecutor tiers;
    private final ResolutionSettings settings;
    private final Clock clock;

    private final AtomicLong totalQueries = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong fastQueries = new AtomicLong();
    private final AtomicLong authoritativeQueries = new AtomicLong();
    private final AtomicLong fastErrors = new AtomicLong();
    private final AtomicLong authoritativeErrors = new AtomicLong();
    private final AtomicLong tierTimeouts = new AtomicLong();
    private final AtomicLong consistencyWarnings = new AtomicLong();
    private final AtomicLong fastNanos = new AtomicLong();
    private final AtomicLong authoritativeNanos = new AtomicLong();

    /**
     * Resolves one record type of a domain.
     *
     * @param domainName the domain name, hashed into its ledger key
     * @param type the record type, e.g. {@code A} or {@code TXT}
     * @param options per-query overrides, null for the defaults
     * @return the answer; never null
     */
    public ResolutionResult resolve(String domainName, String type, ResolveOptions options) {
        requireText(domainName, "Domain name");
        return resolve(DomainKeys.keyOf(domainName), type, options);
    }

    /**
     * Resolves one record type of a domain whose ledger key is already known.
     */
    public ResolutionResult resolve(DomainKey domainKey, String type, ResolveOptions options) {
        if (domainKey == null) {
            throw new IllegalArgumentException("Domain key cannot be null");
        }
        requireText(type, "Record type");
        ResolveOptions opts = options != null ? options : ResolveOptions.DEFAULTS;

        long started = System.nanoTime();
        totalQueries.incrementAndGet();
        ResolutionResult result;
        try {
            result = route(domainKey, type, opts);
        } catch (RuntimeException e) {
            log.error("Failed to resolve {} record of {}", type, domainKey, e);
            result = ResolutionResult.failure(describe(e));
        }
        return result.toBuilder().latency(Duration.ofNanos(System.nanoTime() - started)).build();
    }

    private ResolutionResult route(DomainKey key, String type, ResolveOptions opts) {
        Instant now = clock.instant();
        if (useCache(opts)) {
            Optional<CacheEntry> cached = cache.get(key, type, now);
            if (cached.isPresent()) {
                cacheHits.incrementAndGet();
                log.debug("Cache hit for {} {}", key, type);
                return fromCache(cached.get());
            }
        }

        ResolutionResult result;
        if (fastFirst(opts)) {
            result = routeFastFirst(key, type, opts);
        } else {
            result = project(readAuthoritative(key), type);
        }

        if (result.hasValue()) {
            cache.put(key, type, toCacheEntry(result.getValue(), result.getTtl(), result, now));
        }
        return result;
    }

    private ResolutionResult routeFastFirst(DomainKey key, String type, ResolveOptions opts) {
        FastRecord fast;
        try {
            fast = readFast(() -> fastLedger.getRecord(key, type));
        } catch (RuntimeException e) {
            if (opts.isForceFast()) {
                return ResolutionResult.failure("Fast tier failed: " + describe(e));
            }
            log.warn("Fast tier failed for {} {}, falling back to authoritative: {}",
                    key, type, describe(e));
            return project(readAuthoritative(key), type);
        }

        if (!fast.hasValue()) {
            return ResolutionResult.builder()
                    .source(ResolutionSource.FAST)
                    .contentRef(fast.contentRef())
                    .build();
        }

        ResolutionResult fastResult = ResolutionResult.builder()
                .value(fast.value())
                .ttl(fast.ttl() > 0 ? fast.ttl() : RecordSet.DEFAULT_TTL_SECONDS)
                .source(ResolutionSource.FAST)
                .contentRef(fast.contentRef())
                .timestamp(fast.timestamp())
                .build();

        if (!opts.verifyOr(settings.isVerifyWithAuthoritative())) {
            return fastResult;
        }

        AuthoritativeView authoritative;
        try {
            authoritative = readAuthoritative(key);
        } catch (RuntimeException e) {
            log.warn("Verification of {} {} failed, returning unverified fast answer: {}",
                    key, type, describe(e));
            return fastResult;
        }
        if (agrees(fast.contentRef(), authoritative)) {
            return fastResult;
        }
        consistencyWarnings.incrementAndGet();
        log.warn("Fast tier disagrees with authoritative ledger for {} {} (fast {}, authoritative {})",
                key, type, fast.contentRef(), authoritative.record().getContentRef());
        return project(authoritative, type).toBuilder().consistencyWarning(true).build();
    }

    /**
     * Resolves several record types of a domain with a single round trip per tier.
     * Cached answers are used only when every requested type is cached.
     */
    public BatchResolutionResult resolveBatch(String domainName, List<String> types, ResolveOptions options) {
        requireText(domainName, "Domain name");
        if (types == null || types.isEmpty()) {
            throw new IllegalArgumentException("At least one record type is required");
        }
        types.forEach(type -> requireText(type, "Record type"));
        List<String> requested = List.copyOf(types);
        ResolveOptions opts = options != null ? options : ResolveOptions.DEFAULTS;
        DomainKey key = DomainKeys.keyOf(domainName);

        long started = System.nanoTime();
        totalQueries.incrementAndGet();
        BatchResolutionResult result;
        try {
            result = routeBatch(key, requested, opts);
        } catch (RuntimeException e) {
            log.error("Failed to resolve {} records of {}", requested, domainName, e);
            result = BatchResolutionResult.failure(requested, describe(e));
        }
        return result.toBuilder().latency(Duration.ofNanos(System.nanoTime() - started)).build();
    }

    private BatchResolutionResult routeBatch(DomainKey key, List<String> types, ResolveOptions opts) {
        Instant now = clock.instant();
        if (useCache(opts)) {
            Optional<BatchResolutionResult> cached = batchFromCache(key, types, now);
            if (cached.isPresent()) {
                cacheHits.incrementAndGet();
                log.debug("Cache hit for {} {}", key, types);
                return cached.get();
            }
        }

        BatchResolutionResult result;
        if (fastFirst(opts)) {
            result = routeBatchFastFirst(key, types, opts);
        } else {
            result = projectBatch(readAuthoritative(key), types);
        }

        for (int i = 0; i < types.size(); i++) {
            String value = result.getValues().get(i);
            if (value != null) {
                cache.put(key, types.get(i), toCacheEntry(value, result.getTtls().get(i), result.getContentRef(),
                        result.getSource(), now));
            }
        }
        return result;
    }

    private BatchResolutionResult routeBatchFastFirst(DomainKey key, List<String> types, ResolveOptions opts) {
        FastBatch fast;
        try {
            fast = readFast(() -> fastLedger.getBatchRecords(key, types));
        } catch (RuntimeException e) {
            if (opts.isForceFast()) {
                return BatchResolutionResult.failure(types, "Fast tier failed: " + describe(e));
            }
            log.warn("Fast tier failed for {} {}, falling back to authoritative: {}",
                    key, types, describe(e));
            return projectBatch(readAuthoritative(key), types);
        }

        List<String> values = new ArrayList<>(types.size());
        List<Integer> ttls = new ArrayList<>(types.size());
        for (int i = 0; i < types.size(); i++) {
            String value = i < fast.values().size() ? fast.values().get(i) : null;
            Integer ttl = i < fast.ttls().size() ? fast.ttls().get(i) : null;
            boolean present = value != null && !value.isEmpty();
            values.add(present ? value : null);
            ttls.add(!present ? 0 : ttl != null && ttl > 0 ? ttl : RecordSet.DEFAULT_TTL_SECONDS);
        }
        BatchResolutionResult fastResult = BatchResolutionResult.builder()
                .types(types)
                .values(Collections.unmodifiableList(values))
                .ttls(List.copyOf(ttls))
                .source(ResolutionSource.FAST)
                .contentRef(fast.contentRef())
                .build();

        if (!opts.verifyOr(settings.isVerifyWithAuthoritative())) {
            return fastResult;
        }

        AuthoritativeView authoritative;
        try {
            authoritative = readAuthoritative(key);
        } catch (RuntimeException e) {
            log.warn("Verification of {} {} failed, returning unverified fast answer: {}",
                    key, types, describe(e));
            return fastResult;
        }
        if (agrees(fast.contentRef(), authoritative)) {
            return fastResult;
        }
        consistencyWarnings.incrementAndGet();
        log.warn("Fast tier disagrees with authoritative ledger for {} (fast {}, authoritative {})",
                key, fast.contentRef(), authoritative.record().getContentRef());
        return projectBatch(authoritative, types).toBuilder().consistencyWarning(true).build();
    }

    private Optional<BatchResolutionResult> batchFromCache(DomainKey key, List<String> types, Instant now) {
        List<CacheEntry> entries = new ArrayList<>(types.size());
        for (String type : types) {
            Optional<CacheEntry> entry = cache.get(key, type, now);
            if (entry.isEmpty()) {
                return Optional.empty();
            }
            entries.add(entry.get());
        }
        return Optional.of(BatchResolutionResult.builder()
                .types(types)
                .values(entries.stream().map(CacheEntry::getValue).toList())
                .ttls(entries.stream().map(CacheEntry::getTtl).toList())
                .source(ResolutionSource.CACHE)
                .contentRef(entries.get(0).getContentRef())
                .build());
    }

    private <T> T readFast(Supplier<T> call) {
        fastQueries.incrementAndGet();
        long started = System.nanoTime();
        try {
            T answer = tiers.call(FAST_TIER, call);
            fastNanos.addAndGet(System.nanoTime() - started);
            return answer;
        } catch (RuntimeException e) {
            fastErrors.incrementAndGet();
            if (e instanceof TierTimeoutException) {
                tierTimeouts.incrementAndGet();
            }
            throw e;
        }
    }

    private AuthoritativeView readAuthoritative(DomainKey key) {
        authoritativeQueries.incrementAndGet();
        long started = System.nanoTime();
        try {
            AuthoritativeView view = tiers.call(AUTHORITATIVE_TIER, () -> lookupAuthoritative(key));
            authoritativeNanos.addAndGet(System.nanoTime() - started);
            return view;
        } catch (RuntimeException e) {
            authoritativeErrors.incrementAndGet();
            if (e instanceof TierTimeoutException) {
                tierTimeouts.incrementAndGet();
            }
            throw e;
        }
    }

    private AuthoritativeView lookupAuthoritative(DomainKey key) {
        DomainRecordSet record = authoritativeLedger.getDomainRecord(key);
        if (!record.isRegistered()) {
            return new AuthoritativeView(record, null, false);
        }
        if (record.isExpiredAt(clock.instant())) {
            log.debug("Domain {} expired at {}", key, record.getExpiry());
            return new AuthoritativeView(record, null, true);
        }
        if (record.getContentRef().isEmpty()) {
            return new AuthoritativeView(record, null, false);
        }
        return new AuthoritativeView(record, contentResolver.resolve(record.getContentRef()), false);
    }

    private ResolutionResult project(AuthoritativeView view, String type) {
        DomainRecordSet record = view.record();
        ResolutionResult.ResolutionResultBuilder result = ResolutionResult.builder()
                .source(ResolutionSource.AUTHORITATIVE)
                .contentRef(record.getContentRef())
                .owner(record.getOwner())
                .expiry(record.getExpiry());
        if (view.expired()) {
            return result.error(ResolutionResult.EXPIRED).build();
        }
        RecordSet content = view.content();
        if (content == null) {
            return result.build();
        }
        Optional<ResolvedRecord> resolved = content.record(type);
        return result
                .value(resolved.map(ResolvedRecord::value).orElse(null))
                .ttl(resolved.map(ResolvedRecord::ttl).orElse(0))
                .timestamp(content.getTimestamp() != null ? content.getTimestamp() : record.getLastUpdated())
                .build();
    }

    private BatchResolutionResult projectBatch(AuthoritativeView view, List<String> types) {
        ContentRef ref = view.record().getContentRef();
        if (view.expired()) {
            return BatchResolutionResult.empty(types, ResolutionSource.AUTHORITATIVE).toBuilder()
                    .contentRef(ref)
                    .error(ResolutionResult.EXPIRED)
                    .build();
        }
        RecordSet content = view.content();
        if (content == null) {
            return BatchResolutionResult.empty(types, ResolutionSource.AUTHORITATIVE).toBuilder()
                    .contentRef(ref)
                    .build();
        }
        List<String> values = new ArrayList<>(types.size());
        List<Integer> ttls = new ArrayList<>(types.size());
        for (String type : types) {
            Optional<ResolvedRecord> resolved = content.record(type);
            values.add(resolved.map(ResolvedRecord::value).orElse(null));
            ttls.add(resolved.map(ResolvedRecord::ttl).orElse(0));
        }
        return BatchResolutionResult.builder()
                .types(types)
                .values(Collections.unmodifiableList(values))
                .ttls(List.copyOf(ttls))
                .source(ResolutionSource.AUTHORITATIVE)
                .contentRef(ref)
                .build();
    }

    /** A fast answer agrees when it carries the same content reference as a live authoritative record. */
    private static boolean agrees(ContentRef fastRef, AuthoritativeView authoritative) {
        ContentRef authoritativeRef = authoritative.record().getContentRef();
        if (authoritative.expired() || fastRef.isEmpty() || authoritativeRef.isEmpty()) {
            return false;
        }
        return normalize(fastRef).equals(normalize(authoritativeRef));
    }

    private static String normalize(ContentRef ref) {
        return ref.value().trim().toLowerCase(Locale.ROOT);
    }

    private ResolutionResult fromCache(CacheEntry entry) {
        return ResolutionResult.builder()
                .value(entry.getValue())
                .ttl(entry.getTtl())
                .source(ResolutionSource.CACHE)
                .contentRef(entry.getContentRef())
                .timestamp(entry.getStoredAt())
                .build();
    }

    private CacheEntry toCacheEntry(String value, int ttl, ResolutionResult result, Instant now) {
        return toCacheEntry(value, ttl, result.getContentRef(), result.getSource(), now);
    }

    private CacheEntry toCacheEntry(String value, int ttl, ContentRef ref, ResolutionSource source, Instant now) {
        long seconds = ttl > 0 ? ttl : RecordSet.DEFAULT_TTL_SECONDS;
        Duration cap = settings.getMaxCacheTtl();
        if (cap != null && cap.getSeconds() < seconds) {
            seconds = cap.getSeconds();
        }
        return CacheEntry.builder()
                .value(value)
                .ttl((int) seconds)
                .contentRef(ref)
                .source(source)
                .storedAt(now)
                .build();
    }

    private boolean useCache(ResolveOptions opts) {
        return settings.isCacheEnabled() && !opts.isSkipCache();
    }

    private boolean fastFirst(ResolveOptions opts) {
        if (opts.isForceAuthoritative()) {
            return false;
        }
        return opts.isForceFast() || settings.isPreferFast();
    }

    /** Drops every cached answer. */
    public void clearCache() {
        cache.clear();
        log.info("Resolution cache cleared");
    }

    public ResolutionStats getStats() {
        return ResolutionStats.builder()
                .totalQueries(totalQueries.get())
                .cacheHits(cacheHits.get())
                .fastQueries(fastQueries.get())
                .authoritativeQueries(authoritativeQueries.get())
                .fastErrors(fastErrors.get())
                .authoritativeErrors(authoritativeErrors.get())
                .tierTimeouts(tierTimeouts.get())
                .consistencyWarnings(consistencyWarnings.get())
                .fastLatency(Duration.ofNanos(fastNanos.get()))
                .authoritativeLatency(Duration.ofNanos(authoritativeNanos.get()))
                .build();
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " cannot be null or blank");
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private record AuthoritativeView(DomainRecordSet record, RecordSet content, boolean expired) {
    }
}
