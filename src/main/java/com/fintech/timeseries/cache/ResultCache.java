package com.fintech.timeseries.cache;

import com.fintech.timeseries.query.AggregateTable;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * TTL memoization of aggregate results with per-fingerprint single flight.
 *
 * <p>Entries expire a fixed TTL after insertion; reads never extend them.
 * The first caller of an uncached fingerprint installs an incomplete future
 * and computes in its own thread; concurrent callers of the same
 * fingerprint wait on that future instead of computing again. A failed
 * computation is removed before its waiters observe the failure, so it is
 * never served from the cache.
 */
public class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final AsyncCache<QueryFingerprint, CacheEntry> cache;
    private final ConcurrentMap<QueryFingerprint, CompletableFuture<CacheEntry>> entries;
    private final Duration ttl;
    private final Ticker ticker;

    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);

    public ResultCache(Duration ttl, long maximumSize, Ticker ticker, Executor executor, MeterRegistry meterRegistry) {
        this.ttl = ttl;
        this.ticker = ticker;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new FixedExpiry())
            .ticker(ticker)
            .executor(executor)
            .recordStats()
            .buildAsync();
        this.entries = cache.asMap();

        CaffeineCacheMetrics.monitor(meterRegistry, cache.synchronous(), "query-results");
        meterRegistry.gauge("timeseries.cache.hits", hits);
        meterRegistry.gauge("timeseries.cache.misses", misses);
    }

    /**
     * Returns the result of a fingerprint, computing it at most once across
     * concurrent callers.
     *
     * @throws RuntimeException whatever the computation threw; nothing is cached
     */
    public AggregateTable get(QueryFingerprint fingerprint, Supplier<AggregateTable> compute) {
        while (true) {
            CompletableFuture<CacheEntry> pending = new CompletableFuture<>();
            CompletableFuture<CacheEntry> existing = entries.putIfAbsent(fingerprint, pending);
            if (existing == null) {
                misses.incrementAndGet();
                return computeInto(fingerprint, pending, compute);
            }

            CacheEntry entry = await(existing);
            if (entry.isExpired(ticker.read())) {
                entries.remove(fingerprint, existing);
                continue;
            }
            hits.incrementAndGet();
            return entry.result();
        }
    }

    /** Returns a completed, unexpired result without computing. */
    public Optional<AggregateTable> getIfPresent(QueryFingerprint fingerprint) {
        CompletableFuture<CacheEntry> existing = entries.get(fingerprint);
        if (existing == null || !existing.isDone() || existing.isCompletedExceptionally()) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        CacheEntry entry = existing.join();
        if (entry.isExpired(ticker.read())) {
            entries.remove(fingerprint, existing);
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.result());
    }

    public void put(QueryFingerprint fingerprint, AggregateTable result) {
        put(fingerprint, result, ttl);
    }

    /** Stores a result with its own TTL, replacing any previous entry. */
    public void put(QueryFingerprint fingerprint, AggregateTable result, Duration entryTtl) {
        cache.put(fingerprint, CompletableFuture.completedFuture(new CacheEntry(result, ticker.read(), entryTtl)));
    }

    public void invalidate(QueryFingerprint fingerprint) {
        cache.synchronous().invalidate(fingerprint);
    }

    /** Drops every entry of one dataset. */
    public int invalidateSource(String source) {
        int before = entries.size();
        entries.keySet().removeIf(fingerprint -> fingerprint.source().equals(source));
        int removed = before - entries.size();
        log.info("Invalidated {} cached results for {}", Math.max(removed, 0), source);
        return Math.max(removed, 0);
    }

    public void invalidateAll() {
        cache.synchronous().invalidateAll();
        log.info("Invalidated all cached results");
    }

    public CacheStatistics statistics() {
        return new CacheStatistics(
            cache.synchronous().estimatedSize(),
            hits.get(),
            misses.get(),
            cache.synchronous().stats().evictionCount(),
            ttl.toSeconds());
    }

    public Duration getTtl() {
        return ttl;
    }

    private AggregateTable computeInto(
            QueryFingerprint fingerprint,
            CompletableFuture<CacheEntry> pending,
            Supplier<AggregateTable> compute) {
        AggregateTable result;
        try {
            result = compute.get();
        } catch (RuntimeException | Error e) {
            entries.remove(fingerprint, pending);
            pending.completeExceptionally(e);
            throw e;
        }
        pending.complete(new CacheEntry(result, ticker.read(), ttl));
        return result;
    }

    private static CacheEntry await(CompletableFuture<CacheEntry> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a shared query", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CompletionException(cause);
        }
    }

    /** Expires an entry its TTL after creation or replacement, never on read. */
    private static final class FixedExpiry implements Expiry<QueryFingerprint, CacheEntry> {

        @Override
        public long expireAfterCreate(QueryFingerprint key, CacheEntry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(QueryFingerprint key, CacheEntry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(QueryFingerprint key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
