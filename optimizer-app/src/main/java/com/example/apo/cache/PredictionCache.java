package com.example.apo.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TTL cache of recent prediction results, backed by Caffeine.
 *
 * <p>
 * Entries expire purely by time; learning events never touch this cache. Each entry carries
 * its own TTL (variable expiry), measured on the injected {@link Clock}. A {@link #get} that
 * finds an expired entry returns empty and removes it; the rest are removed by Caffeine's
 * maintenance and the periodic {@link #clearExpired()} sweep ({@link PredictionCacheSweeper}).
 * </p>
 *
 * <p>
 * Size is bounded by {@code maxEntries}. Past that, Caffeine evicts by its admission policy,
 * possibly the entry just written; callers then see a miss, never an error.
 * </p>
 *
 * Meters: Caffeine statistics are bound as {@code cache.*} with {@code cache=predictions}.
 *
 * @param <V> payload type
 */
@Slf4j
public class PredictionCache<V> {

    static final String CACHE_NAME = "predictions";

    private final Cache<PredictionCacheKey, Entry<V>> entries;
    private final Duration defaultTtl;
    private final AtomicLong expiredRemovals = new AtomicLong();

    public PredictionCache(Clock clock, Duration defaultTtl, int maxEntries, MeterRegistry meterRegistry) {
        Objects.requireNonNull(clock, "clock");
        this.defaultTtl = requirePositive(defaultTtl);
        if (maxEntries < 1) throw new IllegalArgumentException("maxEntries must be >= 1: " + maxEntries);

        this.entries = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .maximumSize(maxEntries)
                .expireAfter(new PerEntryTtl<V>())
                .evictionListener((PredictionCacheKey key, Entry<V> value, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED) expiredRemovals.incrementAndGet();
                })
                .recordStats()
                .build();
        CaffeineCacheMetrics.monitor(meterRegistry, entries, CACHE_NAME);
    }

    public Optional<V> get(PredictionCacheKey key) {
        Entry<V> e = entries.getIfPresent(key);
        if (e == null) {
            // an expired mapping is treated as absent and dropped; a value written meanwhile is kept
            entries.asMap().computeIfPresent(key, (k, v) -> v);
            return Optional.empty();
        }
        return Optional.of(e.payload());
    }

    public void put(PredictionCacheKey key, V payload) {
        put(key, payload, defaultTtl);
    }

    public void put(PredictionCacheKey key, V payload, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(payload, "payload");
        entries.put(key, new Entry<>(payload, requirePositive(ttl)));
    }

    /**
     * Remove every expired entry now.
     *
     * @return number of expired entries removed since the previous call's snapshot
     */
    public int clearExpired() {
        long before = expiredRemovals.get();
        entries.cleanUp();
        int removed = (int) (expiredRemovals.get() - before);
        if (removed > 0) {
            log.debug("Cleared {} expired prediction(s); {} remain", removed, entries.estimatedSize());
        }
        return removed;
    }

    public void invalidateAll() {
        entries.invalidateAll();
    }

    /** Approximate entry count; exact after {@link #clearExpired()}. */
    public int size() {
        return (int) entries.estimatedSize();
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    private static Duration requirePositive(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        return ttl;
    }

    private record Entry<V>(V payload, Duration ttl) {}

    // TTL is fixed at write time; reads do not extend it
    private static final class PerEntryTtl<V> implements Expiry<PredictionCacheKey, Entry<V>> {
        @Override
        public long expireAfterCreate(PredictionCacheKey key, Entry<V> value, long currentTime) {
            return TimeUnit.NANOSECONDS.convert(value.ttl());
        }

        @Override
        public long expireAfterUpdate(PredictionCacheKey key, Entry<V> value, long currentTime, long currentDuration) {
            return TimeUnit.NANOSECONDS.convert(value.ttl());
        }

        @Override
        public long expireAfterRead(PredictionCacheKey key, Entry<V> value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
