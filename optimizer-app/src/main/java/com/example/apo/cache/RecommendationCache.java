package com.example.apo.cache;

import com.example.apo.dto.Recommendation;
import com.example.apo.geo.Coordinate;
import com.example.apo.geo.GeoDistance;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-optimizer cache of computed recommendations, keyed by query centre and radius.
 *
 * <h2>Lookup</h2>
 * An entry answers a query when its centre is within {@code epsilonKm} of the query
 * location, its radius is at least the requested radius, it was computed with the same
 * {@code minSamples} and default model, and it is younger than {@code maxAge}. Among
 * several matches the smallest radius wins, then the nearest centre.
 *
 * <h2>Invalidation</h2>
 * {@link #invalidateCovering(Coordinate)} removes every entry whose query circle, widened
 * by {@code epsilonKm}, contains the updated location. It also advances a generation
 * counter: a recommendation computed before an invalidation is refused by {@link #put}
 * afterwards, so a stale ranking cannot be cached behind an update it never saw.
 *
 * <h2>Capacity</h2>
 * When full, expired entries are dropped first, then the oldest insertion. A full cache
 * never fails a request.
 *
 * <h2>Threading</h2>
 * Guarded by a {@link ReentrantReadWriteLock}: lookups share the read lock, mutations
 * take the write lock.
 */
@Slf4j
public class RecommendationCache {

    private final Clock clock;
    private final double epsilonKm;
    private final int maxEntries;
    private final Duration maxAge;

    private final LinkedHashMap<Key, CachedRecommendation> entries = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong generation = new AtomicLong();

    public RecommendationCache(Clock clock, double epsilonKm, int maxEntries, Duration maxAge) {
        if (!(epsilonKm >= 0.0) || Double.isInfinite(epsilonKm)) {
            throw new IllegalArgumentException("epsilonKm must be finite and >= 0: " + epsilonKm);
        }
        if (maxEntries < 1) throw new IllegalArgumentException("maxEntries must be >= 1: " + maxEntries);
        if (maxAge == null || maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be positive: " + maxAge);
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.epsilonKm = epsilonKm;
        this.maxEntries = maxEntries;
        this.maxAge = maxAge;
    }

    public Optional<Recommendation> lookup(Coordinate location, double radiusKm, int minSamples, String defaultModelId) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            return entries.values().stream()
                    .filter(e -> e.minSamples() == minSamples
                            && e.defaultModelId().equals(defaultModelId)
                            && e.radiusKm() >= radiusKm
                            && !isExpired(e, now))
                    .map(e -> new Candidate(e, GeoDistance.distanceKm(e.center(), location)))
                    .filter(c -> c.distanceKm() <= epsilonKm)
                    .min(Comparator.comparingDouble((Candidate c) -> c.entry().radiusKm())
                            .thenComparingDouble(Candidate::distanceKm))
                    .map(c -> c.entry().recommendation());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Generation to pass back to {@link #put}; read it before querying the pattern store. */
    public long generation() {
        return generation.get();
    }

    /**
     * Cache a recommendation unless an invalidation happened since {@code observedGeneration}.
     *
     * @return true if stored
     */
    public boolean put(Coordinate center, double radiusKm, int minSamples, String defaultModelId,
                       Recommendation recommendation, long observedGeneration) {
        Objects.requireNonNull(recommendation, "recommendation");
        lock.writeLock().lock();
        try {
            if (generation.get() != observedGeneration) {
                log.debug("Skipping cache put for center={} radiusKm={}: invalidated while computing", center, radiusKm);
                return false;
            }
            Key key = new Key(center, radiusKm, minSamples, defaultModelId);
            if (!entries.containsKey(key) && entries.size() >= maxEntries) {
                makeRoom();
            }
            entries.put(key, new CachedRecommendation(center, radiusKm, minSamples, defaultModelId,
                    recommendation, clock.instant()));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drop every entry that could have answered a query whose circle contains {@code location}.
     * Entries are reused for queries up to {@code epsilonKm} away, so the test is
     * {@code distance(centre, location) <= radiusKm + epsilonKm}.
     *
     * @return number of entries removed
     */
    public int invalidateCovering(Coordinate location) {
        lock.writeLock().lock();
        try {
            generation.incrementAndGet();
            int removed = 0;
            Iterator<CachedRecommendation> it = entries.values().iterator();
            while (it.hasNext()) {
                CachedRecommendation e = it.next();
                if (GeoDistance.within(e.center(), location, e.radiusKm() + epsilonKm)) {
                    it.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                log.debug("Invalidated {} cached recommendation(s) covering {}", removed, location);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void invalidateAll() {
        lock.writeLock().lock();
        try {
            generation.incrementAndGet();
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // caller holds the write lock
    private void makeRoom() {
        Instant now = clock.instant();
        entries.values().removeIf(e -> isExpired(e, now));
        if (entries.size() >= maxEntries) {
            Iterator<Map.Entry<Key, CachedRecommendation>> eldest = entries.entrySet().iterator();
            eldest.next();
            eldest.remove();
        }
    }

    private boolean isExpired(CachedRecommendation e, Instant now) {
        return !now.isBefore(e.cachedAt().plus(maxAge));
    }

    private record Key(Coordinate center, double radiusKm, int minSamples, String defaultModelId) {}

    private record Candidate(CachedRecommendation entry, double distanceKm) {}

    /** One cached answer together with the query that produced it. */
    public record CachedRecommendation(
            Coordinate center,
            double radiusKm,
            int minSamples,
            String defaultModelId,
            Recommendation recommendation,
            Instant cachedAt) {}
}
