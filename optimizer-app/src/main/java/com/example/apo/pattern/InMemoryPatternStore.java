package com.example.apo.pattern;

import com.example.apo.geo.Coordinate;
import com.example.apo.geo.GeoDistance;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * {@link PatternStore} held entirely in memory.
 *
 * <h2>Concurrency</h2>
 * <ul>
 *   <li>Patterns live in a {@link ConcurrentHashMap}; every write goes through
 *       {@link ConcurrentHashMap#compute}, so writes to one key are serialized while other
 *       keys stay available to readers and writers.</li>
 *   <li>A {@link SpatialGrid} indexes keys by cell. Keys are added when first inserted and
 *       never removed, because patterns are never deleted.</li>
 * </ul>
 *
 * <h2>Radius queries</h2>
 * Grid candidates are filtered by exact haversine distance, sorted nearest first and cut
 * at {@code maxQueryResults}. Returned patterns have their {@code lastUsedAt} refreshed.
 */
@Slf4j
public class InMemoryPatternStore implements PatternStore {

    private final ConcurrentHashMap<PatternKey, Pattern> patterns = new ConcurrentHashMap<>();
    private final SpatialGrid grid;
    private final int maxQueryResults;
    protected final Clock clock;

    public InMemoryPatternStore(Clock clock, double cellSizeDegrees, int maxQueryResults) {
        if (maxQueryResults < 1) {
            throw new IllegalArgumentException("maxQueryResults must be >= 1: " + maxQueryResults);
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.grid = new SpatialGrid(cellSizeDegrees);
        this.maxQueryResults = maxQueryResults;
    }

    @Override
    public Pattern upsert(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return compute(pattern.location(), pattern.modelId(), current -> pattern);
    }

    @Override
    public Pattern compute(Coordinate location, String modelId, Function<Optional<Pattern>, Pattern> remapping) {
        Objects.requireNonNull(remapping, "remapping");
        PatternKey key = new PatternKey(Objects.requireNonNull(location, "location"), modelId);
        return patterns.compute(key, (k, current) -> {
            Pattern next = remapping.apply(Optional.ofNullable(current));
            if (next == null || !k.equals(next.key())) {
                throw new IllegalStateException("remapping must return a pattern for " + k + ", got " + next);
            }
            Pattern stored = next.touchedAt(clock.instant());
            onWrite(stored);
            if (current == null) {
                grid.add(k);
            }
            return stored;
        });
    }

    @Override
    public Optional<Pattern> get(Coordinate location, String modelId) {
        return Optional.ofNullable(touch(new PatternKey(location, modelId)));
    }

    @Override
    public List<Pattern> queryRadius(Coordinate center, double radiusKm) {
        Objects.requireNonNull(center, "center");
        if (!(radiusKm >= 0.0) || Double.isInfinite(radiusKm)) {
            throw new IllegalArgumentException("radiusKm must be a finite non-negative number: " + radiusKm);
        }

        List<Hit> hits = new ArrayList<>();
        for (PatternKey key : grid.candidates(center, radiusKm)) {
            double d = GeoDistance.distanceKm(center, key.location());
            if (d <= radiusKm) {
                hits.add(new Hit(key, d));
            }
        }
        hits.sort(Comparator.comparingDouble(Hit::distanceKm));
        if (hits.size() > maxQueryResults) {
            log.debug("queryRadius truncated: center={} radiusKm={} matches={} cap={}",
                    center, radiusKm, hits.size(), maxQueryResults);
        }

        List<Pattern> out = new ArrayList<>(Math.min(hits.size(), maxQueryResults));
        for (Hit hit : hits) {
            if (out.size() >= maxQueryResults) break;
            Pattern p = touch(hit.key());
            if (p != null) out.add(p);
        }
        return out;
    }

    @Override
    public List<Pattern> findAll() {
        return new ArrayList<>(patterns.values());
    }

    @Override
    public int size() {
        return patterns.size();
    }

    public int maxQueryResults() {
        return maxQueryResults;
    }

    /**
     * Hook invoked while the key is locked, before the new value becomes visible.
     * Throwing aborts the write and leaves the previous value in place.
     */
    protected void onWrite(Pattern stored) {
        // in-memory only
    }

    /** Put a pattern back exactly as given, bypassing {@link #onWrite} and the clock. */
    protected void restore(Pattern pattern) {
        patterns.compute(pattern.key(), (k, current) -> {
            if (current == null) grid.add(k);
            return pattern;
        });
    }

    private Pattern touch(PatternKey key) {
        return patterns.computeIfPresent(key, (k, p) -> p.touchedAt(clock.instant()));
    }

    private record Hit(PatternKey key, double distanceKm) {}
}
