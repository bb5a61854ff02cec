package com.example.apo.cache;

import com.example.apo.MutableClock;
import com.example.apo.dto.Recommendation;
import com.example.apo.dto.RecommendationSource;
import com.example.apo.geo.Coordinate;
import com.example.apo.geo.GeoDistance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecommendationCacheTest {

    private static final Coordinate NYC = Coordinate.of(40.71, -74.00);
    private static final Coordinate BROOKLYN = Coordinate.of(40.68, -73.94);
    private static final Coordinate LA = Coordinate.of(34.05, -118.24);

    private MutableClock clock;
    private RecommendationCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T12:00:00Z");
        cache = new RecommendationCache(clock, 0.05, 100, Duration.ofHours(1));
    }

    @Test
    void hitWithinEpsilonOfCentre() {
        Recommendation rec = learned("lstm");
        cache.put(NYC, 10.0, 1, "ensemble", rec, cache.generation());

        // ~11 m away
        assertThat(cache.lookup(Coordinate.of(40.7101, -74.00), 10.0, 1, "ensemble")).containsSame(rec);
        // ~1.1 km away
        assertThat(cache.lookup(Coordinate.of(40.72, -74.00), 10.0, 1, "ensemble")).isEmpty();
    }

    @Test
    void largerCachedRadiusAnswersSmallerQueryButNotTheReverse() {
        Recommendation wide = learned("wide");
        cache.put(NYC, 50.0, 1, "ensemble", wide, cache.generation());

        assertThat(cache.lookup(NYC, 10.0, 1, "ensemble")).containsSame(wide);
        assertThat(cache.lookup(NYC, 100.0, 1, "ensemble")).isEmpty();
    }

    @Test
    void smallestCoveringRadiusWins() {
        Recommendation wide = learned("wide");
        Recommendation narrow = learned("narrow");
        cache.put(NYC, 50.0, 1, "ensemble", wide, cache.generation());
        cache.put(NYC, 10.0, 1, "ensemble", narrow, cache.generation());

        assertThat(cache.lookup(NYC, 5.0, 1, "ensemble")).containsSame(narrow);
        assertThat(cache.lookup(NYC, 20.0, 1, "ensemble")).containsSame(wide);
    }

    @Test
    void queryParametersMustMatch() {
        cache.put(NYC, 10.0, 1, "ensemble", learned("lstm"), cache.generation());

        assertThat(cache.lookup(NYC, 10.0, 2, "ensemble")).isEmpty();
        assertThat(cache.lookup(NYC, 10.0, 1, "persistence")).isEmpty();
    }

    @Test
    void invalidateCoveringRemovesOnlyEntriesContainingTheLocation() {
        cache.put(NYC, 10.0, 1, "ensemble", learned("nyc"), cache.generation());
        cache.put(LA, 10.0, 1, "ensemble", learned("la"), cache.generation());

        int removed = cache.invalidateCovering(BROOKLYN);

        assertThat(removed).isEqualTo(1);
        assertThat(cache.lookup(NYC, 10.0, 1, "ensemble")).isEmpty();
        assertThat(cache.lookup(LA, 10.0, 1, "ensemble")).isPresent();
    }

    @Test
    void invalidationReachesQueriesServedFromANeighbouringCentre() {
        Coordinate origin = Coordinate.of(0.0, 0.0);
        cache.put(origin, 10.0, 1, "ensemble", learned("lstm"), cache.generation());
        // ~44 m from the cached centre, so served by the origin entry
        Coordinate neighbour = Coordinate.of(0.0, 0.0004);
        assertThat(cache.lookup(neighbour, 10.0, 1, "ensemble")).isPresent();

        // inside the neighbour's 10 km circle, ~10.03 km from the cached centre
        Coordinate update = Coordinate.of(0.0, 0.0004 + 9.99 / GeoDistance.KM_PER_DEGREE);
        assertThat(GeoDistance.distanceKm(origin, update)).isGreaterThan(10.0);

        assertThat(cache.invalidateCovering(update)).isEqualTo(1);
        assertThat(cache.lookup(neighbour, 10.0, 1, "ensemble")).isEmpty();
    }

    @Test
    void updatesBeyondRadiusPlusEpsilonKeepTheEntry() {
        Coordinate origin = Coordinate.of(0.0, 0.0);
        cache.put(origin, 10.0, 1, "ensemble", learned("lstm"), cache.generation());

        assertThat(cache.invalidateCovering(Coordinate.of(0.0, 10.2 / GeoDistance.KM_PER_DEGREE))).isZero();
        assertThat(cache.lookup(origin, 10.0, 1, "ensemble")).isPresent();
    }

    @Test
    void putIsRefusedWhenInvalidatedWhileComputing() {
        long observed = cache.generation();
        cache.invalidateCovering(LA);

        boolean stored = cache.put(NYC, 10.0, 1, "ensemble", learned("stale"), observed);

        assertThat(stored).isFalse();
        assertThat(cache.size()).isZero();
        assertThat(cache.put(NYC, 10.0, 1, "ensemble", learned("fresh"), cache.generation())).isTrue();
    }

    @Test
    void entriesExpireAfterMaxAge() {
        cache.put(NYC, 10.0, 1, "ensemble", learned("lstm"), cache.generation());

        clock.advance(Duration.ofMinutes(59));
        assertThat(cache.lookup(NYC, 10.0, 1, "ensemble")).isPresent();
        clock.advance(Duration.ofMinutes(1));
        assertThat(cache.lookup(NYC, 10.0, 1, "ensemble")).isEmpty();
    }

    @Test
    void fullCacheEvictsOldestInsertion() {
        RecommendationCache small = new RecommendationCache(clock, 0.05, 2, Duration.ofHours(1));
        small.put(NYC, 10.0, 1, "ensemble", learned("first"), small.generation());
        small.put(LA, 10.0, 1, "ensemble", learned("second"), small.generation());
        small.put(BROOKLYN, 1.0, 1, "ensemble", learned("third"), small.generation());

        assertThat(small.size()).isEqualTo(2);
        assertThat(small.lookup(NYC, 10.0, 1, "ensemble")).isEmpty();
        assertThat(small.lookup(LA, 10.0, 1, "ensemble")).isPresent();
        assertThat(small.lookup(BROOKLYN, 1.0, 1, "ensemble")).isPresent();
    }

    @Test
    void invalidateAllClearsEverything() {
        cache.put(NYC, 10.0, 1, "ensemble", learned("lstm"), cache.generation());
        long before = cache.generation();

        cache.invalidateAll();

        assertThat(cache.size()).isZero();
        assertThat(cache.generation()).isGreaterThan(before);
    }

    @Test
    void rejectsBadConfiguration() {
        assertThatThrownBy(() -> new RecommendationCache(clock, -1.0, 10, Duration.ofHours(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RecommendationCache(clock, 0.05, 0, Duration.ofHours(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RecommendationCache(clock, 0.05, 10, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private Recommendation learned(String modelId) {
        return new Recommendation(modelId, 0.9, RecommendationSource.LEARNED, 12, clock.instant());
    }
}
