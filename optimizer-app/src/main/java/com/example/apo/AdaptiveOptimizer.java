package com.example.apo;

import com.example.apo.cache.RecommendationCache;
import com.example.apo.dto.LearningInsight;
import com.example.apo.dto.OptimizationStats;
import com.example.apo.dto.PredictionRecord;
import com.example.apo.dto.Recommendation;
import com.example.apo.dto.RecommendationSource;
import com.example.apo.geo.Coordinate;
import com.example.apo.learning.AccuracyFunction;
import com.example.apo.learning.LearningEngine;
import com.example.apo.pattern.Pattern;
import com.example.apo.pattern.PatternStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Entry point of the optimizer:
 *  • recommend(location, radiusKm, minSamples) → best model for the neighbourhood (cached)
 *  • recordOutcome(prediction, actual) → learn from ground truth, invalidate covering cache entries
 *  • stats() → what has been learned so far (no side effects)
 *
 * <h2>Ranking</h2>
 * Patterns within the radius with at least {@code minSamples} samples are grouped by model:
 * <pre>
 *   score = avg(confidence) * 0.7 + 0.3 * min(totalSamples, 10) / 10
 * </pre>
 * The highest score wins; equal scores go to the lexicographically smallest model id. With
 * nothing to rank, the caller's default model is returned with confidence 0.
 *
 * <h2>Errors</h2>
 * A {@link com.example.apo.pattern.StorageException} from the store is never turned into a
 * default recommendation; it propagates so outages stay visible.
 *
 * <h2>Threading</h2>
 * One instance is shared by all callers. Each instance owns its {@link RecommendationCache},
 * so separate instances never see each other's cached answers. The synchronous methods may
 * block on the pattern store; the {@code *Async} variants run them on {@code boundedElastic}.
 */
@Service
@Slf4j
public class AdaptiveOptimizer {

    static final double ACCURACY_WEIGHT = 0.7;
    static final double SAMPLE_WEIGHT = 0.3;
    static final int SAMPLE_SATURATION = 10;

    private final PatternStore store;
    private final LearningEngine learning;
    private final RecommendationCache cache;
    private final Clock clock;

    private final double defaultRadiusKm;
    private final int defaultMinSamples;
    private final String defaultModelId;
    private final int lowConfidenceSamples;

    private final Timer recommendTimer;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final MeterRegistry meterRegistry;

    @Autowired
    public AdaptiveOptimizer(PatternStore store, LearningEngine learning, OptimizerProps props,
                             Clock clock, MeterRegistry meterRegistry) {
        this(store, learning,
                new RecommendationCache(clock,
                        props.getRecommendationCache().getEpsilonKm(),
                        props.getRecommendationCache().getMaxEntries(),
                        props.getRecommendationCache().getMaxAge()),
                props, clock, meterRegistry);
    }

    public AdaptiveOptimizer(PatternStore store, LearningEngine learning, RecommendationCache cache,
                             OptimizerProps props, Clock clock, MeterRegistry meterRegistry) {
        this.store = Objects.requireNonNull(store, "store");
        this.learning = Objects.requireNonNull(learning, "learning");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultRadiusKm = props.getDefaultRadiusKm();
        this.defaultMinSamples = props.getDefaultMinSamples();
        this.defaultModelId = props.getDefaultModelId();
        this.lowConfidenceSamples = props.getLowConfidenceSamples();

        this.meterRegistry = meterRegistry;
        this.recommendTimer = meterRegistry.timer("apo.recommend.duration");
        this.cacheHits = meterRegistry.counter("apo.recommend.cache", "result", "hit");
        this.cacheMisses = meterRegistry.counter("apo.recommend.cache", "result", "miss");
        meterRegistry.gauge("apo.recommend.cache.size", cache, RecommendationCache::size);

        learning.addListener(updated -> cache.invalidateCovering(updated.location()));
    }

    @PostConstruct
    void logReady() {
        log.info("Adaptive optimizer ready: patterns={} defaultRadiusKm={} defaultMinSamples={} defaultModel={}",
                store.size(), defaultRadiusKm, defaultMinSamples, defaultModelId);
    }

    /* ===================== RECOMMEND ===================== */

    /** Recommend with the configured radius, minimum samples and default model. */
    public Recommendation recommend(Coordinate location) {
        return recommend(location, defaultRadiusKm, defaultMinSamples, defaultModelId);
    }

    /** Recommend with the configured default model. */
    public Recommendation recommend(Coordinate location, double radiusKm, int minSamples) {
        return recommend(location, radiusKm, minSamples, defaultModelId);
    }

    /**
     * Best model for {@code location}, from cache when an equivalent query was answered
     * and nothing inside its radius has been learned since.
     *
     * @param location       query point
     * @param radiusKm       neighbourhood radius, finite and &gt; 0
     * @param minSamples     patterns with fewer samples are ignored; &gt;= 1
     * @param defaultModelId returned with confidence 0 when no pattern qualifies
     * @throws IllegalArgumentException on invalid arguments
     * @throws com.example.apo.pattern.StorageException if the pattern store is unavailable
     */
    public Recommendation recommend(Coordinate location, double radiusKm, int minSamples, String defaultModelId) {
        Objects.requireNonNull(location, "location");
        if (!(radiusKm > 0.0) || Double.isInfinite(radiusKm)) {
            throw new IllegalArgumentException("radiusKm must be a finite positive number: " + radiusKm);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be >= 1: " + minSamples);
        }
        if (defaultModelId == null || defaultModelId.isBlank()) {
            throw new IllegalArgumentException("defaultModelId must not be blank");
        }
        return recommendTimer.record(() -> lookupOrRank(location, radiusKm, minSamples, defaultModelId));
    }

    public Mono<Recommendation> recommendAsync(Coordinate location, double radiusKm, int minSamples, String defaultModelId) {
        return Mono.fromCallable(() -> recommend(location, radiusKm, minSamples, defaultModelId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Recommendation lookupOrRank(Coordinate location, double radiusKm, int minSamples, String defaultModelId) {
        var cached = cache.lookup(location, radiusKm, minSamples, defaultModelId);
        if (cached.isPresent()) {
            cacheHits.increment();
            log.debug("Recommendation cache hit: location={} radiusKm={} model={}",
                    location, radiusKm, cached.get().modelId());
            return cached.get();
        }
        cacheMisses.increment();

        long generation = cache.generation();
        Collection<Pattern> patterns = store.queryRadius(location, radiusKm);
        Recommendation rec = rank(patterns, minSamples, defaultModelId, clock.instant());
        cache.put(location, radiusKm, minSamples, defaultModelId, rec, generation);

        meterRegistry.counter("apo.recommend.source", "source", rec.source().name()).increment();
        log.debug("Recommendation computed: location={} radiusKm={} patterns={} model={} confidence={} source={}",
                location, radiusKm, patterns.size(), rec.modelId(), rec.confidence(), rec.source());
        return rec;
    }

    /**
     * Rank patterns by model. Package-private so the scoring rule can be tested without a store.
     */
    static Recommendation rank(Collection<Pattern> patterns, int minSamples, String defaultModelId, Instant now) {
        // TreeMap iterates model ids in natural order, so a strict '>' keeps the smallest id on ties
        Map<String, ModelGroup> groups = new TreeMap<>();
        for (Pattern p : patterns) {
            if (p.sampleCount() < minSamples) continue;
            groups.computeIfAbsent(p.modelId(), id -> new ModelGroup()).add(p);
        }
        if (groups.isEmpty()) {
            return Recommendation.fallback(defaultModelId, now);
        }

        String bestModel = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        long bestSamples = 0;
        for (Map.Entry<String, ModelGroup> e : groups.entrySet()) {
            double score = e.getValue().score();
            if (score > bestScore) {
                bestModel = e.getKey();
                bestScore = score;
                bestSamples = e.getValue().totalSamples;
            }
        }
        double confidence = Math.max(0.0, Math.min(1.0, bestScore));
        return new Recommendation(bestModel, confidence, RecommendationSource.LEARNED, bestSamples, now);
    }

    /* ===================== LEARN ===================== */

    /**
     * Fold ground truth into the pattern for {@code (prediction.location, prediction.modelId)}.
     * Cached recommendations whose radius covers that location are invalidated before this
     * method returns.
     *
     * @throws com.example.apo.pattern.StorageException if the update cannot be persisted
     */
    public LearningInsight recordOutcome(PredictionRecord prediction, Map<String, Object> actual) {
        return learning.recordOutcome(prediction, actual);
    }

    /** Same as {@link #recordOutcome(PredictionRecord, Map)} with a caller-supplied accuracy function. */
    public LearningInsight recordOutcome(PredictionRecord prediction, Map<String, Object> actual,
                                         AccuracyFunction accuracyFn) {
        return learning.recordOutcome(prediction, actual, accuracyFn);
    }

    public Mono<LearningInsight> recordOutcomeAsync(PredictionRecord prediction, Map<String, Object> actual) {
        return Mono.fromCallable(() -> recordOutcome(prediction, actual))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /* ===================== STATS ===================== */

    /** Aggregate view of stored patterns. Read-only: does not refresh {@code lastUsedAt}. */
    public OptimizationStats stats() {
        SummaryStatistics confidence = new SummaryStatistics();
        Map<String, Long> perModel = new TreeMap<>();
        long lowConfidence = 0;

        for (Pattern p : store.findAll()) {
            confidence.addValue(p.confidence());
            perModel.merge(p.modelId(), 1L, Long::sum);
            if (p.sampleCount() < lowConfidenceSamples) lowConfidence++;
        }

        boolean empty = confidence.getN() == 0;
        return new OptimizationStats(
                confidence.getN(),
                perModel,
                empty ? 0.0 : confidence.getMean(),
                empty ? 0.0 : confidence.getMin(),
                empty ? 0.0 : confidence.getMax(),
                lowConfidence,
                cache.size());
    }

    /** Drop every cached recommendation, e.g. after patterns were bulk-loaded behind the optimizer's back. */
    public void invalidateRecommendations() {
        cache.invalidateAll();
    }

    private static final class ModelGroup {
        private final SummaryStatistics confidence = new SummaryStatistics();
        private long totalSamples;

        void add(Pattern p) {
            confidence.addValue(p.confidence());
            totalSamples += p.sampleCount();
        }

        double score() {
            double trust = Math.min(totalSamples, SAMPLE_SATURATION) / (double) SAMPLE_SATURATION;
            return confidence.getMean() * ACCURACY_WEIGHT + SAMPLE_WEIGHT * trust;
        }
    }
}
