package com.example.apo;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Externalized settings bound from {@code optimizer.*} (see {@code application.yaml}).
 * Every value has a documented default and may be overridden per environment.
 */
@Component
@ConfigurationProperties(prefix = "optimizer")
@Validated
@Getter
@Setter
public class OptimizerProps {

    /** Radius used when callers do not pass one. 111 km is roughly one degree of latitude. */
    @Positive
    private double defaultRadiusKm = 111.0;

    /** Patterns with fewer samples are ignored when ranking. */
    @Min(1)
    private int defaultMinSamples = 1;

    /** Returned with confidence 0 when no pattern qualifies. */
    @NotBlank
    private String defaultModelId = "ensemble";

    /** Patterns below this many samples are reported as low-confidence in stats. */
    @Min(1)
    private int lowConfidenceSamples = 10;

    @Valid
    private RecommendationCache recommendationCache = new RecommendationCache();

    @Valid
    private PredictionCache predictionCache = new PredictionCache();

    @Valid
    private PatternStore patternStore = new PatternStore();

    @Valid
    private Accuracy accuracy = new Accuracy();

    @Getter
    @Setter
    public static class RecommendationCache {
        /** Query centres closer than this share a cached recommendation. */
        @PositiveOrZero
        private double epsilonKm = 0.05;
        @Min(1)
        private int maxEntries = 10_000;
        @NotNull
        private Duration maxAge = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class PredictionCache {
        @NotNull
        private Duration ttl = Duration.ofMinutes(5);
        @Min(1)
        private int maxEntries = 50_000;
        /** Read by {@code PredictionCacheSweeper} through its {@code @Scheduled} placeholder. */
        @NotNull
        private Duration sweepInterval = Duration.ofMinutes(1);
    }

    @Getter
    @Setter
    public static class PatternStore {
        @NotNull
        private StoreType type = StoreType.MEMORY;
        /** JSON-lines journal used when {@code type=journal}. */
        @NotBlank
        private String journalFile = "data/patterns.jsonl";
        @Positive
        @DecimalMax("180")
        private double cellSizeDegrees = 1.0;
        @Min(1)
        private int maxQueryResults = 10_000;
    }

    @Getter
    @Setter
    public static class Accuracy {
        /** Error at which a numeric field scores 0, unless overridden in {@link #scales}. */
        @Positive
        private double defaultScale = 10.0;
        private Map<String, Double> scales = new HashMap<>();
    }

    public enum StoreType { MEMORY, JOURNAL }
}
