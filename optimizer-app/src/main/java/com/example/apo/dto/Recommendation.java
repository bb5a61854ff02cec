package com.example.apo.dto;

import java.time.Instant;

/**
 * Optimizer output naming the model to use for a location.
 *
 * <h2>Fields:</h2>
 * <ul>
 *   <li><b>modelId</b> – recommended model.</li>
 *   <li><b>confidence</b> – ranking score in [0, 1]; {@code 0.0} for {@link RecommendationSource#DEFAULT}.</li>
 *   <li><b>source</b> – {@code LEARNED} or {@code DEFAULT}.</li>
 *   <li><b>supportingSamples</b> – outcomes behind the winning model within the radius.</li>
 *   <li><b>computedAt</b> – when the ranking ran; a cached answer keeps its original time.</li>
 * </ul>
 */
public record Recommendation(
        String modelId,
        double confidence,
        RecommendationSource source,
        long supportingSamples,
        Instant computedAt) {

    public static Recommendation fallback(String defaultModelId, Instant now) {
        return new Recommendation(defaultModelId, 0.0, RecommendationSource.DEFAULT, 0, now);
    }

    public boolean isLearned() {
        return source == RecommendationSource.LEARNED;
    }
}
