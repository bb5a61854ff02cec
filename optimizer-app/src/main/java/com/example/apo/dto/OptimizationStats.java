package com.example.apo.dto;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only snapshot of what the optimizer has learned.
 *
 * @param totalPatterns          number of stored patterns
 * @param patternsPerModel       pattern count per model id, sorted by model id; read-only copy
 * @param averageConfidence      mean confidence over all patterns ({@code 0.0} when empty)
 * @param minConfidence          lowest confidence ({@code 0.0} when empty)
 * @param maxConfidence          highest confidence ({@code 0.0} when empty)
 * @param lowConfidencePatterns  patterns with fewer samples than the low-confidence threshold
 * @param cachedRecommendations  live entries in the recommendation cache
 */
public record OptimizationStats(
        long totalPatterns,
        Map<String, Long> patternsPerModel,
        double averageConfidence,
        double minConfidence,
        double maxConfidence,
        long lowConfidencePatterns,
        int cachedRecommendations) {

    public OptimizationStats {
        patternsPerModel = Collections.unmodifiableMap(new TreeMap<>(patternsPerModel));
    }
}
