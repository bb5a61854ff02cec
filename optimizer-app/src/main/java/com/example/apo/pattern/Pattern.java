package com.example.apo.pattern;

import com.example.apo.geo.Coordinate;

import java.time.Instant;
import java.util.Objects;

/**
 * A learned association between a geographic point and how well one model has
 * performed there.
 *
 * <h2>Fields:</h2>
 * <ul>
 *   <li><b>location</b> – exact stored coordinate; together with {@code modelId} it forms the identity.</li>
 *   <li><b>modelId</b> – opaque identifier of a candidate prediction strategy.</li>
 *   <li><b>confidence</b> – blended accuracy estimate in [0, 1].</li>
 *   <li><b>sampleCount</b> – number of outcomes folded into {@code confidence}; at least 1.</li>
 *   <li><b>lastUsedAt</b> – refreshed on every read or write of the pattern.</li>
 * </ul>
 *
 * @throws IllegalArgumentException if confidence is outside [0, 1] or sampleCount &lt; 1
 */
public record Pattern(
        Coordinate location,
        String modelId,
        double confidence,
        long sampleCount,
        Instant lastUsedAt) {

    public Pattern {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(lastUsedAt, "lastUsedAt");
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId must not be blank");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be in [0,1]: " + confidence);
        }
        if (sampleCount < 1) {
            throw new IllegalArgumentException("sampleCount must be >= 1: " + sampleCount);
        }
    }

    /** First observation for a new (location, model) pair. */
    public static Pattern first(Coordinate location, String modelId, double accuracy, Instant now) {
        return new Pattern(location, modelId, accuracy, 1, now);
    }

    public PatternKey key() {
        return new PatternKey(location, modelId);
    }

    public Pattern touchedAt(Instant now) {
        return new Pattern(location, modelId, confidence, sampleCount, now);
    }
}
