package com.example.apo.dto;

import com.example.apo.geo.Coordinate;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable value describing one prediction produced by an external predictor.
 *
 * <p>
 * The optimizer never computes predictions. It receives them, together with the
 * ground truth that arrives later, and learns which model performed best where.
 * </p>
 *
 * <h2>Fields:</h2>
 * <ul>
 *   <li><b>location</b> – the point the prediction was made for.</li>
 *   <li><b>modelId</b> – the strategy that produced it (e.g. {@code "lstm"}, {@code "ensemble"}).</li>
 *   <li><b>issuedAt</b> – when the prediction was issued.</li>
 *   <li><b>payload</b> – caller-defined values; opaque except to the accuracy function.
 *       Stored as an immutable copy.</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * PredictionRecord p = new PredictionRecord(
 *     Coordinate.of(40.71, -74.00),
 *     "ensemble",
 *     Instant.now(),
 *     Map.of("temperature", 21.5, "precipitation", 0.2)
 * );
 * }</pre>
 */
public record PredictionRecord(
        Coordinate location,
        String modelId,
        Instant issuedAt,
        Map<String, Object> payload) {

    public PredictionRecord {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(payload, "payload");
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId must not be blank");
        }
        payload = Map.copyOf(payload);
    }
}
