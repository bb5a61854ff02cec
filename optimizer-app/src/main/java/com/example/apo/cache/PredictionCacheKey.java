package com.example.apo.cache;

import com.example.apo.geo.Coordinate;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Key of a cached prediction result: location, time bucket and model version.
 *
 * <p>
 * Predictions issued for the same location and model version within one bucket share
 * a key, e.g. with a 1-hour bucket every request between 10:00 and 10:59 maps to the
 * same entry.
 * </p>
 */
public record PredictionCacheKey(Coordinate location, long timeBucket, String modelVersion) {

    public PredictionCacheKey {
        Objects.requireNonNull(location, "location");
        if (modelVersion == null || modelVersion.isBlank()) {
            throw new IllegalArgumentException("modelVersion must not be blank");
        }
    }

    /**
     * Key for the bucket containing {@code at}. Both {@code at} and {@code bucketWidth} must be
     * representable in epoch milliseconds (roughly +/-292 million years).
     *
     * @throws IllegalArgumentException if the width is under 1 ms or either value overflows a millisecond long
     */
    public static PredictionCacheKey of(Coordinate location, Instant at, Duration bucketWidth, String modelVersion) {
        Objects.requireNonNull(at, "at");
        Objects.requireNonNull(bucketWidth, "bucketWidth");
        long width;
        long epochMillis;
        try {
            width = bucketWidth.toMillis();
            epochMillis = at.toEpochMilli();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("bucket " + bucketWidth + " at " + at + " exceeds the millisecond range", e);
        }
        if (width <= 0) throw new IllegalArgumentException("bucketWidth must be positive: " + bucketWidth);
        return new PredictionCacheKey(location, Math.floorDiv(epochMillis, width), modelVersion);
    }
}
