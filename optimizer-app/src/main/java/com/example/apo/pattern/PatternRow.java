package com.example.apo.pattern;

import com.example.apo.geo.Coordinate;

import java.time.Instant;

/**
 * One line of the pattern journal, as written by {@link JournalPatternStore}.
 *
 * <pre>{@code
 * {"lat":40.71,"lon":-74.0,"model_id":"ensemble","confidence":0.85,"sample_count":30,"last_used_at":1760900000000}
 * }</pre>
 *
 * Field names are snake_case to keep the file readable outside the JVM.
 */
public record PatternRow(
        Double lat,
        Double lon,
        String model_id,
        Double confidence,
        Long sample_count,
        Long last_used_at) {

    public static PatternRow of(Pattern p) {
        return new PatternRow(
                p.location().latitude(),
                p.location().longitude(),
                p.modelId(),
                p.confidence(),
                p.sampleCount(),
                p.lastUsedAt().toEpochMilli());
    }

    /**
     * Validate and convert back to a {@link Pattern}.
     *
     * @throws StorageException with {@link StorageException.Kind#CORRUPT} if a field is missing or out of range
     */
    public Pattern toPattern() {
        if (lat == null || lon == null || confidence == null || sample_count == null || last_used_at == null) {
            throw StorageException.corrupt("missing field in " + this, null);
        }
        try {
            return new Pattern(Coordinate.of(lat, lon), model_id, confidence, sample_count,
                    Instant.ofEpochMilli(last_used_at));
        } catch (IllegalArgumentException e) {
            throw StorageException.corrupt(e.getMessage(), e);
        }
    }
}
