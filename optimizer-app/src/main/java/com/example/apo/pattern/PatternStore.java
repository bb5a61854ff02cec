package com.example.apo.pattern;

import com.example.apo.geo.Coordinate;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Durable keyed storage of learned {@link Pattern}s.
 *
 * <p>
 * Implementations must make writes atomic per {@link PatternKey}: concurrent upserts or
 * computes on the same key never lose an update, while reads and writes on other keys
 * proceed without blocking each other.
 * </p>
 *
 * <p>
 * Every read and write refreshes the pattern's {@code lastUsedAt}.
 * </p>
 *
 * @see InMemoryPatternStore
 * @see JournalPatternStore
 */
public interface PatternStore {

    /**
     * Insert or fully replace the pattern stored under {@code pattern.key()}.
     *
     * @return the pattern as stored
     * @throws StorageException with {@link StorageException.Kind#UNAVAILABLE} if the write cannot be persisted
     */
    Pattern upsert(Pattern pattern);

    /**
     * Atomically read-modify-write one key. The remapping function receives the current
     * pattern (empty if absent) and returns the replacement; it may be invoked while the
     * key is locked and must not touch the store itself.
     *
     * @return the pattern as stored
     * @throws StorageException with {@link StorageException.Kind#UNAVAILABLE} if the write cannot be persisted
     */
    Pattern compute(Coordinate location, String modelId, Function<Optional<Pattern>, Pattern> remapping);

    /** Exact lookup by location and model id. */
    Optional<Pattern> get(Coordinate location, String modelId);

    /**
     * All patterns whose stored location is within {@code radiusKm} of {@code center},
     * nearest first, truncated to the store's configured result cap.
     */
    List<Pattern> queryRadius(Coordinate center, double radiusKm);

    /** Snapshot of every stored pattern, in no particular order. */
    List<Pattern> findAll();

    int size();
}
