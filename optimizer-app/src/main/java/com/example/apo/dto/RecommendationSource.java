package com.example.apo.dto;

/** Where a {@link Recommendation} came from. */
public enum RecommendationSource {
    /** Ranked from learned patterns. */
    LEARNED,
    /** No usable pattern in range; the caller's default model was returned with zero confidence. */
    DEFAULT
}
