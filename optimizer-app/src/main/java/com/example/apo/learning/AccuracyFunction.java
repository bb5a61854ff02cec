package com.example.apo.learning;

import java.util.Map;

/**
 * Scores a prediction against the ground truth that arrived later.
 * <p>
 * Implementations should return a value in [0, 1] where 1 is a perfect prediction.
 * The {@link LearningEngine} clamps anything else, so a misbehaving function degrades
 * learning quality but never corrupts stored confidences.
 */
@FunctionalInterface
public interface AccuracyFunction {

    double score(Map<String, Object> predicted, Map<String, Object> actual);
}
