package com.example.apo.dto;

import com.example.apo.geo.Coordinate;

/**
 * Result of folding one outcome into the pattern store.
 *
 * @param location      pattern location that was updated
 * @param modelId       model whose pattern was updated
 * @param accuracy      accuracy used for the update, always in [0, 1]
 * @param newConfidence confidence stored after the update
 * @param sampleCount   sample count stored after the update
 * @param clamped       true when the accuracy function returned a value outside [0, 1]
 *                      (or NaN) and it was clamped before use
 */
public record LearningInsight(
        Coordinate location,
        String modelId,
        double accuracy,
        double newConfidence,
        long sampleCount,
        boolean clamped) {}
