package com.example.apo.learning;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.util.Map;

/**
 * Default {@link AccuracyFunction}: per-field normalized absolute error, averaged.
 *
 * <p>
 * For every key whose value is numeric in both payloads:
 * <pre>
 *   fieldScore = 1 - min(|predicted - actual| / scale(field), 1)
 * </pre>
 * and the result is the mean of all field scores. Non-numeric fields are ignored. A
 * non-finite number on either side scores 0 for that field. When the payloads share no
 * numeric field the result is {@code 0.0}.
 * </p>
 *
 * <p>
 * Scales are per field (e.g. {@code temperature → 5.0} means a 5-degree miss scores 0),
 * falling back to {@code defaultScale}.
 * </p>
 */
@Slf4j
public class NormalizedErrorAccuracy implements AccuracyFunction {

    private final double defaultScale;
    private final Map<String, Double> scales;

    public NormalizedErrorAccuracy(double defaultScale, Map<String, Double> scales) {
        if (!(defaultScale > 0.0) || Double.isInfinite(defaultScale)) {
            throw new IllegalArgumentException("defaultScale must be positive: " + defaultScale);
        }
        scales.forEach((field, s) -> {
            if (s == null || !(s > 0.0) || Double.isInfinite(s)) {
                throw new IllegalArgumentException("scale for '" + field + "' must be positive: " + s);
            }
        });
        this.defaultScale = defaultScale;
        this.scales = Map.copyOf(scales);
    }

    public NormalizedErrorAccuracy(double defaultScale) {
        this(defaultScale, Map.of());
    }

    @Override
    public double score(Map<String, Object> predicted, Map<String, Object> actual) {
        SummaryStatistics fieldScores = new SummaryStatistics();
        for (Map.Entry<String, Object> e : predicted.entrySet()) {
            if (!(e.getValue() instanceof Number p)) continue;
            if (!(actual.get(e.getKey()) instanceof Number a)) continue;

            double pv = p.doubleValue();
            double av = a.doubleValue();
            if (!Double.isFinite(pv) || !Double.isFinite(av)) {
                fieldScores.addValue(0.0);
                continue;
            }
            double err = Math.abs(pv - av) / scaleFor(e.getKey());
            fieldScores.addValue(1.0 - Math.min(err, 1.0));
        }
        if (fieldScores.getN() == 0) {
            log.debug("No shared numeric fields between predicted={} and actual={}", predicted.keySet(), actual.keySet());
            return 0.0;
        }
        return fieldScores.getMean();
    }

    public double scaleFor(String field) {
        return scales.getOrDefault(field, defaultScale);
    }
}
