package com.example.apo.learning;

import com.example.apo.dto.LearningInsight;
import com.example.apo.dto.PredictionRecord;
import com.example.apo.pattern.Pattern;
import com.example.apo.pattern.PatternStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Turns (prediction, actual) pairs into pattern confidence updates.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Score the prediction with the accuracy function; clamp to [0, 1] (NaN → 0) and
 *       log a warning when the function misbehaves.</li>
 *   <li>Atomically update the pattern for {@code (location, modelId)}:
 *     <ul>
 *       <li>absent → {@code confidence = accuracy, sampleCount = 1}</li>
 *       <li>present → {@code confidence = (old + accuracy) / 2, sampleCount + 1}</li>
 *     </ul>
 *   </li>
 *   <li>Notify {@link PatternUpdateListener}s so dependent caches can invalidate.</li>
 * </ol>
 *
 * <p>
 * The blend is a plain two-point average, so the latest outcome carries half the weight
 * regardless of history. Confidence reacts quickly and oscillates under noisy outcomes.
 * </p>
 *
 * <h2>Errors</h2>
 * {@link com.example.apo.pattern.StorageException} from the store propagates unchanged;
 * listeners are not notified when the write fails.
 */
@Slf4j
public class LearningEngine {

    private final PatternStore store;
    private final AccuracyFunction defaultAccuracy;
    private final Clock clock;
    private final List<PatternUpdateListener> listeners = new CopyOnWriteArrayList<>();

    private final Counter outcomes;
    private final Counter invalidOutcomes;

    public LearningEngine(PatternStore store, AccuracyFunction defaultAccuracy, Clock clock, MeterRegistry meterRegistry) {
        this.store = Objects.requireNonNull(store, "store");
        this.defaultAccuracy = Objects.requireNonNull(defaultAccuracy, "defaultAccuracy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.outcomes = meterRegistry.counter("apo.learning.outcomes");
        this.invalidOutcomes = meterRegistry.counter("apo.learning.invalid_outcome");
    }

    /** Record an outcome scored by the configured default accuracy function. */
    public LearningInsight recordOutcome(PredictionRecord prediction, Map<String, Object> actual) {
        return recordOutcome(prediction, actual, defaultAccuracy);
    }

    public LearningInsight recordOutcome(PredictionRecord prediction, Map<String, Object> actual,
                                         AccuracyFunction accuracyFn) {
        Objects.requireNonNull(prediction, "prediction");
        Objects.requireNonNull(actual, "actual");
        Objects.requireNonNull(accuracyFn, "accuracyFn");

        double raw = accuracyFn.score(prediction.payload(), actual);
        double accuracy = clamp01(raw);
        boolean clamped = Double.isNaN(raw) || raw != accuracy;
        if (clamped) {
            invalidOutcomes.increment();
            log.warn("Accuracy function returned {} for model={} location={}; clamped to {}",
                    raw, prediction.modelId(), prediction.location(), accuracy);
        }

        Pattern stored = store.compute(prediction.location(), prediction.modelId(), current -> current
                .map(p -> new Pattern(p.location(), p.modelId(),
                        (p.confidence() + accuracy) / 2.0,
                        p.sampleCount() + 1,
                        clock.instant()))
                .orElseGet(() -> Pattern.first(prediction.location(), prediction.modelId(), accuracy, clock.instant())));
        outcomes.increment();

        log.debug("Learned: model={} location={} accuracy={} confidence={} samples={}",
                stored.modelId(), stored.location(), accuracy, stored.confidence(), stored.sampleCount());

        for (PatternUpdateListener l : listeners) {
            l.patternUpdated(stored);
        }
        return new LearningInsight(stored.location(), stored.modelId(), accuracy,
                stored.confidence(), stored.sampleCount(), clamped);
    }

    public void addListener(PatternUpdateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(PatternUpdateListener listener) {
        listeners.remove(listener);
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
