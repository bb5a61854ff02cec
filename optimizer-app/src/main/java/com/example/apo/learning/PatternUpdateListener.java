package com.example.apo.learning;

import com.example.apo.pattern.Pattern;

/**
 * Notified synchronously after the {@link LearningEngine} stores an updated pattern,
 * before {@code recordOutcome} returns to its caller.
 */
@FunctionalInterface
public interface PatternUpdateListener {

    void patternUpdated(Pattern pattern);
}
