package com.example.apo;

import com.example.apo.cache.PredictionCache;
import com.example.apo.learning.AccuracyFunction;
import com.example.apo.learning.LearningEngine;
import com.example.apo.learning.NormalizedErrorAccuracy;
import com.example.apo.pattern.InMemoryPatternStore;
import com.example.apo.pattern.JournalPatternStore;
import com.example.apo.pattern.PatternStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.Map;

/**
 * Application-wide beans.
 *
 * <h2>Responsibilities:</h2>
 * <ul>
 *   <li>Pick the {@link PatternStore} backend from {@code optimizer.pattern-store.type}:
 *       {@code memory} (default) or {@code journal} (durable JSON-lines file).</li>
 *   <li>Provide the default {@link AccuracyFunction}, configured from
 *       {@code optimizer.accuracy.*}; declare another bean of that type to replace it.</li>
 *   <li>Wire the {@link LearningEngine} and the {@link PredictionCache}.</li>
 *   <li>Expose a UTC {@link Clock} so every timestamp and TTL comes from one place.</li>
 * </ul>
 */
@Configuration
@Slf4j
public class DefaultConfiguration {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    PatternStore patternStore(OptimizerProps props, Clock clock, MeterRegistry meterRegistry) {
        OptimizerProps.PatternStore cfg = props.getPatternStore();
        if (cfg.getType() == OptimizerProps.StoreType.MEMORY) {
            log.info("Using in-memory pattern store (cellSizeDegrees={}, maxQueryResults={})",
                    cfg.getCellSizeDegrees(), cfg.getMaxQueryResults());
            return new InMemoryPatternStore(clock, cfg.getCellSizeDegrees(), cfg.getMaxQueryResults());
        }

        JournalPatternStore store = new JournalPatternStore(
                Paths.get(cfg.getJournalFile()), new ObjectMapper(), clock,
                cfg.getCellSizeDegrees(), cfg.getMaxQueryResults());
        meterRegistry.gauge("apo.pattern.corrupt_rows", store, JournalPatternStore::corruptRows);

        if (store.needsCompaction()) {
            // Shrinking the journal is housekeeping; startup does not wait for it.
            store.compactAsync()
                    .doOnSubscribe(s -> log.info("Compacting pattern journal (async)… rows={} patterns={}",
                            store.journalRows(), store.size()))
                    .doOnError(e -> log.warn("Async journal compaction failed: {}", e.toString()))
                    .onErrorResume(e -> Mono.empty())
                    .subscribe();
        }
        return store;
    }

    @Bean
    AccuracyFunction accuracyFunction(OptimizerProps props) {
        OptimizerProps.Accuracy cfg = props.getAccuracy();
        return new NormalizedErrorAccuracy(cfg.getDefaultScale(), cfg.getScales());
    }

    @Bean
    LearningEngine learningEngine(PatternStore patternStore, AccuracyFunction accuracyFunction,
                                  Clock clock, MeterRegistry meterRegistry) {
        return new LearningEngine(patternStore, accuracyFunction, clock, meterRegistry);
    }

    @Bean
    PredictionCache<Map<String, Object>> predictionCache(OptimizerProps props, Clock clock, MeterRegistry meterRegistry) {
        OptimizerProps.PredictionCache cfg = props.getPredictionCache();
        return new PredictionCache<>(clock, cfg.getTtl(), cfg.getMaxEntries(), meterRegistry);
    }
}
