package com.example.apo.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodic background sweep of expired {@link PredictionCache} entries. */
@Component
@RequiredArgsConstructor
@Slf4j
public class PredictionCacheSweeper {

    private final PredictionCache<?> predictionCache;

    @Scheduled(fixedDelayString = "${optimizer.prediction-cache.sweep-interval:PT1M}",
            initialDelayString = "${optimizer.prediction-cache.sweep-interval:PT1M}")
    public void sweep() {
        int removed = predictionCache.clearExpired();
        if (removed > 0) {
            log.info("Prediction cache sweep removed {} expired entries; size={}", removed, predictionCache.size());
        }
    }
}
