package com.example.apo;

import com.example.apo.cache.PredictionCache;
import com.example.apo.cache.PredictionCacheKey;
import com.example.apo.cache.PredictionCacheSweeper;
import com.example.apo.dto.LearningInsight;
import com.example.apo.dto.PredictionRecord;
import com.example.apo.dto.Recommendation;
import com.example.apo.dto.RecommendationSource;
import com.example.apo.geo.Coordinate;
import com.example.apo.pattern.JournalPatternStore;
import com.example.apo.pattern.PatternStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Boots the full context with the journal-backed store in a throwaway directory.
 */
@SpringBootTest(properties = "spring.profiles.active=test")
class AdaptiveOptimizerApplicationTest {

    private static Path dataDir;

    @Autowired AdaptiveOptimizer optimizer;
    @Autowired PatternStore patternStore;
    @Autowired OptimizerProps props;
    @Autowired PredictionCache<Map<String, Object>> predictionCache;
    @Autowired PredictionCacheSweeper sweeper;
    @Autowired MeterRegistry meterRegistry;

    @DynamicPropertySource
    static void registerProps(DynamicPropertyRegistry r) {
        try {
            dataDir = Files.createTempDirectory("apo-test");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        r.add("optimizer.pattern-store.type", () -> "journal");
        r.add("optimizer.pattern-store.journal-file", () -> dataDir.resolve("patterns.jsonl").toString());
    }

    @Test
    void propertiesAreBoundFromYaml() {
        assertThat(props.getDefaultRadiusKm()).isEqualTo(111.0);
        assertThat(props.getDefaultModelId()).isEqualTo("ensemble");
        assertThat(props.getPredictionCache().getTtl()).isEqualTo(Duration.ofMinutes(5));
        assertThat(props.getPredictionCache().getSweepInterval()).isEqualTo(Duration.ofHours(1));
        assertThat(props.getAccuracy().getScales()).containsEntry("temperature", 5.0);
    }

    @Test
    void learnedOutcomeIsPersistedAndRecommended() throws IOException {
        assertThat(patternStore).isInstanceOf(JournalPatternStore.class);
        Coordinate boulder = Coordinate.of(40.015, -105.27);

        PredictionRecord p = new PredictionRecord(boulder, "lstm", Instant.now(), Map.of("temperature", 18.0));
        LearningInsight insight = optimizer.recordOutcome(p, Map.of("temperature", 19.0));
        // 1 degree off on a 5 degree scale
        assertThat(insight.accuracy()).isCloseTo(0.8, within(1e-9));

        Recommendation rec = optimizer.recommend(boulder, 5.0, 1);
        assertThat(rec.modelId()).isEqualTo("lstm");
        assertThat(rec.source()).isEqualTo(RecommendationSource.LEARNED);

        Path journal = ((JournalPatternStore) patternStore).journal();
        assertThat(Files.readAllLines(journal, StandardCharsets.UTF_8))
                .anySatisfy(line -> assertThat(line).contains("\"model_id\":\"lstm\""));
        assertThat(meterRegistry.find("apo.learning.outcomes").counter()).isNotNull();
    }

    @Test
    void predictionCacheAndSweeperAreWired() {
        PredictionCacheKey key = PredictionCacheKey.of(Coordinate.of(51.5, -0.12), Instant.now(), Duration.ofHours(1), "v7");
        predictionCache.put(key, Map.of("temperature", 11.0));

        assertThat(predictionCache.get(key)).contains(Map.of("temperature", 11.0));
        sweeper.sweep();
        assertThat(predictionCache.get(key)).isPresent();
    }
}
