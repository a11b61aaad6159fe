package com.document.classification.metrics;

import com.document.classification.core.model.DecisionOutcome;
import com.document.classification.core.model.DecisionStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("every method should be callable")
        void testNoOp() {
            MetricsService service = new NoOpMetricsService();
            assertDoesNotThrow(() -> {
                service.recordClassificationDuration(DecisionStage.BLENDED, Duration.ofMillis(5));
                service.incrementClassified(DecisionOutcome.CLASSIFIED);
                service.incrementEmbeddingSkipped();
                service.incrementEmbeddingFailed();
                service.recordRuleScore(0.8);
                service.recordBatchSize(10);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private SimpleMeterRegistry registry;
        private MicrometerMetricsService service;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            service = new MicrometerMetricsService(registry);
        }

        @Test
        @DisplayName("durations should be tagged with the stage label")
        void testDurationTaggedByStage() {
            service.recordClassificationDuration(DecisionStage.RULE_ONLY, Duration.ofMillis(20));
            service.recordClassificationDuration(DecisionStage.RULE_ONLY, Duration.ofMillis(40));
            service.recordClassificationDuration(DecisionStage.BLENDED, Duration.ofMillis(100));

            Timer ruleOnly = registry.find("document.classification.duration").tag("stage", "rule-only").timer();
            Timer blended = registry.find("document.classification.duration").tag("stage", "blended").timer();
            assertNotNull(ruleOnly);
            assertNotNull(blended);
            assertEquals(2, ruleOnly.count());
            assertEquals(60.0, ruleOnly.totalTime(TimeUnit.MILLISECONDS), 0.001);
            assertEquals(1, blended.count());
        }

        @Test
        @DisplayName("outcomes should be counted separately")
        void testOutcomeCounters() {
            service.incrementClassified(DecisionOutcome.CLASSIFIED);
            service.incrementClassified(DecisionOutcome.CLASSIFIED);
            service.incrementClassified(DecisionOutcome.FAILED);

            Counter classified = registry.find("document.classified").tag("outcome", "CLASSIFIED").counter();
            Counter failed = registry.find("document.classified").tag("outcome", "FAILED").counter();
            assertEquals(2.0, classified.count());
            assertEquals(1.0, failed.count());
            assertNull(registry.find("document.classified").tag("outcome", "UNCLASSIFIED").counter());
        }

        @Test
        @DisplayName("embedding counters should be registered up front")
        void testEmbeddingCounters() {
            assertEquals(0.0, registry.get("document.embedding.skipped").counter().count());

            service.incrementEmbeddingSkipped();
            service.incrementEmbeddingFailed();
            service.incrementEmbeddingFailed();

            assertEquals(1.0, registry.get("document.embedding.skipped").counter().count());
            assertEquals(2.0, registry.get("document.embedding.failed").counter().count());
        }

        @Test
        @DisplayName("rule scores and batch sizes should be summarized")
        void testSummaries() {
            service.recordRuleScore(0.5);
            service.recordRuleScore(1.0);
            service.recordBatchSize(12);

            DistributionSummary scores = registry.get("document.rule.score").summary();
            assertEquals(2, scores.count());
            assertEquals(1.5, scores.totalAmount(), 1e-9);
            assertEquals(1.0, scores.max(), 1e-9);
            assertEquals(12.0, registry.get("document.batch.size").summary().totalAmount(), 1e-9);
        }
    }
}
