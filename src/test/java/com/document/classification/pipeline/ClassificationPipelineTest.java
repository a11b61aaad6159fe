package com.document.classification.pipeline;

import com.document.classification.core.model.Category;
import com.document.classification.core.model.CategorySet;
import com.document.classification.core.model.Decision;
import com.document.classification.core.model.DecisionOutcome;
import com.document.classification.core.model.DecisionStage;
import com.document.classification.core.model.Document;
import com.document.classification.core.model.DocumentMetadata;
import com.document.classification.core.model.ErrorKind;
import com.document.classification.core.model.SemanticScore;
import com.document.classification.core.model.SemanticScores;
import com.document.classification.decision.DecisionPolicy;
import com.document.classification.decision.DecisionResolver;
import com.document.classification.decision.DecisionValidator;
import com.document.classification.exception.ExtractionException;
import com.document.classification.extraction.TextExtractor;
import com.document.classification.metrics.MetricsService;
import com.document.classification.rules.Rule;
import com.document.classification.rules.RuleEngine;
import com.document.classification.similarity.SemanticClassifier;
import com.document.classification.tracing.NoOpTracingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ClassificationPipelineTest {

    private static final Path ROOT = Path.of("inbox");
    private static final Path SOURCE = ROOT.resolve("doc.pdf");

    @Mock
    private TextExtractor extractor;

    @Mock
    private SemanticClassifier semanticClassifier;

    @Mock
    private MetricsService metrics;

    private ClassificationPipeline pipeline;

    @BeforeEach
    void setUp() {
        CategorySet categories = CategorySet.of(
                new Category("Contracts", null, List.of(Rule.keyword("con", "agreement", 0.4)), new float[]{1f, 0f}),
                new Category("Invoices", null, List.of(Rule.keyword("inv", "invoice", 0.9)), new float[]{0f, 1f}));
        DecisionPolicy policy = DecisionPolicy.defaults();
        pipeline = new ClassificationPipeline(extractor, new RuleEngine(categories), semanticClassifier,
                new DecisionResolver(categories, policy), new DecisionValidator(categories, policy),
                metrics, new NoOpTracingService());
    }

    private static Document document(String text) {
        return new Document(SOURCE, text, DocumentMetadata.ofFile("doc.pdf", "doc.pdf", 100));
    }

    @Test
    @DisplayName("Should skip semantic scoring when the rules are conclusive")
    void testConclusiveSkipsSemantic() {
        when(extractor.extract(SOURCE, ROOT)).thenReturn(document("Invoice number 2024-001"));

        Decision decision = pipeline.classify(SOURCE, ROOT, "run-1");

        assertEquals("Invoices", decision.category());
        assertEquals(DecisionStage.RULE_ONLY, decision.stage());
        assertEquals(0.9, decision.confidence(), 1e-12);
        verify(semanticClassifier, never()).score(any());
        verify(metrics).incrementEmbeddingSkipped();
        verify(metrics).incrementClassified(DecisionOutcome.CLASSIFIED);
        verify(metrics).recordClassificationDuration(eq(DecisionStage.RULE_ONLY), any());
    }

    @Test
    @DisplayName("Should blend with semantic scores when the rules are inconclusive")
    void testInconclusiveUsesSemantic() {
        Document doc = document("This agreement is between the parties");
        when(extractor.extract(SOURCE, ROOT)).thenReturn(doc);
        when(semanticClassifier.score(doc)).thenReturn(SemanticScores.of(Map.of(
                "Contracts", new SemanticScore("Contracts", 0.8),
                "Invoices", new SemanticScore("Invoices", 0.1))));

        Decision decision = pipeline.classify(SOURCE, ROOT, "run-1");

        // Contracts: 0.5 * 0.4 + 0.5 * 0.8 = 0.6
        assertEquals("Contracts", decision.category());
        assertEquals(DecisionStage.BLENDED, decision.stage());
        assertEquals(0.6, decision.confidence(), 1e-9);
        verify(metrics, never()).incrementEmbeddingSkipped();
    }

    @Test
    @DisplayName("Should fall back to rules and count the failure when semantic scoring fails")
    void testSemanticFailure() {
        Document doc = document("This agreement is between the parties");
        when(extractor.extract(SOURCE, ROOT)).thenReturn(doc);
        when(semanticClassifier.score(doc)).thenReturn(SemanticScores.failed("connection refused"));

        Decision decision = pipeline.classify(SOURCE, ROOT, null);

        assertEquals("Contracts", decision.category());
        assertEquals(DecisionStage.RULE_ONLY, decision.stage());
        assertEquals("connection refused", decision.trace().semanticError());
        verify(metrics).incrementEmbeddingFailed();
    }

    @Test
    @DisplayName("Should turn an extraction failure into a failed decision")
    void testExtractionFailure() {
        when(extractor.extract(SOURCE, ROOT)).thenThrow(new ExtractionException(SOURCE, "PDF is password protected"));

        Decision decision = pipeline.classify(SOURCE, ROOT, "run-1");

        assertEquals(Decision.FAILED, decision.category());
        assertEquals(DecisionStage.FAILED, decision.stage());
        assertEquals(ErrorKind.EXTRACTION, decision.error().kind());
        assertEquals("PDF is password protected", decision.error().message());
        verify(metrics).incrementClassified(DecisionOutcome.FAILED);
        verifyNoInteractions(semanticClassifier);
    }

    @Test
    @DisplayName("Should turn an unexpected error into an internal failure")
    void testUnexpectedFailure() {
        when(extractor.extract(SOURCE, ROOT)).thenThrow(new IllegalStateException("boom"));

        Decision decision = pipeline.classify(SOURCE, ROOT, "run-1");

        assertEquals(DecisionStage.FAILED, decision.stage());
        assertEquals(ErrorKind.INTERNAL, decision.error().kind());
    }

    @Test
    @DisplayName("Should turn a stack overflow into an internal failure")
    void testStackOverflow() {
        when(extractor.extract(SOURCE, ROOT)).thenThrow(new StackOverflowError());

        Decision decision = pipeline.classify(SOURCE, ROOT, "run-1");

        assertEquals(DecisionStage.FAILED, decision.stage());
        assertEquals(ErrorKind.INTERNAL, decision.error().kind());
        assertEquals("stack overflow while classifying", decision.error().message());
        verify(metrics).incrementClassified(DecisionOutcome.FAILED);
    }
}
