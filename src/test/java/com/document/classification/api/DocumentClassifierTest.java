package com.document.classification.api;

import com.document.classification.config.ClassifierOptions;
import com.document.classification.core.model.Category;
import com.document.classification.core.model.CategorySet;
import com.document.classification.core.model.Decision;
import com.document.classification.core.model.DecisionOutcome;
import com.document.classification.core.model.DecisionStage;
import com.document.classification.core.model.ErrorKind;
import com.document.classification.embedding.CachingEmbeddingProvider;
import com.document.classification.embedding.EmbeddingProvider;
import com.document.classification.embedding.NoOpEmbeddingProvider;
import com.document.classification.pipeline.ClassificationRun;
import com.document.classification.pipeline.ProgressCallback;
import com.document.classification.rules.Rule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DocumentClassifierTest {

    /**
     * Maps text mentioning "quarterly" onto the Reports centroid, everything else onto Invoices.
     */
    private static final class KeywordEmbeddingProvider implements EmbeddingProvider {
        private final AtomicInteger calls = new AtomicInteger();

        @Override
        public float[] embed(String text) {
            calls.incrementAndGet();
            return text.toLowerCase(Locale.ROOT).contains("quarterly")
                    ? new float[]{0.0f, 1.0f}
                    : new float[]{1.0f, 0.0f};
        }

        @Override
        public String getProviderName() {
            return "keyword-stub";
        }

        @Override
        public boolean isAvailable() {
            return true;
        }
    }

    private static CategorySet categories() {
        return CategorySet.of(
                new Category("Invoices", "Supplier invoices",
                        List.of(Rule.keyword("invoice", "invoice", 0.9)), new float[]{1.0f, 0.0f}),
                new Category("Reports", "Periodic reports", List.of(), new float[]{0.0f, 1.0f}));
    }

    @TempDir
    Path tempDir;

    private KeywordEmbeddingProvider provider;
    private DocumentClassifier classifier;

    @BeforeEach
    void setUp() {
        provider = new KeywordEmbeddingProvider();
        classifier = DocumentClassifier.builder()
                .categories(categories())
                .options(ClassifierOptions.builder().workerCount(2).build())
                .embeddingProvider(provider)
                .build();
    }

    @AfterEach
    void tearDown() {
        classifier.close();
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("Single documents")
    class SingleDocuments {

        @Test
        @DisplayName("Conclusive rules should skip the embedding provider")
        void testRuleOnly() throws IOException {
            Decision decision = classifier.classify(write("invoice.txt", "Invoice INV-0042"));

            assertEquals("Invoices", decision.category());
            assertEquals(DecisionStage.RULE_ONLY, decision.stage());
            assertTrue(decision.trace().semanticSkipped());
            assertEquals(0, provider.calls.get());
        }

        @Test
        @DisplayName("Inconclusive rules should fall through to semantic scoring")
        void testBlended() throws IOException {
            Decision decision = classifier.classify(write("q3.txt", "Quarterly results overview"));

            assertEquals("Reports", decision.category());
            assertEquals(DecisionStage.BLENDED, decision.stage());
            assertEquals(0.5, decision.confidence(), 1e-6);
            assertEquals(1, provider.calls.get());
        }

        @Test
        @DisplayName("Unreadable PDF should fail without throwing")
        void testCorruptPdf() throws IOException {
            Decision decision = classifier.classify(write("broken.pdf", "not a pdf at all"));

            assertEquals(DecisionOutcome.FAILED, decision.outcome());
            assertEquals(Decision.FAILED, decision.category());
            assertEquals(ErrorKind.EXTRACTION, decision.error().kind());
        }
    }

    @Nested
    @DisplayName("Directory runs")
    class DirectoryRuns {

        @Test
        @DisplayName("Should classify every supported file in path order")
        void testClassifyDirectory() throws IOException {
            write("a/invoice.txt", "Invoice for March");
            write("b/report.txt", "Quarterly figures");
            write("c/broken.pdf", "garbage");
            write("c/ignored.docx", "Invoice");

            AtomicInteger progress = new AtomicInteger();
            ClassificationRun run = classifier.classifyDirectory(tempDir,
                    (completed, total, decision) -> progress.incrementAndGet());

            assertEquals(3, run.total());
            assertEquals(3, progress.get());
            assertEquals(tempDir.resolve("a/invoice.txt"), run.decisions().get(0).sourcePath());
            assertEquals("Invoices", run.decisions().get(0).category());
            assertEquals("Reports", run.decisions().get(1).category());
            assertEquals(Decision.FAILED, run.decisions().get(2).category());
            assertEquals(2, run.classifiedCount());
            assertEquals(1, run.failedCount());
            assertTrue(run.hasFailures());
        }

        @Test
        @DisplayName("A rule that blows the stack should fail only its own document")
        void testBacktrackingRegex() throws IOException {
            write("regex/a.txt", "Invoice 17");
            write("regex/b.txt", "ab".repeat(200_000));
            write("regex/c.txt", "Invoice 18");
            CategorySet categories = CategorySet.of(
                    new Category("Invoices", List.of(Rule.keyword("invoice", "invoice", 0.9))),
                    new Category("Patterns", List.of(Rule.regex("alternation", "(a|b)*c", 0.9))));

            ClassificationRun run;
            try (DocumentClassifier regexClassifier = DocumentClassifier.builder()
                    .categories(categories)
                    .options(ClassifierOptions.builder().workerCount(2).build())
                    .build()) {
                run = regexClassifier.classifyDirectory(tempDir.resolve("regex"), ProgressCallback.NOOP);
            }

            assertEquals(3, run.total());
            assertEquals("Invoices", run.decisions().get(0).category());
            assertNotEquals(DecisionOutcome.CLASSIFIED, run.decisions().get(1).outcome());
            assertEquals("Invoices", run.decisions().get(2).category());
        }

        @Test
        @DisplayName("Empty directory should produce an empty run")
        void testEmptyDirectory() throws IOException {
            Path empty = Files.createDirectories(tempDir.resolve("empty"));

            ClassificationRun run = classifier.classifyDirectory(empty, ProgressCallback.NOOP);

            assertEquals(0, run.total());
            assertFalse(run.hasFailures());
        }

        @Test
        @DisplayName("Missing directory should be rejected")
        void testMissingDirectory() {
            assertThrows(IllegalArgumentException.class,
                    () -> classifier.classifyDirectory(tempDir.resolve("absent"), ProgressCallback.NOOP));
        }
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Should require a configuration")
        void testMissingConfiguration() {
            assertThrows(IllegalStateException.class, () -> DocumentClassifier.builder().build());
        }

        @Test
        @DisplayName("Should wrap real providers in the embedding cache")
        void testCacheWrapping() {
            assertInstanceOf(CachingEmbeddingProvider.class, classifier.getEmbeddingProvider());
        }

        @Test
        @DisplayName("Should leave the no-op provider unwrapped")
        void testNoOpDefault() {
            try (DocumentClassifier plain = DocumentClassifier.builder().categories(categories()).build()) {
                assertInstanceOf(NoOpEmbeddingProvider.class, plain.getEmbeddingProvider());
                assertEquals(List.of("Invoices", "Reports"), plain.getCategories().names());
            }
        }
    }
}
