package com.document.classification.api;

import com.document.classification.config.ClassifierConfiguration;
import com.document.classification.config.ClassifierOptions;
import com.document.classification.core.model.CategorySet;
import com.document.classification.core.model.Decision;
import com.document.classification.decision.DecisionPolicy;
import com.document.classification.decision.DecisionResolver;
import com.document.classification.decision.DecisionValidator;
import com.document.classification.embedding.CachingEmbeddingProvider;
import com.document.classification.embedding.EmbeddingCacheConfig;
import com.document.classification.embedding.EmbeddingProvider;
import com.document.classification.embedding.NoOpEmbeddingProvider;
import com.document.classification.embedding.TextChunker;
import com.document.classification.extraction.CompositeTextExtractor;
import com.document.classification.extraction.DocumentDiscovery;
import com.document.classification.extraction.TextExtractor;
import com.document.classification.metrics.MetricsService;
import com.document.classification.metrics.NoOpMetricsService;
import com.document.classification.pipeline.BatchClassifier;
import com.document.classification.pipeline.ClassificationPipeline;
import com.document.classification.pipeline.ClassificationRun;
import com.document.classification.pipeline.ProgressCallback;
import com.document.classification.rules.RuleEngine;
import com.document.classification.similarity.SemanticClassifier;
import com.document.classification.tracing.NoOpTracingService;
import com.document.classification.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for classifying documents.
 *
 * <p>Wires extraction, the rule engine, the semantic classifier and the
 * decision resolver into a pipeline and runs it over single files or whole
 * directory trees. The classifier owns two thread pools and must be closed.</p>
 *
 * <pre>
 * try (DocumentClassifier classifier = DocumentClassifier.builder()
 *         .configuration(new CategoryConfigLoader().load(configFile))
 *         .embeddingProvider(OllamaEmbeddingProvider.builder().build())
 *         .build()) {
 *     ClassificationRun run = classifier.classifyDirectory(sourceDir, ProgressCallback.NOOP);
 * }
 * </pre>
 */
public class DocumentClassifier implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DocumentClassifier.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final CategorySet categories;
    private final DecisionPolicy policy;
    private final ClassifierOptions options;
    private final EmbeddingProvider embeddingProvider;
    private final DocumentDiscovery discovery;
    private final ClassificationPipeline pipeline;
    private final BatchClassifier batchClassifier;
    private final ExecutorService workerPool;
    private final ExecutorService embeddingPool;

    private DocumentClassifier(Builder builder) {
        this.categories = builder.configuration.categories();
        this.policy = builder.configuration.policy();
        this.options = builder.options;

        EmbeddingProvider provider = builder.embeddingProvider != null
                ? builder.embeddingProvider
                : new NoOpEmbeddingProvider();
        if (options.isEmbeddingCacheEnabled() && !(provider instanceof NoOpEmbeddingProvider)) {
            provider = new CachingEmbeddingProvider(provider, EmbeddingCacheConfig.defaults());
        }
        this.embeddingProvider = provider;

        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        TextExtractor extractor = builder.textExtractor != null
                ? builder.textExtractor
                : CompositeTextExtractor.createDefault(options.getMaxPages());

        this.workerPool = Executors.newFixedThreadPool(options.getWorkerCount(), namedThreads("classifier-worker"));
        this.embeddingPool = Executors.newFixedThreadPool(options.getWorkerCount(), namedThreads("classifier-embed"));

        SemanticClassifier semanticClassifier = new SemanticClassifier(categories, embeddingProvider,
                new TextChunker(options.getEmbeddingChunkChars()), embeddingPool, options.getEmbeddingTimeout());
        this.pipeline = new ClassificationPipeline(extractor, new RuleEngine(categories), semanticClassifier,
                new DecisionResolver(categories, policy), new DecisionValidator(categories, policy),
                metrics, tracing);
        this.batchClassifier = new BatchClassifier(pipeline, workerPool, metrics);
        this.discovery = new DocumentDiscovery(options.getSupportedExtensions());

        log.info("DocumentClassifier initialized: categories={}, embedding={}, workers={}, policy={}",
                categories.names(), embeddingProvider.getProviderName(), options.getWorkerCount(), policy);
    }

    /**
     * Classifies one file on the calling thread.
     */
    public Decision classify(Path path) {
        Path parent = path.toAbsolutePath().getParent();
        return pipeline.classify(path, parent, null);
    }

    /**
     * Classifies the given files in parallel; decisions come back in input order.
     */
    public ClassificationRun classifyAll(List<Path> paths, Path sourceRoot, ProgressCallback callback) {
        return batchClassifier.classifyAll(paths, sourceRoot, callback);
    }

    /**
     * Discovers every supported file under {@code root} and classifies them.
     */
    public ClassificationRun classifyDirectory(Path root, ProgressCallback callback) {
        List<Path> paths = discovery.discover(root);
        return batchClassifier.classifyAll(paths, root, callback);
    }

    public CategorySet getCategories() {
        return categories;
    }

    public DecisionPolicy getPolicy() {
        return policy;
    }

    public ClassifierOptions getOptions() {
        return options;
    }

    public EmbeddingProvider getEmbeddingProvider() {
        return embeddingProvider;
    }

    @Override
    public void close() {
        shutdown(workerPool, "worker");
        shutdown(embeddingPool, "embedding");
    }

    private static void shutdown(ExecutorService pool, String name) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("executor.shutdown.timeout pool={}", name);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ClassifierConfiguration configuration;
        private ClassifierOptions options = ClassifierOptions.defaults();
        private EmbeddingProvider embeddingProvider;
        private TextExtractor textExtractor;
        private MetricsService metricsService;
        private TracingService tracingService;

        /**
         * Sets the categories and decision policy, usually from {@code CategoryConfigLoader}.
         */
        public Builder configuration(ClassifierConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        /**
         * Shorthand for a configuration with the default decision policy.
         */
        public Builder categories(CategorySet categories) {
            this.configuration = new ClassifierConfiguration(categories, DecisionPolicy.defaults());
            return this;
        }

        public Builder options(ClassifierOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets the embedding provider. Defaults to {@link NoOpEmbeddingProvider},
         * in which case inconclusive documents fall back to the rule result.
         */
        public Builder embeddingProvider(EmbeddingProvider embeddingProvider) {
            this.embeddingProvider = embeddingProvider;
            return this;
        }

        /**
         * Replaces the default PDF and plain-text extractors.
         */
        public Builder textExtractor(TextExtractor textExtractor) {
            this.textExtractor = textExtractor;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public DocumentClassifier build() {
            if (configuration == null) {
                throw new IllegalStateException("ClassifierConfiguration is required");
            }
            if (options == null) {
                throw new IllegalStateException("ClassifierOptions is required");
            }
            return new DocumentClassifier(this);
        }
    }
}
