package com.document.classification.pipeline;

import com.document.classification.core.model.Decision;
import com.document.classification.core.model.ErrorKind;
import com.document.classification.logging.LogContext;
import com.document.classification.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Classifies many documents in parallel.
 *
 * <p>Documents run on the supplied worker pool; finished decisions come back
 * through an {@link ExecutorCompletionService} to the calling thread, which is
 * the only writer of the result list. The returned run lists decisions in
 * input order regardless of completion order.</p>
 */
public class BatchClassifier {
    private static final Logger log = LoggerFactory.getLogger(BatchClassifier.class);

    private final ClassificationPipeline pipeline;
    private final ExecutorService workers;
    private final MetricsService metrics;

    public BatchClassifier(ClassificationPipeline pipeline, ExecutorService workers, MetricsService metrics) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline is required");
        this.workers = Objects.requireNonNull(workers, "workers is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * Classifies every path. A failing document yields a failed decision; the
     * batch always completes.
     */
    public ClassificationRun classifyAll(List<Path> paths, Path sourceRoot, ProgressCallback callback) {
        ProgressCallback progress = callback != null ? callback : ProgressCallback.NOOP;
        String runId = LogContext.generateRunId();
        long start = System.nanoTime();
        int total = paths.size();
        metrics.recordBatchSize(total);

        try (LogContext ctx = LogContext.forRun(runId)) {
            log.info("batch.started documents={}", total);

            CompletionService<Indexed> completion = new ExecutorCompletionService<>(workers);
            List<Future<Indexed>> futures = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                int index = i;
                Path path = paths.get(i);
                futures.add(completion.submit(() -> classifyOne(index, path, sourceRoot, runId)));
            }

            Decision[] decisions = new Decision[total];
            for (int completed = 1; completed <= total; completed++) {
                Indexed result = take(completion);
                if (result == null) {
                    break;
                }
                decisions[result.index()] = result.decision();
                progress.onProgress(completed, total, result.decision());
            }
            fillMissing(decisions, paths, futures);

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            ClassificationRun run = new ClassificationRun(runId, Arrays.asList(decisions), elapsed);
            log.info("batch.completed documents={} classified={} unclassified={} failed={} durationMs={}",
                    total, run.classifiedCount(), run.unclassifiedCount(), run.failedCount(), elapsed.toMillis());
            return run;
        }
    }

    /**
     * Runs one document, turning anything short of a fatal VM error into a failed decision.
     */
    private Indexed classifyOne(int index, Path path, Path sourceRoot, String runId) {
        try {
            return new Indexed(index, pipeline.classify(path, sourceRoot, runId));
        } catch (RuntimeException e) {
            log.error("document.worker.failed document={} error={}", path, e.toString(), e);
            return new Indexed(index, Decision.failed(path, ErrorKind.INTERNAL, describe(e)));
        } catch (Error e) {
            if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
                throw e;
            }
            log.error("document.worker.failed document={} error={}", path, e.toString());
            return new Indexed(index, Decision.failed(path, ErrorKind.INTERNAL, describe(e)));
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getClass().getSimpleName() + ": " + t.getMessage()
                : t.getClass().getSimpleName();
    }

    private Indexed take(CompletionService<Indexed> completion) {
        try {
            return completion.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("batch.interrupted");
            return null;
        } catch (ExecutionException e) {
            // only fatal VM errors get past classifyOne
            throw new IllegalStateException("Document worker failed", e.getCause());
        }
    }

    /**
     * Marks documents that never produced a decision (after an interrupt) as failed.
     */
    private void fillMissing(Decision[] decisions, List<Path> paths, List<Future<Indexed>> futures) {
        for (int i = 0; i < decisions.length; i++) {
            if (decisions[i] == null) {
                futures.get(i).cancel(true);
                decisions[i] = Decision.failed(paths.get(i), ErrorKind.INTERNAL, "classification interrupted");
            }
        }
    }

    private record Indexed(int index, Decision decision) {}
}
