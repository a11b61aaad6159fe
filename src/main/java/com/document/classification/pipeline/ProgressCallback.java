package com.document.classification.pipeline;

import com.document.classification.core.model.Decision;

/**
 * Callback for tracking the progress of a batch run.
 * Invoked from the collecting thread, one call per finished document.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called after each document has been decided.
     *
     * @param completed number of documents decided so far
     * @param total     number of documents in the batch
     * @param decision  the decision just collected
     */
    void onProgress(int completed, int total, Decision decision);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (completed, total, decision) -> {};
}
