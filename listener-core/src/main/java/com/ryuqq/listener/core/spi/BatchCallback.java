package com.ryuqq.listener.core.spi;

import com.ryuqq.listener.core.model.Batch;

/**
 * Callback invoked by {@link LogConsumer#eachBatch(BatchCallback)} for every batch.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BatchCallback {

    /**
     * Processes one batch.
     *
     * @param batch the batch (never null)
     */
    void onBatch(Batch batch);
}
