package com.ryuqq.listener.core.spi;

/**
 * Group consumer SPI that drives the listener's main loop.
 *
 * <p>Offset commit, partition assignment and rebalancing belong to the implementation.
 * The listener only subscribes, iterates batches and asks polling to stop.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Batches of one partition are delivered in log order</li>
 *   <li>A batch counts as processed only after the callback returns normally</li>
 *   <li>Exceptions thrown by the callback propagate out of {@code eachBatch} unchanged</li>
 *   <li>{@link #stop()} is thread-safe and idempotent</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * LogConsumer consumer = client.consumer("orders-group");
 * consumer.subscribe("orders");
 * consumer.eachBatch(batch -&gt; batchProcessor.process(batch));  // blocks until stop()
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface LogConsumer {

    /**
     * Subscribes to a topic.
     *
     * @param topic the topic name
     * @throws IllegalArgumentException if topic is null or blank
     */
    void subscribe(String topic);

    /**
     * Polls batches and hands each one to the callback until {@link #stop()} is called
     * or the batch source is exhausted.
     *
     * <p>Blocks the calling thread for the whole iteration.</p>
     *
     * @param callback invoked once per batch, synchronously, on the calling thread
     * @throws IllegalArgumentException if callback is null
     */
    void eachBatch(BatchCallback callback);

    /**
     * Requests polling to cease after the current batch.
     */
    void stop();
}
