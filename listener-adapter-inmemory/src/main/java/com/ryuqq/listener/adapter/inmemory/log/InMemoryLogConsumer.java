package com.ryuqq.listener.adapter.inmemory.log;

import com.ryuqq.listener.core.model.Batch;
import com.ryuqq.listener.core.model.Message;
import com.ryuqq.listener.core.spi.BatchCallback;
import com.ryuqq.listener.core.spi.LogConsumer;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * In-memory implementation of {@link LogConsumer} SPI.
 *
 * <p>Reads one batch per partition per round, starting at the group's committed offset,
 * and commits {@code lastOffset + 1} only after the callback returns normally.
 * A callback exception leaves the offset uncommitted and propagates unchanged.</p>
 *
 * <p><strong>Termination:</strong></p>
 * <ul>
 *   <li><strong>Drain mode</strong> (default): {@code eachBatch} returns once every partition is drained</li>
 *   <li><strong>Follow mode:</strong> {@code eachBatch} waits for new messages until {@link #stop()}</li>
 *   <li>Either mode returns after the current batch once {@link #stop()} is called</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryLogConsumer implements LogConsumer {

    /**
     * Maximum time an idle consumer in follow mode waits before re-checking its state.
     */
    private static final long IDLE_WAIT_MS = 50L;

    private final InMemoryLog log;
    private final String groupId;
    private final int maxBatchSize;
    private final boolean follow;

    private volatile String topic;
    private volatile boolean running = true;

    /**
     * Creates a consumer bound to a group.
     *
     * @param log the shared log
     * @param groupId the consumer group
     * @param maxBatchSize maximum messages per batch (positive)
     * @param follow whether to wait for new messages instead of returning when drained
     * @throws IllegalArgumentException if arguments are invalid
     */
    public InMemoryLogConsumer(InMemoryLog log, String groupId, int maxBatchSize, boolean follow) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        if (groupId == null || groupId.isBlank()) {
            throw new IllegalArgumentException("groupId cannot be null or blank");
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive (current: " + maxBatchSize + ")");
        }
        this.log = log;
        this.groupId = groupId;
        this.maxBatchSize = maxBatchSize;
        this.follow = follow;
    }

    @Override
    public void subscribe(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        this.topic = topic;
    }

    @Override
    public void eachBatch(BatchCallback callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        String subscribed = topic;
        if (subscribed == null) {
            throw new IllegalStateException("subscribe must be called before eachBatch");
        }

        while (running) {
            boolean delivered = false;
            for (int partition : log.partitions(subscribed)) {
                if (!running) {
                    return;
                }
                delivered |= deliver(subscribed, partition, callback);
            }
            if (!delivered) {
                if (!follow) {
                    return;
                }
                awaitMessages();
            }
        }
    }

    @Override
    public void stop() {
        running = false;
        log.wakeUp();
    }

    /**
     * Returns whether {@link #stop()} has been called.
     *
     * @return true once stopped
     */
    public boolean isStopped() {
        return !running;
    }

    public String getGroupId() {
        return groupId;
    }

    public String getTopic() {
        return topic;
    }

    private boolean deliver(String subscribed, int partition, BatchCallback callback) {
        long from = log.committed(groupId, subscribed, partition);
        List<Message> messages = log.read(subscribed, partition, from, maxBatchSize);
        if (messages.isEmpty()) {
            return false;
        }

        long lastOffset = messages.get(messages.size() - 1).offset();
        long endOffset = log.endOffset(subscribed, partition);
        Batch batch = new Batch(subscribed, partition, messages, endOffset - lastOffset - 1, endOffset);

        callback.onBatch(batch);
        log.commit(groupId, subscribed, partition, lastOffset + 1);
        return true;
    }

    private void awaitMessages() {
        try {
            log.awaitAppend(IDLE_WAIT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
