package com.ryuqq.listener.adapter.inmemory.log;

import com.ryuqq.listener.core.spi.LogClient;
import com.ryuqq.listener.core.spi.LogConsumer;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link LogClient} SPI.
 *
 * <p>Hands out {@link InMemoryLogConsumer}s over a shared {@link InMemoryLog} and counts
 * {@link #close()} calls so tests can assert that a connection is released exactly once.</p>
 *
 * <p>Closing stops every consumer created by this client.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryLogClient implements LogClient {

    private final InMemoryLog log;
    private final int maxBatchSize;
    private final boolean follow;
    private final List<InMemoryLogConsumer> consumers = new CopyOnWriteArrayList<>();
    private final AtomicInteger closeCount = new AtomicInteger();

    /**
     * Creates a client over a shared log.
     *
     * @param log the shared log
     * @param maxBatchSize maximum messages per batch for consumers of this client
     * @param follow whether consumers wait for new messages instead of returning when drained
     * @throws IllegalArgumentException if log is null
     */
    public InMemoryLogClient(InMemoryLog log, int maxBatchSize, boolean follow) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.log = log;
        this.maxBatchSize = maxBatchSize;
        this.follow = follow;
    }

    @Override
    public LogConsumer consumer(String groupId) {
        if (isClosed()) {
            throw new IllegalStateException("Client already closed");
        }
        InMemoryLogConsumer consumer = new InMemoryLogConsumer(log, groupId, maxBatchSize, follow);
        consumers.add(consumer);
        return consumer;
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
        for (InMemoryLogConsumer consumer : consumers) {
            consumer.stop();
        }
    }

    /**
     * Returns whether {@link #close()} has been called at least once.
     *
     * @return true if closed
     */
    public boolean isClosed() {
        return closeCount.get() > 0;
    }

    /**
     * Returns how many times {@link #close()} has been called.
     *
     * @return close call count
     */
    public int getCloseCount() {
        return closeCount.get();
    }

    /**
     * Returns the consumers created by this client.
     *
     * @return snapshot of consumers in creation order
     */
    public List<InMemoryLogConsumer> getConsumers() {
        return List.copyOf(consumers);
    }
}
