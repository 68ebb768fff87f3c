package com.ryuqq.listener.adapter.inmemory.log;

import com.ryuqq.listener.core.spi.LogClientFactory;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link LogClientFactory} SPI for testing and reference purposes.
 *
 * <p>Every {@link #create()} returns a fresh {@link InMemoryLogClient} over the same
 * {@link InMemoryLog}, so consumers of the same group share committed offsets across
 * listener restarts.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Drain mode (default) or follow mode, see {@link InMemoryLogConsumer}</li>
 *   <li>Connection failure injection via {@link #failNextCreate(RuntimeException)}</li>
 *   <li>Tracking of created clients for close assertions</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryLog log = new InMemoryLog();
 * InMemoryLogClientFactory factory = InMemoryLogClientFactory.following(log);
 *
 * Listener listener = new PartitionListener(config, OrderHandler::new, factory, instrumentation);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryLogClientFactory implements LogClientFactory {

    /**
     * Default maximum number of messages per batch.
     */
    public static final int DEFAULT_MAX_BATCH_SIZE = 100;

    private final InMemoryLog log;
    private final int maxBatchSize;
    private final boolean follow;
    private final List<InMemoryLogClient> clients = new CopyOnWriteArrayList<>();
    private final Queue<RuntimeException> pendingFailures = new ConcurrentLinkedQueue<>();

    /**
     * Creates a drain-mode factory with the default batch size.
     *
     * @param log the shared log
     */
    public InMemoryLogClientFactory(InMemoryLog log) {
        this(log, DEFAULT_MAX_BATCH_SIZE, false);
    }

    /**
     * Creates a factory.
     *
     * @param log the shared log
     * @param maxBatchSize maximum messages per batch (positive)
     * @param follow whether consumers wait for new messages instead of returning when drained
     * @throws IllegalArgumentException if arguments are invalid
     */
    public InMemoryLogClientFactory(InMemoryLog log, int maxBatchSize, boolean follow) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive (current: " + maxBatchSize + ")");
        }
        this.log = log;
        this.maxBatchSize = maxBatchSize;
        this.follow = follow;
    }

    /**
     * Creates a follow-mode factory whose consumers run until stopped.
     *
     * @param log the shared log
     * @return a new factory
     */
    public static InMemoryLogClientFactory following(InMemoryLog log) {
        return new InMemoryLogClientFactory(log, DEFAULT_MAX_BATCH_SIZE, true);
    }

    @Override
    public InMemoryLogClient create() {
        RuntimeException failure = pendingFailures.poll();
        if (failure != null) {
            throw failure;
        }
        InMemoryLogClient client = new InMemoryLogClient(log, maxBatchSize, follow);
        clients.add(client);
        return client;
    }

    /**
     * Makes the next {@link #create()} call throw the given exception.
     *
     * <p>Calls queue up: N calls fail the next N connection attempts.</p>
     *
     * @param failure the exception to throw
     */
    public void failNextCreate(RuntimeException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        pendingFailures.add(failure);
    }

    /**
     * Returns the clients created so far.
     *
     * @return snapshot of clients in creation order
     */
    public List<InMemoryLogClient> getClients() {
        return List.copyOf(clients);
    }

    public InMemoryLog getLog() {
        return log;
    }
}
