package com.ryuqq.listener.core.spi;

/**
 * Connection to a partitioned log cluster.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Creating group consumers bound to this connection</li>
 *   <li>Releasing the connection and every consumer created from it</li>
 * </ul>
 *
 * <p><strong>Ownership:</strong> a client is exclusively owned by one listener for its
 * lifetime; nothing else may touch it.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface LogClient extends AutoCloseable {

    /**
     * Creates a consumer that joins the given consumer group.
     *
     * @param groupId the consumer group
     * @return a consumer bound to this client
     * @throws IllegalArgumentException if groupId is null or blank
     * @throws IllegalStateException if the client is already closed
     */
    LogConsumer consumer(String groupId);

    /**
     * Releases the connection.
     *
     * <p>May be called from a thread other than the one polling a consumer of this client.
     * Implementations must tolerate being called while {@code eachBatch} is running.</p>
     */
    @Override
    void close();
}
