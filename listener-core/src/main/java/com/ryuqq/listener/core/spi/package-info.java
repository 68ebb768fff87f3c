/**
 * Log client SPI consumed by the listener.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.listener.core.spi.LogClientFactory} - Produces connected clients</li>
 *   <li>{@link com.ryuqq.listener.core.spi.LogClient} - Connection; creates group consumers</li>
 *   <li>{@link com.ryuqq.listener.core.spi.LogConsumer} - Subscribe, iterate batches, stop</li>
 *   <li>{@link com.ryuqq.listener.core.spi.BatchCallback} - Per-batch callback</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>adapter-inmemory: {@code InMemoryLogClient} for tests and reference</li>
 *   <li>adapter-kafka: {@code KafkaLogClient} backed by Apache Kafka</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.listener.core.spi;
