/**
 * In-memory log client adapter for testing and reference purposes.
 *
 * <p>This package provides an in-memory implementation of the log client SPI:</p>
 * <ul>
 *   <li>{@link com.ryuqq.listener.adapter.inmemory.log.InMemoryLog} - Partitioned log with per-group committed offsets</li>
 *   <li>{@link com.ryuqq.listener.adapter.inmemory.log.InMemoryLogClientFactory} - Factory with failure injection</li>
 *   <li>{@link com.ryuqq.listener.adapter.inmemory.log.InMemoryLogClient} - Connection with close tracking</li>
 *   <li>{@link com.ryuqq.listener.adapter.inmemory.log.InMemoryLogConsumer} - Batch iteration in drain or follow mode</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> All classes are safe for concurrent use.
 * {@code stop()} and {@code close()} may be called from any thread while a consumer is iterating.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No persistence: all data is lost on JVM restart</li>
 *   <li>No partition assignment: every consumer of a group reads every partition</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.listener.adapter.inmemory.log;
