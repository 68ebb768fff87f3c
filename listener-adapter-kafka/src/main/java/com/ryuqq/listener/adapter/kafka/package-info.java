/**
 * Kafka adapter for the log client SPI.
 *
 * <p>Implements {@link com.ryuqq.listener.core.spi.LogClientFactory},
 * {@link com.ryuqq.listener.core.spi.LogClient} and {@link com.ryuqq.listener.core.spi.LogConsumer}
 * on top of kafka-clients.</p>
 *
 * <p><strong>Delivery:</strong> each poll is split into one batch per partition; the offset
 * following the batch is committed synchronously after the callback returns. Auto commit is disabled,
 * so a batch interrupted by shutdown is redelivered to the group (at-least-once).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.listener.adapter.kafka;
