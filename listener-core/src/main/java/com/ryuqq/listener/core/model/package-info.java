/**
 * Core domain model package containing the values that flow through a listener.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.listener.core.model.ListenerIdentity} - Listener correlation context (listener id, group, topic)</li>
 *   <li>{@link com.ryuqq.listener.core.model.Message} - A single log record (key, value, offset, partition)</li>
 *   <li>{@link com.ryuqq.listener.core.model.Batch} - Ordered messages of one partition plus lag information</li>
 * </ul>
 *
 * <h2>Per-message State</h2>
 * <ul>
 *   <li>{@link com.ryuqq.listener.core.model.ProcessingMetadata} - Mutable retry counter and correlation fields for one message</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Everything except ProcessingMetadata is an immutable record</li>
 *   <li><strong>Validation:</strong> Compact constructors reject null identifiers and negative offsets</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.listener.core.model;
