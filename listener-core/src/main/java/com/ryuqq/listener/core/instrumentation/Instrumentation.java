package com.ryuqq.listener.core.instrumentation;

import java.util.Map;

/**
 * Instrumentation sink SPI for listener lifecycle and processing events.
 *
 * <p>Every stage of the listener (start, stop, batch, message, retry error, retry abort)
 * is bracketed by a scope obtained from this interface, so that start, end and error
 * emission are guaranteed on all exit paths.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: start and stop are instrumented from different threads</li>
 *   <li>Non-throwing: a failing sink must never change processing behavior</li>
 *   <li>Metadata maps are handed over by the caller; implementations may keep them</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Instrumentation {

    /**
     * Starts an instrumented operation.
     *
     * @param event the event being recorded
     * @param metadata structured metadata for the event (never null)
     * @return scope that must be closed when the operation ends
     */
    InstrumentationScope begin(ListenerEvent event, Map<String, Object> metadata);
}
