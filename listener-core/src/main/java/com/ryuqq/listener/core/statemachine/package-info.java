/**
 * Listener lifecycle and per-message retry state machines.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.listener.core.statemachine.ListenerState} - Listener lifecycle states (single-use)</li>
 *   <li>{@link com.ryuqq.listener.core.statemachine.RetryState} - Retry loop states for one message</li>
 *   <li>{@link com.ryuqq.listener.core.statemachine.StateTransition} - Transition validation for both</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * RetryState state = RetryState.ATTEMPTING;
 * state = StateTransition.transition(state, RetryState.FAILED);
 * state = StateTransition.transition(state, RetryState.BACKING_OFF);
 *
 * // This will throw IllegalStateException
 * StateTransition.validate(state, RetryState.SUCCEEDED);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.listener.core.statemachine;
