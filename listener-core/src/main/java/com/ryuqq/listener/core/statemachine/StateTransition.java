package com.ryuqq.listener.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>Listener 생명주기와 메시지 재시도 상태의 전이가 허용된 규칙을 따르는지
 * 검증합니다.</p>
 *
 * <p><strong>허용되는 Listener 전이:</strong></p>
 * <ul>
 *   <li>CREATED → RUNNING, CREATED → STOPPED</li>
 *   <li>RUNNING → STOPPED, RUNNING → ABORTED, RUNNING → FAILED</li>
 * </ul>
 *
 * <p><strong>허용되는 Retry 전이:</strong></p>
 * <ul>
 *   <li>ATTEMPTING → SUCCEEDED, ATTEMPTING → FAILED</li>
 *   <li>FAILED → BACKING_OFF</li>
 *   <li>BACKING_OFF → ATTEMPTING, BACKING_OFF → ABORTED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태에서는 어떤 상태로도 전이 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Listener 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ListenerState from, ListenerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case CREATED -> to == ListenerState.RUNNING || to == ListenerState.STOPPED;
            case RUNNING -> to.isTerminal();
            case STOPPED, ABORTED, FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * Retry 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RetryState from, RetryState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case ATTEMPTING -> to == RetryState.SUCCEEDED || to == RetryState.FAILED;
            case FAILED -> to == RetryState.BACKING_OFF;
            case BACKING_OFF -> to == RetryState.ATTEMPTING || to == RetryState.ABORTED;
            case SUCCEEDED, ABORTED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * Listener 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static ListenerState transition(ListenerState current, ListenerState next) {
        validate(current, next);
        return next;
    }

    /**
     * Retry 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RetryState transition(RetryState current, RetryState next) {
        validate(current, next);
        return next;
    }
}
