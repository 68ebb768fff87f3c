package com.ryuqq.listener.core.statemachine;

/**
 * 메시지 한 건의 재시도 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * ATTEMPTING ──► SUCCEEDED
 *    ▲   │
 *    │   ▼ (handler 실패)
 *    │ FAILED
 *    │   │
 *    │   ▼
 *    └─ BACKING_OFF ──► ABORTED (sleep 직후 shutdown 감지)
 * </pre>
 *
 * <p>ABORTED는 BACKING_OFF에서만 도달할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RetryState {

    /**
     * handler 호출 중.
     */
    ATTEMPTING,

    /**
     * handler가 실패를 알림.
     */
    FAILED,

    /**
     * backoff 대기 중.
     */
    BACKING_OFF,

    /**
     * handler 성공.
     */
    SUCCEEDED,

    /**
     * shutdown 요청으로 중단.
     */
    ABORTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED 또는 ABORTED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == ABORTED;
    }
}
