package com.ryuqq.listener.core.statemachine;

/**
 * Listener의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>CREATED → RUNNING (start)</li>
 *   <li>CREATED → STOPPED (start 이전에 stop)</li>
 *   <li>RUNNING → STOPPED (stop 또는 배치 소스 종료)</li>
 *   <li>RUNNING → ABORTED (shutdown으로 재시도 루프 중단)</li>
 *   <li>RUNNING → FAILED (로그 클라이언트 장애 등 치명적 오류)</li>
 *   <li><strong>재시작 불가 (불변식)</strong>: 다시 실행하려면 새 인스턴스가 필요합니다.</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED ──────────────► STOPPED
 *    │
 *    ▼ (start)
 * RUNNING
 *    │
 *    ├─► STOPPED (stop / 배치 소스 종료)
 *    ├─► ABORTED (재시도 중 shutdown 감지)
 *    └─► FAILED  (치명적 오류)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ListenerState {

    /**
     * 생성됨 (아직 start 호출 안 됨).
     */
    CREATED,

    /**
     * 배치 루프 실행 중.
     */
    RUNNING,

    /**
     * 정상 종료.
     */
    STOPPED,

    /**
     * shutdown 요청으로 재시도 루프가 중단되어 종료.
     */
    ABORTED,

    /**
     * 치명적 오류로 종료.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return STOPPED, ABORTED, FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == STOPPED || this == ABORTED || this == FAILED;
    }
}
