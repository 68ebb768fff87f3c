package com.ryuqq.listener.application.listener;

import com.ryuqq.listener.core.model.ListenerIdentity;
import com.ryuqq.listener.core.statemachine.ListenerState;

/**
 * 토픽/컨슈머 그룹 단위 메시지 Listener.
 *
 * <p>구독을 열고, 배치 루프를 끝까지(또는 중단될 때까지) 구동하며,
 * start/stop 제어를 노출합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Listener listener = new PartitionListener(config, OrderHandler::new, clientFactory, instrumentation);
 *
 * Thread worker = new Thread(listener::start, "listener-" + listener.id());
 * worker.start();
 *
 * // SIGTERM 수신 등
 * listener.stop();
 * worker.join();
 * </pre>
 *
 * <p><strong>스레드 모델:</strong></p>
 * <ul>
 *   <li>start(): 처리 스레드를 종료 시점까지 블로킹 (재진입 불가, 인스턴스당 1회)</li>
 *   <li>stop(): 다른 스레드에서 언제든 호출 가능, 멱등</li>
 *   <li>식별자 조회: 생성 후 불변이므로 스레드 안전</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Listener {

    /**
     * 구독 후 배치 루프 실행.
     *
     * <p>배치 소스가 종료되면 STOPPED, 재시도 중 shutdown이 감지되면 ABORTED로
     * 정상 반환합니다. ABORTED는 오류로 취급하지 않습니다.</p>
     *
     * @throws IllegalStateException 이미 start된 (또는 종료된) 인스턴스인 경우
     * @throws RuntimeException 로그 클라이언트 연결/구독 실패 시 (재시도하지 않음)
     */
    void start();

    /**
     * 종료 요청.
     *
     * <p>종료 신호를 설정하고, 컨슈머 폴링 중단을 요청한 뒤 클라이언트 연결을 해제합니다.
     * 두 번째 호출부터는 아무 동작도 하지 않습니다.</p>
     *
     * @throws RuntimeException 로그 클라이언트 해제 실패 시
     */
    void stop();

    /**
     * Listener 식별 정보 조회.
     *
     * @return 식별 정보
     */
    ListenerIdentity identity();

    /**
     * 현재 생명주기 상태 조회.
     *
     * @return 상태
     */
    ListenerState state();

    /**
     * Listener 인스턴스 토큰 조회.
     *
     * @return listenerId
     */
    default String id() {
        return identity().listenerId();
    }

    /**
     * 컨슈머 그룹 ID 조회.
     *
     * @return groupId
     */
    default String groupId() {
        return identity().groupId();
    }

    /**
     * 토픽 조회.
     *
     * @return topic
     */
    default String topic() {
        return identity().topic();
    }
}
