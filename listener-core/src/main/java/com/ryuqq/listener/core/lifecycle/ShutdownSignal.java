package com.ryuqq.listener.core.lifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Listener 인스턴스별 종료 신호 (cancellation token).
 *
 * <p>stop을 호출하는 스레드가 {@link #request()}로 설정하고, 처리 스레드의 재시도 루프가
 * backoff 직후 {@link #isRequested()}로 읽습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>한 번 true가 되면 다시 false로 돌아가지 않음</li>
 *   <li>Listener 인스턴스마다 독립된 신호 (전역 상태 아님)</li>
 *   <li>AtomicBoolean 기반으로 쓰기가 처리 스레드에 즉시 보임</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ShutdownSignal {

    private final AtomicBoolean requested = new AtomicBoolean(false);

    /**
     * 종료 요청.
     *
     * @return 이번 호출로 처음 요청된 경우 true, 이미 요청된 상태였으면 false
     */
    public boolean request() {
        return requested.compareAndSet(false, true);
    }

    /**
     * 종료 요청 여부 확인.
     *
     * @return 요청된 경우 true
     */
    public boolean isRequested() {
        return requested.get();
    }

    @Override
    public String toString() {
        return "ShutdownSignal{requested=" + requested.get() + '}';
    }
}
