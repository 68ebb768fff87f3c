package com.ryuqq.listener.adapter.runner;

import java.time.Duration;

/**
 * 재시도 backoff 대기 수단.
 *
 * <p>재시도 루프의 유일한 블로킹 지점입니다. 테스트에서는 실제로 잠들지 않고
 * 대기 요청을 기록하거나, 대기 도중 stop을 호출하는 구현을 주입합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * {@link Thread#sleep(long)} 기반 기본 구현.
     */
    Sleeper THREAD_SLEEP = interval -> Thread.sleep(interval.toMillis());

    /**
     * 지정 시간 동안 현재 스레드 블로킹.
     *
     * @param interval 대기 시간
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(Duration interval) throws InterruptedException;
}
