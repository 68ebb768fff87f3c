package com.ryuqq.listener.adapter.runner;

import com.ryuqq.listener.core.handler.MessageHandler;

import java.util.function.Supplier;

/**
 * ListenerExecutor가 실행할 Listener 정의 (불변 record).
 *
 * <p>Listener 인스턴스는 1회용이므로 정의만 보관하고, 실행(및 재시작)마다
 * 새 인스턴스를 만듭니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param config Listener 설정
 * @param handlerSupplier handler 팩토리
 * @param maxConcurrency 이 정의로 동시에 띄울 Listener 수 (각자 전용 스레드 사용)
 */
public record ListenerDefinition(
    ListenerConfig config,
    Supplier<? extends MessageHandler> handlerSupplier,
    int maxConcurrency
) {

    /**
     * 동시 실행 1개로 생성.
     *
     * @param config Listener 설정
     * @param handlerSupplier handler 팩토리
     */
    public ListenerDefinition(ListenerConfig config, Supplier<? extends MessageHandler> handlerSupplier) {
        this(config, handlerSupplier, 1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ListenerDefinition {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (handlerSupplier == null) {
            throw new IllegalArgumentException("handlerSupplier cannot be null");
        }
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrency must be positive (current: " + maxConcurrency + ")"
            );
        }
    }
}
