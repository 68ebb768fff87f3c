package com.ryuqq.listener.core.handler;

import com.ryuqq.listener.core.model.ProcessingMetadata;

/**
 * 사용자 메시지 처리 SPI.
 *
 * <p>Listener는 {@code start()} 시점에 이 인터페이스의 인스턴스를 하나 생성하고,
 * 배치 내 메시지마다 순서대로 {@link #consume(String, ProcessingMetadata)}를 호출합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>정상 반환 = 처리 성공</li>
 *   <li>예외 발생 = 처리 실패 → 동일 메시지를 backoff 후 재시도</li>
 *   <li>At-least-once: 같은 메시지가 여러 번 전달될 수 있으므로 멱등하게 구현해야 함</li>
 *   <li>무한히 반환하지 않는 구현은 shutdown을 무기한 막음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * MessageHandler handler = (payload, metadata) -> {
 *     if (metadata.getRetryCount() > 0) {
 *         log.warn("retrying offset {}", metadata.getOffset());
 *     }
 *     orderService.apply(payload);
 * };
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * 메시지 한 건 처리.
     *
     * @param payload 메시지 본문 (null 가능)
     * @param metadata 처리 메타데이터 (retryCount 포함)
     * @throws Exception 처리 실패 시 (종류와 관계없이 재시도 대상)
     */
    void consume(String payload, ProcessingMetadata metadata) throws Exception;
}
