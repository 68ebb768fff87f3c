/**
 * Listener 인터페이스.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.listener.application.listener.Listener} - 구독 생명주기 및 start/stop 제어</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code PartitionListener}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.listener.application.listener;
