/**
 * 계측(Instrumentation) SPI.
 *
 * <p>Listener의 모든 단계를 scope로 감싸 시작/종료/오류 이벤트를 기록합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.listener.core.instrumentation.Instrumentation} - 계측 sink 인터페이스</li>
 *   <li>{@link com.ryuqq.listener.core.instrumentation.InstrumentationScope} - 작업 하나를 감싸는 scope</li>
 *   <li>{@link com.ryuqq.listener.core.instrumentation.ListenerEvent} - 이벤트 이름</li>
 *   <li>{@link com.ryuqq.listener.core.instrumentation.noop.NoOpInstrumentation} - 아무것도 기록하지 않는 구현</li>
 * </ul>
 *
 * <p>SLF4J 기반 구현은 adapter-runner 모듈의 {@code LoggingInstrumentation}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.listener.core.instrumentation;
