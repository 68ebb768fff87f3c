/**
 * Runner Adapter Layer - Listener 구현체.
 *
 * <p>이 패키지는 Listener 인터페이스의 구체적인 구현체와 재시도/backoff 구성 요소를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.listener.adapter.runner.PartitionListener} - 토픽/컨슈머 그룹 단위 Listener</li>
 *   <li>{@link com.ryuqq.listener.adapter.runner.BatchProcessor} - 배치 내 메시지 순차 처리</li>
 *   <li>{@link com.ryuqq.listener.adapter.runner.MessageRetryLoop} - 메시지 단위 재시도 상태 머신</li>
 *   <li>{@link com.ryuqq.listener.adapter.runner.ExponentialBackoffPolicy} - 지수 backoff</li>
 *   <li>{@link com.ryuqq.listener.adapter.runner.LoggingInstrumentation} - SLF4J 계측 sink</li>
 *   <li>{@link com.ryuqq.listener.adapter.runner.ListenerExecutor} - 다중 Listener 실행 및 재시작</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (PartitionListener, ListenerExecutor)
 *   ↓ implements
 * application (Listener interface)
 *   ↓ depends on
 * core (Batch, Message, ProcessingMetadata, ListenerState, RetryState)
 *   ↓ depends on
 * core/spi (LogClientFactory, LogClient, LogConsumer)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.listener.adapter.runner;
