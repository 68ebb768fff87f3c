package com.ryuqq.listener.core.instrumentation;

/**
 * 계측 대상 작업 하나를 감싸는 scope.
 *
 * <p>{@link Instrumentation#begin}이 시작 이벤트를 기록하고,
 * {@link #close()}가 모든 종료 경로에서 종료 이벤트(소요 시간 포함)를 기록합니다.
 * 작업이 실패했다면 close 전에 {@link #fail(Throwable)}을 호출합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (InstrumentationScope scope = instrumentation.begin(ListenerEvent.PROCESS_MESSAGE, metadata)) {
 *     try {
 *         handler.consume(payload, processingMetadata);
 *     } catch (Exception e) {
 *         scope.fail(e);
 *         throw e;
 *     }
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface InstrumentationScope extends AutoCloseable {

    /**
     * 작업 실패 기록.
     *
     * @param error 발생한 실패
     */
    void fail(Throwable error);

    /**
     * 종료 이벤트 기록. 예외를 던지지 않습니다.
     */
    @Override
    void close();
}
