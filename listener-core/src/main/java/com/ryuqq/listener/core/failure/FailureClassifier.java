package com.ryuqq.listener.core.failure;

import com.ryuqq.listener.core.model.ProcessingMetadata;

/**
 * handler 실패 분류 SPI.
 *
 * <p>기본 동작({@link #RETRY_ALL})은 모든 실패를 재시도 대상으로 취급합니다.
 * 리소스 고갈(Error 계열)도 예외가 아닙니다.</p>
 *
 * <p>{@link FailureDisposition#PROPAGATE}를 반환하면 메시지를 건너뛰지 않고
 * Listener 전체가 FAILED로 종료됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * FailureClassifier classifier = (failure, metadata) ->
 *     failure instanceof VirtualMachineError ? FailureDisposition.PROPAGATE : FailureDisposition.RETRY;
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * 모든 실패를 재시도하는 기본 분류기.
     */
    FailureClassifier RETRY_ALL = (failure, metadata) -> FailureDisposition.RETRY;

    /**
     * 실패 분류.
     *
     * @param failure handler가 던진 실패
     * @param metadata 현재 처리 메타데이터
     * @return 처리 방식
     */
    FailureDisposition classify(Throwable failure, ProcessingMetadata metadata);
}
