package com.ryuqq.listener.core.failure;

import com.ryuqq.listener.core.model.ProcessingMetadata;

/**
 * shutdown 요청으로 재시도 루프가 중단되었음을 알리는 제어 신호.
 *
 * <p>사용자에게 보이는 오류가 아닙니다. 배치 처리기와 로그 클라이언트의 배치 루프를
 * 그대로 통과하여 Listener 경계에서 단 한 번 잡히고, 정상 종료(ABORTED)로 변환됩니다.</p>
 *
 * <p>스택 트레이스는 수집하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryAbortedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ProcessingMetadata metadata;

    /**
     * 생성자.
     *
     * @param metadata 중단 시점의 처리 메타데이터
     */
    public RetryAbortedException(ProcessingMetadata metadata) {
        super("Retry loop aborted at " + metadata, null, false, false);
        this.metadata = metadata;
    }

    /**
     * 중단 시점의 처리 메타데이터 조회.
     *
     * @return 처리 메타데이터
     */
    public ProcessingMetadata getMetadata() {
        return metadata;
    }
}
