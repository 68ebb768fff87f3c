package com.ryuqq.listener.adapter.runner;

import com.ryuqq.listener.core.failure.MessageProcessingException;
import com.ryuqq.listener.core.failure.RetryAbortedException;
import com.ryuqq.listener.core.handler.MessageHandler;
import com.ryuqq.listener.core.model.Batch;
import com.ryuqq.listener.core.model.ListenerIdentity;
import com.ryuqq.listener.core.model.Message;
import com.ryuqq.listener.core.model.ProcessingMetadata;

/**
 * 배치 처리기.
 *
 * <p>배치의 메시지를 순서대로, 호출 스레드에서 동기적으로 하나씩 handler에 전달합니다.
 * 같은 배치 안에서 handler가 동시에 호출되는 일은 없으며, 이것이 파티션 내 순서 보장의 전제입니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * For each Message (배치 순서대로):
 *   1. ProcessingMetadata 새로 생성 (retryCount = 0)
 *   2. MessageRetryLoop.run() → 성공할 때까지 재시도
 *   3. 다음 메시지로 진행
 * </pre>
 *
 * <p>재시도 루프의 중단 신호({@link RetryAbortedException})는 잡지 않고 그대로 전파합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BatchProcessor {

    private final ListenerIdentity identity;
    private final MessageRetryLoop retryLoop;

    /**
     * 생성자.
     *
     * @param identity Listener 식별 정보 (메타데이터에 첨부)
     * @param retryLoop 메시지 재시도 루프
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BatchProcessor(ListenerIdentity identity, MessageRetryLoop retryLoop) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        if (retryLoop == null) {
            throw new IllegalArgumentException("retryLoop cannot be null");
        }
        this.identity = identity;
        this.retryLoop = retryLoop;
    }

    /**
     * 배치 처리.
     *
     * @param batch 처리할 배치
     * @param handler 메시지 handler
     * @return 처리 완료된 메시지 수 (정상 반환 시 항상 배치 크기)
     * @throws RetryAbortedException 재시도 중 종료 신호가 감지된 경우
     * @throws MessageProcessingException 치명적 실패로 분류된 경우
     */
    public int process(Batch batch, MessageHandler handler) {
        if (batch == null) {
            throw new IllegalArgumentException("batch cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }

        int processed = 0;
        for (Message message : batch.messages()) {
            ProcessingMetadata metadata = ProcessingMetadata.forMessage(message, identity);
            retryLoop.run(handler, message, metadata);
            processed++;
        }
        return processed;
    }
}
