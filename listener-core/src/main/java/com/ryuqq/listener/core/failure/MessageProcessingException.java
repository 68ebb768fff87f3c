package com.ryuqq.listener.core.failure;

import com.ryuqq.listener.core.model.ProcessingMetadata;

/**
 * {@link FailureClassifier}가 치명적이라고 분류한 handler 실패.
 *
 * <p>Listener 밖으로 전파되어 {@code start()} 호출자에게 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MessageProcessingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ProcessingMetadata metadata;

    /**
     * 생성자.
     *
     * @param metadata 실패 시점의 처리 메타데이터
     * @param cause handler가 던진 원인
     */
    public MessageProcessingException(ProcessingMetadata metadata, Throwable cause) {
        super("Unrecoverable failure processing " + metadata, cause);
        this.metadata = metadata;
    }

    public ProcessingMetadata getMetadata() {
        return metadata;
    }
}
