package com.ryuqq.listener.core.failure;

/**
 * handler 실패 처리 방식.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailureDisposition {

    /**
     * 같은 메시지를 backoff 후 재시도.
     */
    RETRY,

    /**
     * 재시도하지 않고 Listener 밖으로 치명적 오류로 전파.
     */
    PROPAGATE
}
