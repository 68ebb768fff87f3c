package com.ryuqq.listener.core.instrumentation;

/**
 * 계측 이벤트 이름.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ListenerEvent {

    LISTENER_START("listener.start"),
    LISTENER_STOP("listener.stop"),
    PROCESS_BATCH("listener.process_batch"),
    PROCESS_MESSAGE("listener.process_message"),
    RETRY_HANDLER_ERROR("listener.retry_handler_error"),
    RETRY_ABORTED("listener.retry_aborted"),
    EXECUTOR_START("executor.start"),
    EXECUTOR_STOP("executor.stop");

    private final String eventName;

    ListenerEvent(String eventName) {
        this.eventName = eventName;
    }

    /**
     * 외부에 노출되는 이벤트 이름 조회.
     *
     * @return 이벤트 이름 (예: "listener.process_message")
     */
    public String eventName() {
        return eventName;
    }

    @Override
    public String toString() {
        return eventName;
    }
}
