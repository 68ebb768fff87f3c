package com.ryuqq.listener.adapter.runner;

import com.ryuqq.listener.core.backoff.BackoffPolicy;
import com.ryuqq.listener.core.failure.FailureClassifier;
import com.ryuqq.listener.core.failure.FailureDisposition;
import com.ryuqq.listener.core.failure.MessageProcessingException;
import com.ryuqq.listener.core.failure.RetryAbortedException;
import com.ryuqq.listener.core.handler.MessageHandler;
import com.ryuqq.listener.core.instrumentation.Instrumentation;
import com.ryuqq.listener.core.instrumentation.InstrumentationScope;
import com.ryuqq.listener.core.instrumentation.ListenerEvent;
import com.ryuqq.listener.core.lifecycle.ShutdownSignal;
import com.ryuqq.listener.core.model.Message;
import com.ryuqq.listener.core.model.ProcessingMetadata;
import com.ryuqq.listener.core.statemachine.RetryState;
import com.ryuqq.listener.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 메시지 한 건의 재시도 상태 머신.
 *
 * <p>handler가 성공할 때까지 같은 메시지를 무기한 재시도합니다.
 * 재시도를 멈추는 유일한 방법은 종료 신호이며, 이 경우 메시지를 건너뛰지 않고
 * {@link RetryAbortedException}으로 Listener 전체를 중단시킵니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * ATTEMPTING ──(성공)──► SUCCEEDED
 *     │
 *     └─(실패)─► FAILED ──(분류: RETRY)──► BACKING_OFF
 *                  │                          │
 *                  │                          ├─(신호 없음)─► ATTEMPTING (retryCount + 1)
 *                  │                          └─(신호 있음)─► ABORTED → RetryAbortedException
 *                  └─(분류: PROPAGATE)─► MessageProcessingException
 * </pre>
 *
 * <p><strong>BACKING_OFF 상세:</strong></p>
 * <ol>
 *   <li>interval = backoffPolicy.intervalAt(retryCount)</li>
 *   <li>retry_handler_error 이벤트 시작 (예외 정보 + 대기 시간 + 처리 메타데이터)</li>
 *   <li>ERROR 로그 후 interval 동안 sleep (코어 전체의 유일한 블로킹 지점)</li>
 *   <li>retryCount 증가 (메타데이터를 제자리에서 변경)</li>
 *   <li>이벤트 종료 후 종료 신호 확인</li>
 * </ol>
 *
 * <p>sleep 중 인터럽트가 발생하면 인터럽트 플래그를 복원하고 종료 요청으로 취급합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MessageRetryLoop {

    private static final Logger log = LoggerFactory.getLogger(MessageRetryLoop.class);

    private final BackoffPolicy backoffPolicy;
    private final ShutdownSignal shutdownSignal;
    private final Instrumentation instrumentation;
    private final Sleeper sleeper;
    private final FailureClassifier failureClassifier;

    /**
     * 생성자.
     *
     * @param backoffPolicy 재시도 대기 정책
     * @param shutdownSignal Listener의 종료 신호
     * @param instrumentation 계측 sink
     * @param sleeper backoff 대기 수단
     * @param failureClassifier 실패 분류기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MessageRetryLoop(
        BackoffPolicy backoffPolicy,
        ShutdownSignal shutdownSignal,
        Instrumentation instrumentation,
        Sleeper sleeper,
        FailureClassifier failureClassifier
    ) {
        if (backoffPolicy == null) {
            throw new IllegalArgumentException("backoffPolicy cannot be null");
        }
        if (shutdownSignal == null) {
            throw new IllegalArgumentException("shutdownSignal cannot be null");
        }
        if (instrumentation == null) {
            throw new IllegalArgumentException("instrumentation cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (failureClassifier == null) {
            throw new IllegalArgumentException("failureClassifier cannot be null");
        }

        this.backoffPolicy = backoffPolicy;
        this.shutdownSignal = shutdownSignal;
        this.instrumentation = instrumentation;
        this.sleeper = sleeper;
        this.failureClassifier = failureClassifier;
    }

    /**
     * 메시지를 성공할 때까지 처리.
     *
     * @param handler 메시지 handler
     * @param message 처리할 메시지
     * @param metadata 이 메시지 전용 처리 메타데이터 (retryCount가 제자리에서 증가함)
     * @return 항상 {@link RetryState#SUCCEEDED}
     * @throws RetryAbortedException backoff 직후 종료 신호가 감지된 경우
     * @throws MessageProcessingException 분류기가 실패를 PROPAGATE로 분류한 경우
     */
    public RetryState run(MessageHandler handler, Message message, ProcessingMetadata metadata) {
        RetryState state = RetryState.ATTEMPTING;
        Throwable failure = null;

        while (!state.isTerminal()) {
            RetryState next = switch (state) {
                case ATTEMPTING -> {
                    failure = attempt(handler, message, metadata);
                    yield failure == null ? RetryState.SUCCEEDED : RetryState.FAILED;
                }
                case FAILED -> classify(failure, metadata);
                case BACKING_OFF -> backOff(failure, metadata);
                case SUCCEEDED, ABORTED -> throw new IllegalStateException("Retry loop already finished: " + state);
            };
            state = StateTransition.transition(state, next);
        }

        if (state == RetryState.ABORTED) {
            throw new RetryAbortedException(metadata);
        }
        return state;
    }

    /**
     * handler 1회 호출.
     *
     * @return 실패 원인, 성공 시 null
     */
    private Throwable attempt(MessageHandler handler, Message message, ProcessingMetadata metadata) {
        try (InstrumentationScope scope = instrumentation.begin(ListenerEvent.PROCESS_MESSAGE, metadata.asMetadata())) {
            try {
                handler.consume(message.value(), metadata);
                return null;
            } catch (Throwable failure) {
                if (failure instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                scope.fail(failure);
                return failure;
            }
        }
    }

    private RetryState classify(Throwable failure, ProcessingMetadata metadata) {
        FailureDisposition disposition = failureClassifier.classify(failure, metadata);
        if (disposition == FailureDisposition.PROPAGATE) {
            log.error("Unrecoverable error processing message, propagating {}", metadata.asMetadata(), failure);
            throw new MessageProcessingException(metadata, failure);
        }
        return RetryState.BACKING_OFF;
    }

    private RetryState backOff(Throwable failure, ProcessingMetadata metadata) {
        Duration interval = backoffPolicy.intervalAt(metadata.getRetryCount());
        Map<String, Object> errorMetadata = errorMetadata(failure, interval, metadata);
        boolean interrupted = false;

        try (InstrumentationScope scope = instrumentation.begin(ListenerEvent.RETRY_HANDLER_ERROR, errorMetadata)) {
            log.error("error processing message, waiting {}ms {}", interval.toMillis(), metadata.asMetadata(), failure);
            try {
                sleeper.sleep(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scope.fail(e);
                interrupted = true;
            }
            metadata.incrementRetryCount();
        }

        if (interrupted) {
            log.warn("Backoff interrupted, treating as shutdown request {}", metadata.asMetadata());
            return RetryState.ABORTED;
        }
        return shutdownSignal.isRequested() ? RetryState.ABORTED : RetryState.ATTEMPTING;
    }

    private static Map<String, Object> errorMetadata(Throwable failure, Duration interval, ProcessingMetadata metadata) {
        List<String> backtrace = new ArrayList<>();
        for (StackTraceElement element : failure.getStackTrace()) {
            backtrace.add(element.toString());
        }

        Map<String, Object> error = new LinkedHashMap<>();
        error.put("exception_class", failure.getClass().getName());
        error.put("exception_message", failure.getMessage());
        error.put("backtrace", backtrace);
        error.put("waiting_time_ms", interval.toMillis());
        error.putAll(metadata.asMetadata());
        return error;
    }
}
