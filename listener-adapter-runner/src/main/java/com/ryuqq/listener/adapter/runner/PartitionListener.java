package com.ryuqq.listener.adapter.runner;

import com.ryuqq.listener.application.listener.Listener;
import com.ryuqq.listener.core.backoff.BackoffPolicy;
import com.ryuqq.listener.core.failure.FailureClassifier;
import com.ryuqq.listener.core.failure.RetryAbortedException;
import com.ryuqq.listener.core.handler.MessageHandler;
import com.ryuqq.listener.core.instrumentation.Instrumentation;
import com.ryuqq.listener.core.instrumentation.InstrumentationScope;
import com.ryuqq.listener.core.instrumentation.ListenerEvent;
import com.ryuqq.listener.core.lifecycle.ShutdownSignal;
import com.ryuqq.listener.core.model.Batch;
import com.ryuqq.listener.core.model.ListenerIdentity;
import com.ryuqq.listener.core.spi.LogClient;
import com.ryuqq.listener.core.spi.LogClientFactory;
import com.ryuqq.listener.core.spi.LogConsumer;
import com.ryuqq.listener.core.statemachine.ListenerState;
import com.ryuqq.listener.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 토픽/컨슈머 그룹 단위 Listener 구현체.
 *
 * <p>로그 클라이언트를 열어 토픽을 구독하고, 배치 루프가 끝날 때까지 처리 스레드를 점유합니다.
 * 메시지 실패는 {@link MessageRetryLoop}가 처리하며, 재시도 중 종료 신호가 감지되면
 * 배치 루프 전체가 중단됩니다.</p>
 *
 * <p><strong>start() 흐름:</strong></p>
 * <pre>
 * CREATED → RUNNING
 *   ↓
 * [listener.start] 클라이언트 생성 → handler 생성 → 컨슈머 생성 → subscribe
 *   ↓
 * consumer.eachBatch(batch → [listener.process_batch] BatchProcessor.process)
 *   ↓
 * - 배치 소스 종료          → STOPPED
 * - RetryAbortedException   → [listener.retry_aborted] → ABORTED (정상 반환)
 * - 그 외 예외              → FAILED (예외 재전파)
 *   ↓
 * 클라이언트 해제 (모든 경로에서 정확히 1회)
 * </pre>
 *
 * <p><strong>stop() 흐름 (다른 스레드에서 호출):</strong></p>
 * <pre>
 * 종료 신호 설정 → [listener.stop] 컨슈머 폴링 중단 요청 → 클라이언트 해제
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>상태는 AtomicReference로 관리, 종료 상태 전이는 처리 스레드만 수행</li>
 *   <li>client/consumer 필드는 lifecycleLock으로 보호 (start의 구독 단계와 stop이 경합)</li>
 *   <li>진행 중인 handler 호출이나 backoff sleep은 선점하지 않음 (다음 backoff 직후 종료)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PartitionListener implements Listener {

    private static final Logger log = LoggerFactory.getLogger(PartitionListener.class);

    private final ListenerIdentity identity;
    private final Supplier<? extends MessageHandler> handlerSupplier;
    private final LogClientFactory clientFactory;
    private final Instrumentation instrumentation;
    private final ShutdownSignal shutdownSignal;
    private final BatchProcessor batchProcessor;

    private final AtomicReference<ListenerState> state = new AtomicReference<>(ListenerState.CREATED);
    private final AtomicBoolean stopInvoked = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private LogClient client;
    private LogConsumer consumer;
    private boolean clientReleased;
    private MessageHandler handler;

    /**
     * 생성자 (기본 backoff/sleep/실패 분류 사용).
     *
     * @param config Listener 설정
     * @param handlerSupplier handler 팩토리 (start마다 1회 호출)
     * @param clientFactory 로그 클라이언트 팩토리
     * @param instrumentation 계측 sink
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PartitionListener(
        ListenerConfig config,
        Supplier<? extends MessageHandler> handlerSupplier,
        LogClientFactory clientFactory,
        Instrumentation instrumentation
    ) {
        this(
            config,
            handlerSupplier,
            clientFactory,
            instrumentation,
            config == null ? null : ExponentialBackoffPolicy.from(config.backoff()),
            Sleeper.THREAD_SLEEP,
            FailureClassifier.RETRY_ALL
        );
    }

    /**
     * 생성자 (backoff 정책, sleep, 실패 분류 주입).
     *
     * @param config Listener 설정
     * @param handlerSupplier handler 팩토리 (start마다 1회 호출)
     * @param clientFactory 로그 클라이언트 팩토리
     * @param instrumentation 계측 sink
     * @param backoffPolicy 재시도 대기 정책 (config.backoff 대신 사용)
     * @param sleeper backoff 대기 수단
     * @param failureClassifier 실패 분류기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PartitionListener(
        ListenerConfig config,
        Supplier<? extends MessageHandler> handlerSupplier,
        LogClientFactory clientFactory,
        Instrumentation instrumentation,
        BackoffPolicy backoffPolicy,
        Sleeper sleeper,
        FailureClassifier failureClassifier
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (handlerSupplier == null) {
            throw new IllegalArgumentException("handlerSupplier cannot be null");
        }
        if (clientFactory == null) {
            throw new IllegalArgumentException("clientFactory cannot be null");
        }
        if (instrumentation == null) {
            throw new IllegalArgumentException("instrumentation cannot be null");
        }

        this.identity = ListenerIdentity.generate(config.groupId(), config.topic());
        this.handlerSupplier = handlerSupplier;
        this.clientFactory = clientFactory;
        this.instrumentation = instrumentation;
        this.shutdownSignal = new ShutdownSignal();
        this.batchProcessor = new BatchProcessor(
            identity,
            new MessageRetryLoop(backoffPolicy, shutdownSignal, instrumentation, sleeper, failureClassifier)
        );
    }

    @Override
    public void start() {
        ListenerState previous = state.getAndUpdate(current ->
            current == ListenerState.CREATED ? ListenerState.RUNNING : current);
        if (previous != ListenerState.CREATED) {
            if (previous == ListenerState.STOPPED && stopInvoked.get()) {
                log.info("Listener stopped before start, skipping {}", identity.asMetadata());
                return;
            }
            throw new IllegalStateException(
                "Listener can only be started once (current: " + previous + ")"
            );
        }

        LogConsumer subscribed;
        try {
            subscribed = subscribe();
        } catch (RuntimeException e) {
            try {
                releaseClient();
            } finally {
                finish(ListenerState.FAILED);
            }
            throw e;
        }

        ListenerState outcome = ListenerState.FAILED;
        try {
            if (subscribed != null) {
                subscribed.eachBatch(this::processBatch);
            }
            outcome = ListenerState.STOPPED;
        } catch (RetryAbortedException e) {
            recordAbort(e);
            outcome = ListenerState.ABORTED;
        } finally {
            try {
                releaseClient();
            } finally {
                finish(outcome);
            }
        }
    }

    @Override
    public void stop() {
        if (!stopInvoked.compareAndSet(false, true)) {
            log.debug("Listener already stopping {}", identity.asMetadata());
            return;
        }

        shutdownSignal.request();

        if (state.compareAndSet(ListenerState.CREATED, ListenerState.STOPPED)) {
            log.info("Listener stopped before start {}", identity.asMetadata());
            return;
        }

        try (InstrumentationScope scope = instrumentation.begin(ListenerEvent.LISTENER_STOP, identity.asMetadata())) {
            try {
                log.info("Listener stopping {}", identity.asMetadata());
                synchronized (lifecycleLock) {
                    if (consumer != null) {
                        consumer.stop();
                    }
                    releaseClient();
                }
            } catch (RuntimeException e) {
                scope.fail(e);
                throw e;
            }
        }
    }

    @Override
    public ListenerIdentity identity() {
        return identity;
    }

    @Override
    public ListenerState state() {
        return state.get();
    }

    /**
     * 클라이언트/handler/컨슈머 생성 후 구독.
     *
     * @return 구독된 컨슈머, 구독 전에 stop이 먼저 호출된 경우 null
     */
    private LogConsumer subscribe() {
        try (InstrumentationScope scope = instrumentation.begin(ListenerEvent.LISTENER_START, identity.asMetadata())) {
            try {
                synchronized (lifecycleLock) {
                    if (shutdownSignal.isRequested()) {
                        log.info("Shutdown requested before subscribe, skipping {}", identity.asMetadata());
                        return null;
                    }

                    client = clientFactory.create();
                    handler = handlerSupplier.get();
                    if (handler == null) {
                        throw new IllegalStateException("handlerSupplier returned null");
                    }
                    consumer = client.consumer(identity.groupId());
                    consumer.subscribe(identity.topic());
                    log.info("Listener started {}", identity.asMetadata());
                    return consumer;
                }
            } catch (RuntimeException e) {
                scope.fail(e);
                throw e;
            }
        }
    }

    private void processBatch(Batch batch) {
        Map<String, Object> metadata = batch.asMetadata();
        metadata.putAll(identity.asMetadata());

        try (InstrumentationScope scope = instrumentation.begin(ListenerEvent.PROCESS_BATCH, metadata)) {
            try {
                batchProcessor.process(batch, handler);
            } catch (RuntimeException | Error e) {
                scope.fail(e);
                throw e;
            }
        }
    }

    private void recordAbort(RetryAbortedException abort) {
        Map<String, Object> metadata = identity.asMetadata();
        if (abort.getMetadata() != null) {
            metadata.put("offset", abort.getMetadata().getOffset());
            metadata.put("retry_count", abort.getMetadata().getRetryCount());
        }

        try (InstrumentationScope ignored = instrumentation.begin(ListenerEvent.RETRY_ABORTED, metadata)) {
            log.info("Retry loop aborted, listener is shutting down {}", metadata);
        }
    }

    /**
     * 클라이언트 연결 해제 (최대 1회).
     *
     * <p>해제 시도 전에 플래그를 먼저 세우므로 close가 실패해도 두 번째 시도는 없습니다.</p>
     */
    private void releaseClient() {
        synchronized (lifecycleLock) {
            if (client == null || clientReleased) {
                return;
            }
            clientReleased = true;
            client.close();
        }
    }

    private void finish(ListenerState outcome) {
        ListenerState finished = state.updateAndGet(current -> StateTransition.transition(current, outcome));
        log.info("Listener finished with state {} {}", finished, identity.asMetadata());
    }
}
