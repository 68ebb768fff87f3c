package com.ryuqq.listener.adapter.runner;

import com.ryuqq.listener.application.listener.Listener;
import com.ryuqq.listener.core.backoff.BackoffPolicy;
import com.ryuqq.listener.core.instrumentation.Instrumentation;
import com.ryuqq.listener.core.instrumentation.InstrumentationScope;
import com.ryuqq.listener.core.instrumentation.ListenerEvent;
import com.ryuqq.listener.core.spi.LogClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * 여러 Listener를 전용 스레드에서 실행하고, 크래시한 Listener를 재시작하는 실행기.
 *
 * <p><strong>감독 루프 (Listener 슬롯마다):</strong></p>
 * <pre>
 * while (stop 전):
 *   1. 정의로부터 새 Listener 생성
 *   2. listener.start() (종료될 때까지 블로킹)
 *   3. 정상 반환 (STOPPED/ABORTED) → 슬롯 종료
 *      예외 (생성 실패 또는 FAILED) → restartBackoff.intervalAt(연속 크래시 수) 만큼 대기 후 1로
 * </pre>
 *
 * <p>재시작 대기는 stop()이 호출되면 즉시 깨어납니다.</p>
 *
 * <p><strong>종료:</strong> stop()은 살아있는 모든 Listener에 stop을 전달한 뒤
 * shutdownTimeoutMs 동안 워커 스레드 종료를 기다리고, 시간 초과 시 인터럽트합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ListenerExecutor {

    private static final Logger log = LoggerFactory.getLogger(ListenerExecutor.class);

    private final List<ListenerDefinition> definitions;
    private final Function<ListenerDefinition, ? extends Listener> listenerFactory;
    private final Instrumentation instrumentation;
    private final ExecutorConfig config;
    private final BackoffPolicy restartBackoff;
    private final ExecutorService workers;

    private final Set<Listener> activeListeners = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch stopLatch = new CountDownLatch(1);

    /**
     * 생성자 ({@link PartitionListener} 사용).
     *
     * @param definitions 실행할 Listener 정의 목록
     * @param clientFactory 로그 클라이언트 팩토리 (모든 Listener가 공유)
     * @param instrumentation 계측 sink (모든 Listener가 공유)
     * @param config 실행기 설정
     * @throws IllegalArgumentException 의존성이 null이거나 정의 목록이 비어있는 경우
     */
    public ListenerExecutor(
        List<ListenerDefinition> definitions,
        LogClientFactory clientFactory,
        Instrumentation instrumentation,
        ExecutorConfig config
    ) {
        this(definitions, partitionListeners(clientFactory, instrumentation), instrumentation, config);
    }

    /**
     * 생성자 (Listener 팩토리 주입).
     *
     * @param definitions 실행할 Listener 정의 목록
     * @param listenerFactory 정의로부터 새 Listener 인스턴스를 만드는 팩토리
     * @param instrumentation 계측 sink
     * @param config 실행기 설정
     * @throws IllegalArgumentException 의존성이 null이거나 정의 목록이 비어있는 경우
     */
    public ListenerExecutor(
        List<ListenerDefinition> definitions,
        Function<ListenerDefinition, ? extends Listener> listenerFactory,
        Instrumentation instrumentation,
        ExecutorConfig config
    ) {
        if (definitions == null || definitions.isEmpty()) {
            throw new IllegalArgumentException("definitions cannot be null or empty");
        }
        if (listenerFactory == null) {
            throw new IllegalArgumentException("listenerFactory cannot be null");
        }
        if (instrumentation == null) {
            throw new IllegalArgumentException("instrumentation cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.definitions = List.copyOf(definitions);
        this.listenerFactory = listenerFactory;
        this.instrumentation = instrumentation;
        this.config = config;
        this.restartBackoff = ExponentialBackoffPolicy.from(config.restartBackoff());
        this.workers = Executors.newFixedThreadPool(totalConcurrency(this.definitions));
    }

    /**
     * 모든 Listener 슬롯 실행 시작 (비블로킹).
     *
     * @throws IllegalStateException 이미 시작되었거나 종료된 경우
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("ListenerExecutor already stopped");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("ListenerExecutor already started");
        }

        Map<String, Object> metadata = metadata();
        try (InstrumentationScope ignored = instrumentation.begin(ListenerEvent.EXECUTOR_START, metadata)) {
            for (ListenerDefinition definition : definitions) {
                for (int slot = 0; slot < definition.maxConcurrency(); slot++) {
                    workers.submit(() -> supervise(definition));
                }
            }
            log.info("ListenerExecutor started {}", metadata);
        }
    }

    /**
     * 모든 Listener 종료 및 워커 스레드 정리.
     *
     * <p>두 번째 호출부터는 아무 동작도 하지 않습니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void stop() throws InterruptedException {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        stopLatch.countDown();

        Map<String, Object> metadata = metadata();
        try (InstrumentationScope scope = instrumentation.begin(ListenerEvent.EXECUTOR_STOP, metadata)) {
            log.info("ListenerExecutor stopping {}", metadata);
            for (Listener listener : activeListeners) {
                stopListener(listener);
            }

            workers.shutdown();
            if (!workers.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Listeners did not finish within {}ms, interrupting", config.shutdownTimeoutMs());
                scope.fail(new IllegalStateException("Shutdown timed out after " + config.shutdownTimeoutMs() + "ms"));
                workers.shutdownNow();
            }
        }
    }

    /**
     * 현재 실행 중인 Listener 수 조회.
     *
     * @return 실행 중인 Listener 수
     */
    public int activeListenerCount() {
        return activeListeners.size();
    }

    /**
     * stop 호출 여부 확인.
     *
     * @return stop이 호출된 경우 true
     */
    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * Listener 슬롯 감독 루프.
     *
     * <p>Listener 생성 실패도 크래시로 보고 같은 backoff로 재시도합니다.
     * 루프 밖으로 빠져나가는 예외(Error 등)는 슬롯 종료 전에 기록합니다.</p>
     *
     * @param definition 실행할 Listener 정의
     */
    private void supervise(ListenerDefinition definition) {
        try {
            runSlot(definition);
        } catch (Throwable t) {
            log.error("Listener slot terminated unexpectedly {}", slotMetadata(definition), t);
            throw t;
        }
    }

    private void runSlot(ListenerDefinition definition) {
        int crashes = 0;
        while (!stopped.get()) {
            Listener listener = null;
            try {
                listener = listenerFactory.apply(definition);
                activeListeners.add(listener);
                // stop()이 activeListeners를 순회한 뒤에 등록된 경우
                if (stopped.get()) {
                    listener.stop();
                }
                listener.start();
                log.info("Listener exited with state {} {}", listener.state(), listener.identity().asMetadata());
                return;
            } catch (RuntimeException e) {
                Duration interval = restartBackoff.intervalAt(crashes++);
                Map<String, Object> metadata = listener != null
                    ? listener.identity().asMetadata()
                    : slotMetadata(definition);
                log.error("listener crashed, waiting {}ms {}", interval.toMillis(), metadata, e);
                if (!awaitRestart(interval)) {
                    return;
                }
            } finally {
                if (listener != null) {
                    activeListeners.remove(listener);
                }
            }
        }
    }

    /**
     * 재시작 대기.
     *
     * @return 재시작해야 하면 true, 대기 중 stop이 호출되었거나 인터럽트되면 false
     */
    private boolean awaitRestart(Duration interval) {
        try {
            return !stopLatch.await(interval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * 개별 Listener 종료.
     *
     * <p>예외 발생 시에도 계속 진행하여 다른 Listener의 종료를 방해하지 않습니다.</p>
     */
    private void stopListener(Listener listener) {
        try {
            listener.stop();
        } catch (RuntimeException e) {
            log.error("Failed to stop listener {}", listener.identity().asMetadata(), e);
        }
    }

    private static Map<String, Object> slotMetadata(ListenerDefinition definition) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("group_id", definition.config().groupId());
        metadata.put("topic", definition.config().topic());
        return metadata;
    }

    private Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("listeners", definitions.size());
        metadata.put("threads", totalConcurrency(definitions));
        return metadata;
    }

    private static int totalConcurrency(List<ListenerDefinition> definitions) {
        int total = 0;
        for (ListenerDefinition definition : definitions) {
            total += definition.maxConcurrency();
        }
        return total;
    }

    private static Function<ListenerDefinition, PartitionListener> partitionListeners(
        LogClientFactory clientFactory,
        Instrumentation instrumentation
    ) {
        if (clientFactory == null) {
            throw new IllegalArgumentException("clientFactory cannot be null");
        }
        if (instrumentation == null) {
            throw new IllegalArgumentException("instrumentation cannot be null");
        }
        return definition -> new PartitionListener(
            definition.config(),
            definition.handlerSupplier(),
            clientFactory,
            instrumentation
        );
    }
}
