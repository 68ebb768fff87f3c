package com.ryuqq.listener.adapter.kafka;

import com.ryuqq.listener.core.spi.LogClient;
import com.ryuqq.listener.core.spi.LogConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kafka 기반 {@link LogClient} 구현체.
 *
 * <p>Kafka에는 컨슈머와 분리된 연결 객체가 없으므로, 이 클라이언트는 자신이 만든
 * 컨슈머들의 수명을 묶는 역할을 합니다. {@link #close()}는 모든 컨슈머를 해제합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class KafkaLogClient implements LogClient {

    private static final Logger log = LoggerFactory.getLogger(KafkaLogClient.class);

    private final KafkaConsumerFactory consumerFactory;
    private final Duration pollTimeout;
    private final List<KafkaLogConsumer> consumers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * 생성자.
     *
     * @param consumerFactory Kafka 컨슈머 생성 전략
     * @param pollTimeout poll 대기 시간
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public KafkaLogClient(KafkaConsumerFactory consumerFactory, Duration pollTimeout) {
        if (consumerFactory == null) {
            throw new IllegalArgumentException("consumerFactory cannot be null");
        }
        if (pollTimeout == null) {
            throw new IllegalArgumentException("pollTimeout cannot be null");
        }
        this.consumerFactory = consumerFactory;
        this.pollTimeout = pollTimeout;
    }

    @Override
    public LogConsumer consumer(String groupId) {
        if (groupId == null || groupId.isBlank()) {
            throw new IllegalArgumentException("groupId cannot be null or blank");
        }
        if (closed.get()) {
            throw new IllegalStateException("Client already closed");
        }
        KafkaLogConsumer consumer = new KafkaLogConsumer(consumerFactory.create(groupId), groupId, pollTimeout);
        consumers.add(consumer);
        return consumer;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (KafkaLogConsumer consumer : consumers) {
            consumer.release();
        }
        log.info("Kafka client closed ({} consumers released)", consumers.size());
    }

    /**
     * close 호출 여부 확인.
     *
     * @return close된 경우 true
     */
    public boolean isClosed() {
        return closed.get();
    }
}
