package com.ryuqq.listener.adapter.kafka;

import com.ryuqq.listener.core.model.Batch;
import com.ryuqq.listener.core.model.Message;
import com.ryuqq.listener.core.spi.BatchCallback;
import com.ryuqq.listener.core.spi.LogConsumer;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kafka 기반 {@link LogConsumer} 구현체.
 *
 * <p><strong>poll 루프:</strong></p>
 * <pre>
 * while (running):
 *   records = consumer.poll(pollTimeout)
 *   for each partition in records:
 *     callback.onBatch(Batch)           ← 파티션 단위 배치 (오프셋 순서)
 *     commitSync(partition → lastOffset + 1)
 * </pre>
 *
 * <p><strong>종료:</strong> 최초 {@link #stop()}은 running을 내리고 {@code wakeup()}으로
 * 진행 중인 poll을 깨웁니다. 이후 호출은 아무 동작도 하지 않습니다. 현재 배치의 callback이 끝나면 루프를 빠져나옵니다.</p>
 *
 * <p><strong>스레드 모델:</strong> KafkaConsumer는 스레드 안전하지 않으므로
 * poll 중에는 polling 스레드가 루프 종료 시 직접 close합니다.
 * poll이 시작되지 않은 컨슈머는 {@link #release()}가 즉시 close합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class KafkaLogConsumer implements LogConsumer {

    private static final Logger log = LoggerFactory.getLogger(KafkaLogConsumer.class);

    private final Consumer<String, String> consumer;
    private final String groupId;
    private final Duration pollTimeout;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicBoolean polling = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile String topic;

    /**
     * 생성자.
     *
     * @param consumer Kafka 컨슈머 (이 객체가 close 책임을 가짐)
     * @param groupId 컨슈머 그룹 ID
     * @param pollTimeout poll 대기 시간
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public KafkaLogConsumer(Consumer<String, String> consumer, String groupId, Duration pollTimeout) {
        if (consumer == null) {
            throw new IllegalArgumentException("consumer cannot be null");
        }
        if (groupId == null || groupId.isBlank()) {
            throw new IllegalArgumentException("groupId cannot be null or blank");
        }
        if (pollTimeout == null || pollTimeout.isNegative()) {
            throw new IllegalArgumentException("pollTimeout cannot be null or negative");
        }
        this.consumer = consumer;
        this.groupId = groupId;
        this.pollTimeout = pollTimeout;
    }

    @Override
    public void subscribe(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        this.topic = topic;
        consumer.subscribe(List.of(topic), new LoggingRebalanceListener());
        log.info("Subscribed to {} (group={})", topic, groupId);
    }

    @Override
    public void eachBatch(BatchCallback callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        if (topic == null) {
            throw new IllegalStateException("subscribe must be called before eachBatch");
        }
        if (!polling.compareAndSet(false, true)) {
            throw new IllegalStateException("eachBatch is already running");
        }

        try {
            while (running.get()) {
                ConsumerRecords<String, String> records;
                try {
                    records = consumer.poll(pollTimeout);
                } catch (WakeupException e) {
                    if (!running.get()) {
                        break;
                    }
                    continue;
                }

                for (TopicPartition partition : records.partitions()) {
                    if (!running.get()) {
                        break;
                    }
                    Batch batch = toBatch(partition, records.records(partition));
                    callback.onBatch(batch);
                    commit(partition, batch.lastOffset() + 1);
                }
            }
        } finally {
            polling.set(false);
            closeConsumer();
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping consumer of {} (group={})", topic, groupId);
            // wakeup은 최초 stop에서 한 번만. 커밋 재시도가 다시 깨워지면 안 됨
            if (!closed.get()) {
                consumer.wakeup();
            }
        }
    }

    /**
     * 컨슈머 해제.
     *
     * <p>poll 루프가 실행 중이면 종료를 요청하고 close는 polling 스레드에 맡깁니다.
     * 그렇지 않으면 호출 스레드에서 즉시 close합니다.</p>
     */
    void release() {
        stop();
        if (!polling.get()) {
            closeConsumer();
        }
    }

    /**
     * 컨슈머가 close되었는지 확인.
     *
     * @return close된 경우 true
     */
    public boolean isClosed() {
        return closed.get();
    }

    private Batch toBatch(TopicPartition partition, List<ConsumerRecord<String, String>> records) {
        List<Message> messages = new ArrayList<>(records.size());
        for (ConsumerRecord<String, String> record : records) {
            messages.add(Message.of(record.key(), record.value(), record.offset(), record.partition()));
        }

        long lastOffset = records.get(records.size() - 1).offset();
        OptionalLong lag = consumer.currentLag(partition);
        long offsetLag = lag.isPresent() ? Math.max(0L, lag.getAsLong()) : 0L;
        return new Batch(partition.topic(), partition.partition(), messages, offsetLag, lastOffset + 1 + offsetLag);
    }

    private void commit(TopicPartition partition, long nextOffset) {
        Map<TopicPartition, OffsetAndMetadata> offsets = Map.of(partition, new OffsetAndMetadata(nextOffset));
        try {
            consumer.commitSync(offsets);
        } catch (WakeupException e) {
            // stop()의 wakeup이 커밋에 걸린 경우. wakeup은 1회성이므로 재시도는 깨워지지 않음
            consumer.commitSync(offsets);
        }
        log.debug("Committed {} → {}", partition, nextOffset);
    }

    private void closeConsumer() {
        if (closed.compareAndSet(false, true)) {
            consumer.close();
            log.info("Consumer of {} closed (group={})", topic, groupId);
        }
    }

    private final class LoggingRebalanceListener implements ConsumerRebalanceListener {

        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            log.info("Revoked: {} (group={})", partitions, groupId);
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            log.info("Assigned: {} (group={})", partitions, groupId);
        }
    }
}
