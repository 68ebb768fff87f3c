package com.ryuqq.listener.adapter.kafka;

import com.ryuqq.listener.core.spi.LogClientFactory;
import org.apache.kafka.clients.consumer.KafkaConsumer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Kafka 기반 {@link LogClientFactory} 구현체.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * KafkaClientConfig config = KafkaClientConfig.load();   // listener.properties
 * LogClientFactory clientFactory = new KafkaLogClientFactory(config);
 *
 * Listener listener = new PartitionListener(
 *     new ListenerConfig("orders-group", "orders"),
 *     OrderHandler::new,
 *     clientFactory,
 *     new LoggingInstrumentation()
 * );
 * </pre>
 *
 * <p>컨슈머마다 client.id에 순번 접미사를 붙여 브로커 쪽에서 구분할 수 있게 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class KafkaLogClientFactory implements LogClientFactory {

    private final KafkaConsumerFactory consumerFactory;
    private final Duration pollTimeout;

    /**
     * 생성자 ({@link KafkaConsumer} 사용).
     *
     * @param config Kafka 클라이언트 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public KafkaLogClientFactory(KafkaClientConfig config) {
        this(config, kafkaConsumers(config));
    }

    /**
     * 생성자 (컨슈머 생성 전략 주입).
     *
     * @param config Kafka 클라이언트 설정
     * @param consumerFactory 컨슈머 생성 전략
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public KafkaLogClientFactory(KafkaClientConfig config, KafkaConsumerFactory consumerFactory) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (consumerFactory == null) {
            throw new IllegalArgumentException("consumerFactory cannot be null");
        }
        this.consumerFactory = consumerFactory;
        this.pollTimeout = Duration.ofMillis(config.pollTimeoutMs());
    }

    @Override
    public KafkaLogClient create() {
        return new KafkaLogClient(consumerFactory, pollTimeout);
    }

    private static KafkaConsumerFactory kafkaConsumers(KafkaClientConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        AtomicInteger sequence = new AtomicInteger();
        return groupId -> new KafkaConsumer<>(
            config.consumerProperties(groupId, String.valueOf(sequence.incrementAndGet()))
        );
    }
}
