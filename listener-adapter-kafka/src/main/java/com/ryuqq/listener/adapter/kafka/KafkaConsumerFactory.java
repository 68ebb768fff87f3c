package com.ryuqq.listener.adapter.kafka;

import org.apache.kafka.clients.consumer.Consumer;

/**
 * 컨슈머 그룹별 Kafka {@link Consumer} 생성 전략.
 *
 * <p>기본 구현은 {@link KafkaClientConfig#consumerProperties(String, String)}로
 * {@code KafkaConsumer}를 만들며, 테스트에서는 {@code MockConsumer}를 반환하도록 교체합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface KafkaConsumerFactory {

    /**
     * 컨슈머 생성.
     *
     * @param groupId 컨슈머 그룹 ID
     * @return 새 컨슈머 (호출자가 close 책임)
     */
    Consumer<String, String> create(String groupId);
}
