package com.ryuqq.listener.adapter.kafka;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Kafka 클라이언트 설정 (불변 record).
 *
 * <p><strong>설정 항목 (properties 키 → 기본값):</strong></p>
 * <ul>
 *   <li>kafka.bootstrap.servers → localhost:9092</li>
 *   <li>kafka.client.id → listener</li>
 *   <li>kafka.auto.offset.reset → earliest</li>
 *   <li>kafka.max.poll.records → 500</li>
 *   <li>kafka.poll.timeout.ms → 250</li>
 *   <li>kafka.session.timeout.ms, kafka.max.poll.interval.ms, kafka.fetch.min.bytes, kafka.fetch.max.wait.ms → 설정 시에만 전달</li>
 * </ul>
 *
 * <p>같은 키의 System property가 있으면 properties 파일 값보다 우선합니다.
 * 오프셋 자동 커밋은 항상 비활성화됩니다 (배치 처리 후 수동 커밋).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param bootstrapServers 브로커 주소 목록
 * @param clientId 클라이언트 ID 접두사
 * @param autoOffsetReset 커밋된 오프셋이 없을 때의 시작 위치 (earliest, latest, none)
 * @param maxPollRecords poll 1회당 최대 레코드 수
 * @param pollTimeoutMs poll 대기 시간 (밀리초)
 * @param overrides 추가 컨슈머 설정 (ConsumerConfig 키 기준)
 */
public record KafkaClientConfig(
    String bootstrapServers,
    String clientId,
    String autoOffsetReset,
    int maxPollRecords,
    long pollTimeoutMs,
    Map<String, String> overrides
) {

    /**
     * 클래스패스에서 읽는 기본 설정 파일 이름.
     */
    public static final String DEFAULT_RESOURCE = "listener.properties";

    static final String DEFAULT_BOOTSTRAP_SERVERS = "localhost:9092";
    static final String DEFAULT_CLIENT_ID = "listener";
    static final String DEFAULT_AUTO_OFFSET_RESET = "earliest";
    static final int DEFAULT_MAX_POLL_RECORDS = 500;
    static final long DEFAULT_POLL_TIMEOUT_MS = 250;

    private static final Logger log = LoggerFactory.getLogger(KafkaClientConfig.class);

    private static final Map<String, String> OPTIONAL_KEYS = Map.of(
        "kafka.session.timeout.ms", ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG,
        "kafka.max.poll.interval.ms", ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG,
        "kafka.fetch.min.bytes", ConsumerConfig.FETCH_MIN_BYTES_CONFIG,
        "kafka.fetch.max.wait.ms", ConsumerConfig.FETCH_MAX_WAIT_MS_CONFIG
    );

    /**
     * 기본 설정 생성자.
     */
    public KafkaClientConfig() {
        this(
            DEFAULT_BOOTSTRAP_SERVERS,
            DEFAULT_CLIENT_ID,
            DEFAULT_AUTO_OFFSET_RESET,
            DEFAULT_MAX_POLL_RECORDS,
            DEFAULT_POLL_TIMEOUT_MS,
            Map.of()
        );
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public KafkaClientConfig {
        if (bootstrapServers == null || bootstrapServers.isBlank()) {
            throw new IllegalArgumentException("bootstrapServers cannot be null or blank");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId cannot be null or blank");
        }
        if (!"earliest".equals(autoOffsetReset) && !"latest".equals(autoOffsetReset) && !"none".equals(autoOffsetReset)) {
            throw new IllegalArgumentException(
                "autoOffsetReset must be one of earliest, latest, none (current: " + autoOffsetReset + ")"
            );
        }
        if (maxPollRecords <= 0) {
            throw new IllegalArgumentException(
                "maxPollRecords must be positive (current: " + maxPollRecords + ")"
            );
        }
        if (pollTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "pollTimeoutMs must be positive (current: " + pollTimeoutMs + ")"
            );
        }
        overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
    }

    /**
     * Properties로부터 생성.
     *
     * @param properties 설정 값 (kafka.* 키)
     * @return 새 KafkaClientConfig
     * @throws IllegalArgumentException properties가 null이거나 값이 유효하지 않은 경우
     */
    public static KafkaClientConfig from(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }

        Map<String, String> overrides = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : OPTIONAL_KEYS.entrySet()) {
            String value = get(properties, entry.getKey(), null);
            if (value != null) {
                overrides.put(entry.getValue(), value);
            }
        }

        KafkaClientConfig config = new KafkaClientConfig(
            get(properties, "kafka.bootstrap.servers", DEFAULT_BOOTSTRAP_SERVERS),
            get(properties, "kafka.client.id", DEFAULT_CLIENT_ID),
            get(properties, "kafka.auto.offset.reset", DEFAULT_AUTO_OFFSET_RESET),
            parseInt(get(properties, "kafka.max.poll.records", String.valueOf(DEFAULT_MAX_POLL_RECORDS)), "kafka.max.poll.records"),
            parseLong(get(properties, "kafka.poll.timeout.ms", String.valueOf(DEFAULT_POLL_TIMEOUT_MS)), "kafka.poll.timeout.ms"),
            overrides
        );
        log.info("Kafka client config bootstrap={} clientId={} autoOffsetReset={} maxPollRecords={} pollTimeoutMs={} overrides={}",
            config.bootstrapServers(), config.clientId(), config.autoOffsetReset(),
            config.maxPollRecords(), config.pollTimeoutMs(), config.overrides());
        return config;
    }

    /**
     * 클래스패스의 {@value #DEFAULT_RESOURCE}로부터 생성 (파일이 없으면 기본값).
     *
     * @return 새 KafkaClientConfig
     * @throws UncheckedIOException 파일을 읽을 수 없는 경우
     */
    public static KafkaClientConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * 클래스패스 리소스로부터 생성 (리소스가 없으면 기본값).
     *
     * @param resource 리소스 이름
     * @return 새 KafkaClientConfig
     * @throws UncheckedIOException 리소스를 읽을 수 없는 경우
     */
    public static KafkaClientConfig load(String resource) {
        Properties properties = new Properties();
        try (InputStream is = KafkaClientConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                properties.load(is);
            } else {
                log.warn("{} not found on classpath, using defaults", resource);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + resource, e);
        }
        return from(properties);
    }

    /**
     * 컨슈머 그룹용 KafkaConsumer 설정 생성.
     *
     * @param groupId 컨슈머 그룹 ID
     * @param clientIdSuffix 클라이언트 ID 접미사 (null이면 접두사만 사용)
     * @return KafkaConsumer 생성자에 전달할 Properties
     */
    public Properties consumerProperties(String groupId, String clientIdSuffix) {
        Properties p = new Properties();
        p.setProperty(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        p.setProperty(ConsumerConfig.CLIENT_ID_CONFIG, clientIdSuffix == null ? clientId : clientId + "-" + clientIdSuffix);
        p.setProperty(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        p.setProperty(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        p.setProperty(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        p.setProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, autoOffsetReset);
        p.setProperty(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, String.valueOf(maxPollRecords));
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            p.setProperty(entry.getKey(), entry.getValue());
        }
        p.setProperty(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        return p;
    }

    /**
     * bootstrapServers만 변경한 새 인스턴스 생성.
     */
    public KafkaClientConfig withBootstrapServers(String bootstrapServers) {
        return new KafkaClientConfig(bootstrapServers, clientId, autoOffsetReset, maxPollRecords, pollTimeoutMs, overrides);
    }

    /**
     * pollTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public KafkaClientConfig withPollTimeoutMs(long pollTimeoutMs) {
        return new KafkaClientConfig(bootstrapServers, clientId, autoOffsetReset, maxPollRecords, pollTimeoutMs, overrides);
    }

    private static String get(Properties properties, String key, String defaultValue) {
        String system = trimToNull(System.getProperty(key));
        if (system != null) {
            return system;
        }
        String value = trimToNull(properties.getProperty(key));
        return value != null ? value : defaultValue;
    }

    private static int parseInt(String value, String key) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + value + ")", e);
        }
    }

    private static long parseLong(String value, String key) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + value + ")", e);
        }
    }

    private static String trimToNull(String s) {
        if (s == null) {
            return null;
        }
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
