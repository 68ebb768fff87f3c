package com.ryuqq.listener.adapter.runner;

/**
 * PartitionListener 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>groupId: 컨슈머 그룹 ID (필수)</li>
 *   <li>topic: 구독할 토픽 (필수)</li>
 *   <li>backoff: handler 실패 시 재시도 대기 정책 설정 (기본 {@link BackoffConfig#BackoffConfig()})</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param groupId 컨슈머 그룹 ID
 * @param topic 토픽 이름
 * @param backoff backoff 설정
 */
public record ListenerConfig(String groupId, String topic, BackoffConfig backoff) {

    /**
     * 기본 backoff로 생성.
     *
     * @param groupId 컨슈머 그룹 ID
     * @param topic 토픽 이름
     */
    public ListenerConfig(String groupId, String topic) {
        this(groupId, topic, new BackoffConfig());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ListenerConfig {
        if (groupId == null || groupId.isBlank()) {
            throw new IllegalArgumentException("groupId cannot be null or blank");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
    }

    /**
     * groupId만 변경한 새 인스턴스 생성.
     */
    public ListenerConfig withGroupId(String groupId) {
        return new ListenerConfig(groupId, topic, backoff);
    }

    /**
     * topic만 변경한 새 인스턴스 생성.
     */
    public ListenerConfig withTopic(String topic) {
        return new ListenerConfig(groupId, topic, backoff);
    }

    /**
     * backoff만 변경한 새 인스턴스 생성.
     */
    public ListenerConfig withBackoff(BackoffConfig backoff) {
        return new ListenerConfig(groupId, topic, backoff);
    }
}
