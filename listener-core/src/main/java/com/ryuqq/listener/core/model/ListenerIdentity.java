package com.ryuqq.listener.core.model;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Listener 식별 정보 (불변 record).
 *
 * <p>Listener 생성 시점에 한 번 만들어지며, 이후 모든 계측 이벤트에
 * 상관관계(correlation) 컨텍스트로 첨부됩니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>listenerId:</strong> 프로세스 내 Listener 인스턴스마다 고유한 짧은 랜덤 토큰 (6자리 hex)</li>
 *   <li><strong>groupId:</strong> 컨슈머 그룹 ID</li>
 *   <li><strong>topic:</strong> 구독할 토픽</li>
 * </ul>
 *
 * @param listenerId Listener 인스턴스 토큰
 * @param groupId 컨슈머 그룹 ID
 * @param topic 토픽 이름
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ListenerIdentity(
    String listenerId,
    String groupId,
    String topic
) {

    private static final int ID_BYTES = 3;
    private static final SecureRandom RANDOM = new SecureRandom();

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 빈 문자열인 경우
     */
    public ListenerIdentity {
        if (listenerId == null || listenerId.isBlank()) {
            throw new IllegalArgumentException("listenerId cannot be null or blank");
        }
        if (groupId == null || groupId.isBlank()) {
            throw new IllegalArgumentException("groupId cannot be null or blank");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
    }

    /**
     * 새 랜덤 listenerId로 식별 정보 생성.
     *
     * @param groupId 컨슈머 그룹 ID
     * @param topic 토픽 이름
     * @return 생성된 ListenerIdentity
     * @throws IllegalArgumentException groupId 또는 topic이 유효하지 않은 경우
     */
    public static ListenerIdentity generate(String groupId, String topic) {
        byte[] bytes = new byte[ID_BYTES];
        RANDOM.nextBytes(bytes);
        return new ListenerIdentity(HexFormat.of().formatHex(bytes), groupId, topic);
    }

    /**
     * 계측 메타데이터 형태로 변환.
     *
     * <p>키 순서: listener_id, group_id, topic</p>
     *
     * @return 변경 가능한 새 Map (호출자가 병합해도 안전)
     */
    public Map<String, Object> asMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("listener_id", listenerId);
        metadata.put("group_id", groupId);
        metadata.put("topic", topic);
        return metadata;
    }
}
