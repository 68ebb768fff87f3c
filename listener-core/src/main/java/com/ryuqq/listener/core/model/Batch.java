package com.ryuqq.listener.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 하나의 파티션에 대한 메시지 배치 (불변 record).
 *
 * <p>로그 클라이언트가 한 번의 iteration 동안 소유하며, Listener는 이를 변경하지 않습니다.
 * 메시지 순서는 로그에서 전달된 순서 그대로 유지됩니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>topic:</strong> 배치가 속한 토픽</li>
 *   <li><strong>partition:</strong> 파티션 번호</li>
 *   <li><strong>messages:</strong> 순서가 보장된 메시지 목록</li>
 *   <li><strong>offsetLag:</strong> 배치 마지막 메시지 이후 남은 메시지 수</li>
 *   <li><strong>highwaterMarkOffset:</strong> 파티션의 highwater mark 오프셋</li>
 * </ul>
 *
 * @param topic 토픽 이름
 * @param partition 파티션 번호
 * @param messages 메시지 목록 (방어적 복사됨)
 * @param offsetLag 오프셋 지연 (0 이상)
 * @param highwaterMarkOffset highwater mark 오프셋 (0 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Batch(
    String topic,
    int partition,
    List<Message> messages,
    long offsetLag,
    long highwaterMarkOffset
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 수치가 음수인 경우
     */
    public Batch {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (partition < 0) {
            throw new IllegalArgumentException("partition must be non-negative (current: " + partition + ")");
        }
        if (messages == null) {
            throw new IllegalArgumentException("messages cannot be null");
        }
        if (offsetLag < 0) {
            throw new IllegalArgumentException("offsetLag must be non-negative (current: " + offsetLag + ")");
        }
        if (highwaterMarkOffset < 0) {
            throw new IllegalArgumentException(
                "highwaterMarkOffset must be non-negative (current: " + highwaterMarkOffset + ")"
            );
        }
        messages = List.copyOf(messages);
    }

    /**
     * 배치 크기 조회.
     *
     * @return 메시지 수
     */
    public int size() {
        return messages.size();
    }

    /**
     * 빈 배치인지 확인.
     *
     * @return 메시지가 없으면 true
     */
    public boolean isEmpty() {
        return messages.isEmpty();
    }

    /**
     * 마지막 메시지의 오프셋 조회.
     *
     * @return 마지막 오프셋, 빈 배치면 -1
     */
    public long lastOffset() {
        return messages.isEmpty() ? -1L : messages.get(messages.size() - 1).offset();
    }

    /**
     * 계측 메타데이터 형태로 변환.
     *
     * <p>키: batch_size, partition, offset_lag, highwater_mark_offset</p>
     *
     * @return 변경 가능한 새 Map
     */
    public Map<String, Object> asMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("batch_size", messages.size());
        metadata.put("partition", partition);
        metadata.put("offset_lag", offsetLag);
        metadata.put("highwater_mark_offset", highwaterMarkOffset);
        return metadata;
    }
}
