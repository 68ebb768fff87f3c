package com.ryuqq.listener.core.model;

/**
 * 파티션 로그에서 읽어 온 단일 메시지 (불변 record).
 *
 * <p>로그 클라이언트가 소유한 데이터에 대한 읽기 전용 뷰입니다.
 * key와 value는 null일 수 있습니다 (tombstone 등).</p>
 *
 * @param key 메시지 키 (null 허용)
 * @param value 메시지 본문 (null 허용)
 * @param offset 파티션 내 오프셋 (0 이상)
 * @param partition 파티션 번호 (0 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Message(
    String key,
    String value,
    long offset,
    int partition
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException offset 또는 partition이 음수인 경우
     */
    public Message {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative (current: " + offset + ")");
        }
        if (partition < 0) {
            throw new IllegalArgumentException("partition must be non-negative (current: " + partition + ")");
        }
    }

    /**
     * Message 생성.
     *
     * @param key 메시지 키
     * @param value 메시지 본문
     * @param offset 오프셋
     * @param partition 파티션 번호
     * @return 생성된 Message
     */
    public static Message of(String key, String value, long offset, int partition) {
        return new Message(key, value, offset, partition);
    }
}
