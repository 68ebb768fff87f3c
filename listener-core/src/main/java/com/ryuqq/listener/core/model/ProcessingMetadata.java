package com.ryuqq.listener.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 메시지 한 건의 처리 메타데이터.
 *
 * <p>메시지의 첫 시도 전에 새로 생성되고, 해당 메시지의 처리 시도가 끝나면
 * (성공 또는 중단) 더 이상 사용되지 않습니다.</p>
 *
 * <p><strong>가변성:</strong> retryCount만 변경 가능하며 단조 증가합니다 (0, 1, 2, ...).
 * 인스턴스는 복사되지 않으므로 증가된 값은 다음 시도의 계측에 그대로 보입니다.</p>
 *
 * <p><strong>스레드 모델:</strong> 한 메시지의 재시도 체인이 독점 소유합니다.
 * 여러 스레드에서 공유하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ProcessingMetadata {

    private final String key;
    private final int partition;
    private final long offset;
    private final ListenerIdentity identity;
    private int retryCount;

    private ProcessingMetadata(String key, int partition, long offset, ListenerIdentity identity) {
        this.key = key;
        this.partition = partition;
        this.offset = offset;
        this.identity = identity;
        this.retryCount = 0;
    }

    /**
     * 메시지에 대한 새 메타데이터 생성 (retryCount = 0).
     *
     * @param message 처리할 메시지
     * @param identity Listener 식별 정보
     * @return 새 ProcessingMetadata
     * @throws IllegalArgumentException message 또는 identity가 null인 경우
     */
    public static ProcessingMetadata forMessage(Message message, ListenerIdentity identity) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        return new ProcessingMetadata(message.key(), message.partition(), message.offset(), identity);
    }

    /**
     * 재시도 횟수 1 증가.
     *
     * @return 증가된 재시도 횟수
     */
    public int incrementRetryCount() {
        retryCount++;
        return retryCount;
    }

    public String getKey() {
        return key;
    }

    public int getPartition() {
        return partition;
    }

    public long getOffset() {
        return offset;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public ListenerIdentity getIdentity() {
        return identity;
    }

    /**
     * 계측 메타데이터 형태로 변환 (현재 시점 스냅샷).
     *
     * <p>키 순서: key, partition, offset, retry_count, listener_id, group_id, topic</p>
     *
     * @return 변경 가능한 새 Map
     */
    public Map<String, Object> asMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("key", key);
        metadata.put("partition", partition);
        metadata.put("offset", offset);
        metadata.put("retry_count", retryCount);
        metadata.putAll(identity.asMetadata());
        return metadata;
    }

    @Override
    public String toString() {
        return "ProcessingMetadata{key=" + key
            + ", partition=" + partition
            + ", offset=" + offset
            + ", retryCount=" + retryCount
            + ", listenerId=" + identity.listenerId() + '}';
    }
}
