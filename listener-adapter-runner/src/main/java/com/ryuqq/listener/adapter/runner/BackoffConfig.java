package com.ryuqq.listener.adapter.runner;

/**
 * Backoff 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>minMs: 첫 재시도 대기 시간 (기본 1000ms)</li>
 *   <li>maxMs: 최대 대기 시간 (기본 60000ms)</li>
 *   <li>jitterFactor: Jitter 비율 0.0 ~ 1.0 (기본 0.0)</li>
 * </ul>
 *
 * <p>런타임 중 변경은 지원하지 않습니다. 변경하려면 새 Listener를 생성합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param minMs 최소 대기 시간 (밀리초, 양수여야 함)
 * @param maxMs 최대 대기 시간 (밀리초, minMs 이상이어야 함)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 */
public record BackoffConfig(long minMs, long maxMs, double jitterFactor) {

    static final long DEFAULT_MIN_MS = 1000;
    static final long DEFAULT_MAX_MS = 60000;
    static final double DEFAULT_JITTER_FACTOR = 0.0;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: minMs=1000ms, maxMs=60000ms, jitterFactor=0.0</p>
     */
    public BackoffConfig() {
        this(DEFAULT_MIN_MS, DEFAULT_MAX_MS, DEFAULT_JITTER_FACTOR);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffConfig {
        if (minMs <= 0) {
            throw new IllegalArgumentException(
                "minMs must be positive (current: " + minMs + ")"
            );
        }
        if (maxMs < minMs) {
            throw new IllegalArgumentException(
                "maxMs must be >= minMs (min: " + minMs + ", max: " + maxMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * minMs만 변경한 새 인스턴스 생성.
     *
     * @param minMs 새로운 최소 대기 시간
     * @return 새 BackoffConfig 인스턴스
     */
    public BackoffConfig withMinMs(long minMs) {
        return new BackoffConfig(minMs, this.maxMs, this.jitterFactor);
    }

    /**
     * maxMs만 변경한 새 인스턴스 생성.
     *
     * @param maxMs 새로운 최대 대기 시간
     * @return 새 BackoffConfig 인스턴스
     */
    public BackoffConfig withMaxMs(long maxMs) {
        return new BackoffConfig(this.minMs, maxMs, this.jitterFactor);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     *
     * @param jitterFactor 새로운 Jitter 비율
     * @return 새 BackoffConfig 인스턴스
     */
    public BackoffConfig withJitterFactor(double jitterFactor) {
        return new BackoffConfig(this.minMs, this.maxMs, jitterFactor);
    }
}
