package com.ryuqq.listener.adapter.runner;

import com.ryuqq.listener.core.backoff.BackoffPolicy;

import java.time.Duration;

/**
 * Exponential Backoff with Jitter 정책.
 *
 * <p>재시도 간격을 지수적으로 증가시키되 maxDelay에서 멈춥니다.
 * jitter는 선택 사항이며 여러 Listener가 동시에 재시도하는 것을 분산시킵니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(minDelay * 2^attempt, maxDelay)
 * jitter      = random(0, exponential * jitterFactor)
 * delay       = min(exponential + jitter, maxDelay)
 * </pre>
 *
 * <p><strong>예시 (minDelay=1000ms, maxDelay=60000ms, jitterFactor=0):</strong></p>
 * <ul>
 *   <li>attempt=0: 1000ms</li>
 *   <li>attempt=1: 2000ms</li>
 *   <li>attempt=5: 32000ms</li>
 *   <li>attempt=6 이상: 60000ms (maxDelay)</li>
 * </ul>
 *
 * <p><strong>단조성:</strong> jitterFactor가 1.0 이하이면 jitter를 더한 값도
 * 다음 단계의 exponential(2배)을 넘지 않으므로 {@code intervalAt(n+1) >= intervalAt(n)}이 유지됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {

    private static final int MAX_SHIFT = 62;

    private final long minDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: minDelay=1000ms, maxDelay=60000ms, jitterFactor=0.0</p>
     */
    public ExponentialBackoffPolicy() {
        this(BackoffConfig.DEFAULT_MIN_MS, BackoffConfig.DEFAULT_MAX_MS, BackoffConfig.DEFAULT_JITTER_FACTOR);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param minDelayMs 최소 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, minDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExponentialBackoffPolicy(long minDelayMs, long maxDelayMs, double jitterFactor) {
        if (minDelayMs <= 0) {
            throw new IllegalArgumentException(
                "minDelayMs must be positive (current: " + minDelayMs + ")"
            );
        }
        if (maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= minDelayMs (min: " + minDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.minDelayMs = minDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * BackoffConfig로부터 생성.
     *
     * @param config backoff 설정
     * @return 새 ExponentialBackoffPolicy
     * @throws IllegalArgumentException config가 null인 경우
     */
    public static ExponentialBackoffPolicy from(BackoffConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new ExponentialBackoffPolicy(config.minMs(), config.maxMs(), config.jitterFactor());
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 현재 재시도 횟수 (0부터 시작)
     * @return 재시도 전 대기 시간
     * @throws IllegalArgumentException attempt가 음수인 경우
     */
    @Override
    public Duration intervalAt(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException(
                "attempt must be non-negative (current: " + attempt + ")"
            );
        }

        // 1. 지수적 백오프 (shift overflow 방지)
        long exponential;
        if (attempt > MAX_SHIFT || minDelayMs > (maxDelayMs >> attempt)) {
            exponential = maxDelayMs;
        } else {
            exponential = Math.min(minDelayMs << attempt, maxDelayMs);
        }

        // 2. Jitter 추가 (0 ~ exponential * jitterFactor)
        long jitter = (long) (exponential * jitterFactor * Math.random());

        // 3. 최대값 제한
        return Duration.ofMillis(exponential + Math.min(jitter, maxDelayMs - exponential));
    }

    public long getMinDelayMs() {
        return minDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
