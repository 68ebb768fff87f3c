package com.ryuqq.listener.core.backoff;

import java.time.Duration;

/**
 * 재시도 대기 시간 정책.
 *
 * <p>재시도 횟수(attempt)에 대한 대기 시간을 계산합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>attempt에 대해 단조 비감소: {@code intervalAt(n + 1) >= intervalAt(n)}</li>
 *   <li>부수 효과 없음</li>
 *   <li>0 이상의 모든 정수 입력에 대해 정의됨</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * 재시도 대기 시간 계산.
     *
     * @param attempt 재시도 횟수 (0부터 시작)
     * @return 대기 시간
     * @throws IllegalArgumentException attempt가 음수인 경우
     */
    Duration intervalAt(int attempt);

    /**
     * 고정 간격 정책 생성.
     *
     * @param interval 항상 반환할 대기 시간 (0 이상)
     * @return 고정 간격 BackoffPolicy
     * @throws IllegalArgumentException interval이 null이거나 음수인 경우
     */
    static BackoffPolicy fixed(Duration interval) {
        if (interval == null) {
            throw new IllegalArgumentException("interval cannot be null");
        }
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must be non-negative (current: " + interval + ")");
        }
        return attempt -> {
            if (attempt < 0) {
                throw new IllegalArgumentException("attempt must be non-negative (current: " + attempt + ")");
            }
            return interval;
        };
    }
}
