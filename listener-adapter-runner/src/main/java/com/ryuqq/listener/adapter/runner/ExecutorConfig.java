package com.ryuqq.listener.adapter.runner;

/**
 * ListenerExecutor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>restartBackoff: 크래시한 Listener 재시작 대기 정책 (기본 {@link BackoffConfig#BackoffConfig()})</li>
 *   <li>shutdownTimeoutMs: stop 시 워커 스레드 종료 대기 시간 (기본 30000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param restartBackoff 재시작 backoff 설정
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record ExecutorConfig(BackoffConfig restartBackoff, long shutdownTimeoutMs) {

    static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 30000;

    /**
     * 기본 설정 생성자.
     */
    public ExecutorConfig() {
        this(new BackoffConfig(), DEFAULT_SHUTDOWN_TIMEOUT_MS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExecutorConfig {
        if (restartBackoff == null) {
            throw new IllegalArgumentException("restartBackoff cannot be null");
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * restartBackoff만 변경한 새 인스턴스 생성.
     *
     * @param restartBackoff 새로운 재시작 backoff 설정
     * @return 새 ExecutorConfig 인스턴스
     */
    public ExecutorConfig withRestartBackoff(BackoffConfig restartBackoff) {
        return new ExecutorConfig(restartBackoff, this.shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     *
     * @param shutdownTimeoutMs 새로운 종료 대기 시간
     * @return 새 ExecutorConfig 인스턴스
     */
    public ExecutorConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new ExecutorConfig(this.restartBackoff, shutdownTimeoutMs);
    }
}
