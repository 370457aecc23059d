package com.ryuqq.stepflow.adapter.runner;

/**
 * RetryingStepInvoker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 첫 시도를 포함한 최대 시도 횟수 (기본 3)</li>
 *   <li>baseDelayMs: 첫 재시도 대기 시간 (기본 100ms)</li>
 *   <li>maxDelayMs: 재시도 대기 상한 (기본 10000ms)</li>
 *   <li>jitterFactor: jitter 비율 (기본 0.1)</li>
 * </ul>
 *
 * @author Stepflow Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상, 1이면 재시도 없음)
 * @param baseDelayMs 기본 지연 (밀리초, 양수)
 * @param maxDelayMs 최대 지연 (밀리초, baseDelayMs 이상)
 * @param jitterFactor jitter 비율 (0.0 ~ 1.0)
 */
public record RetryConfig(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, baseDelayMs=100ms, maxDelayMs=10000ms, jitterFactor=0.1</p>
     */
    public RetryConfig() {
        this(3, 100, 10000, 0.1);
    }

    public RetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryConfig withBaseDelayMs(long baseDelayMs) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryConfig withMaxDelayMs(long maxDelayMs) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryConfig withJitterFactor(double jitterFactor) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }
}
