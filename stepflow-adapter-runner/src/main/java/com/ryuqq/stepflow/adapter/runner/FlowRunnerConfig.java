package com.ryuqq.stepflow.adapter.runner;

/**
 * ParallelFlowRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: worker 스레드 수 (기본 8). join 대기는 스레드를 점유하지 않으므로
 *       branch 수보다 작아도 교착되지 않음</li>
 *   <li>emptyForeachPolicy: 빈 foreach 처리 (기본 JOIN_EMPTY)</li>
 *   <li>shutdownTimeoutMs: shutdown 시 진행 중인 step 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * @author Stepflow Team
 * @since 1.0.0
 * @param concurrency worker 스레드 수 (1 이상이어야 함)
 * @param emptyForeachPolicy 빈 foreach 처리 방식
 * @param shutdownTimeoutMs shutdown 대기 시간 (밀리초, 양수여야 함)
 */
public record FlowRunnerConfig(
    int concurrency,
    EmptyForeachPolicy emptyForeachPolicy,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=8, emptyForeachPolicy=JOIN_EMPTY, shutdownTimeoutMs=60000ms</p>
     */
    public FlowRunnerConfig() {
        this(8, EmptyForeachPolicy.JOIN_EMPTY, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FlowRunnerConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (emptyForeachPolicy == null) {
            throw new IllegalArgumentException("emptyForeachPolicy cannot be null");
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public FlowRunnerConfig withConcurrency(int concurrency) {
        return new FlowRunnerConfig(concurrency, emptyForeachPolicy, shutdownTimeoutMs);
    }

    public FlowRunnerConfig withEmptyForeachPolicy(EmptyForeachPolicy emptyForeachPolicy) {
        return new FlowRunnerConfig(concurrency, emptyForeachPolicy, shutdownTimeoutMs);
    }

    public FlowRunnerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new FlowRunnerConfig(concurrency, emptyForeachPolicy, shutdownTimeoutMs);
    }
}
