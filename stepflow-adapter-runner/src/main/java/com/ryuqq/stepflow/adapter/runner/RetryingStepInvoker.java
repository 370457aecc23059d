package com.ryuqq.stepflow.adapter.runner;

import com.ryuqq.stepflow.core.error.StepflowException;
import com.ryuqq.stepflow.core.graph.StepDefinition;
import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.spi.StepInvoker;
import com.ryuqq.stepflow.core.step.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * 실패한 step body를 backoff 후 재시도하는 StepInvoker.
 *
 * <p><strong>재시도 규칙:</strong></p>
 * <ul>
 *   <li>최대 {@link RetryConfig#maxAttempts()}번 시도, 마지막 예외를 그대로 전파</li>
 *   <li>{@link StepflowException}(병합 충돌, 빈 foreach 등)은 결정적 오류이므로 재시도하지 않음</li>
 *   <li>대기는 {@link BackoffCalculator}가 계산, 대기 중에는 worker 스레드를 점유</li>
 * </ul>
 *
 * <p>body는 재시도해도 안전해야 합니다 (Artifact는 성공한 시도의 결과만 기록됨).</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class RetryingStepInvoker implements StepInvoker {

    private static final Logger log = LoggerFactory.getLogger(RetryingStepInvoker.class);

    private final RetryConfig config;
    private final BackoffCalculator backoffCalculator;
    private final Predicate<Exception> retryable;
    private final Sleeper sleeper;

    public RetryingStepInvoker(RetryConfig config) {
        this(config, new BackoffCalculator(config), e -> !(e instanceof StepflowException), Thread::sleep);
    }

    /**
     * 생성자 (재시도 판정, 대기 방식 주입).
     *
     * @param config 재시도 설정
     * @param backoffCalculator 백오프 계산기
     * @param retryable 재시도할 예외 판정
     * @param sleeper 대기 방식
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryingStepInvoker(RetryConfig config, BackoffCalculator backoffCalculator,
                               Predicate<Exception> retryable, Sleeper sleeper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (retryable == null) {
            throw new IllegalArgumentException("retryable cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.config = config;
        this.backoffCalculator = backoffCalculator;
        this.retryable = retryable;
        this.sleeper = sleeper;
    }

    @Override
    public StepResult invoke(StepDefinition step, BranchPath branchPath, Callable<StepResult> call) throws Exception {
        int attempt = 1;
        while (true) {
            try {
                return call.call();
            } catch (Exception e) {
                if (attempt >= config.maxAttempts() || !retryable.test(e)) {
                    throw e;
                }
                long delay = backoffCalculator.calculate(attempt);
                log.warn("Step {} at {} failed (attempt {}/{}), retrying in {}ms: {}",
                    step.name(), branchPath, attempt, config.maxAttempts(), delay, e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(interrupted);
                    throw e;
                }
                attempt++;
            }
        }
    }

    /**
     * 재시도 대기.
     */
    @FunctionalInterface
    public interface Sleeper {

        void sleep(long millis) throws InterruptedException;
    }
}
