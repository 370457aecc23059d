package com.ryuqq.stepflow.application.flow;

import com.ryuqq.stepflow.core.model.RunId;
import com.ryuqq.stepflow.core.outcome.RunOutcome;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 제출된 Run의 핸들.
 *
 * <p>결과 Future는 항상 {@link RunOutcome}으로 정상 완료됩니다. step 실패도
 * {@link com.ryuqq.stepflow.core.outcome.Failed}로 전달되므로 예외적 완료는 실행기 결함입니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class RunHandle {

    private final RunId runId;
    private final CompletableFuture<RunOutcome> outcome;

    private RunHandle(RunId runId, CompletableFuture<RunOutcome> outcome) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        this.runId = runId;
        this.outcome = outcome;
    }

    public static RunHandle of(RunId runId, CompletableFuture<RunOutcome> outcome) {
        return new RunHandle(runId, outcome);
    }

    public RunId getRunId() {
        return runId;
    }

    public boolean isDone() {
        return outcome.isDone();
    }

    public CompletableFuture<RunOutcome> toFuture() {
        return outcome;
    }

    /**
     * 완료까지 대기.
     *
     * @return Run 결과
     * @throws IllegalStateException 대기 중 인터럽트되었거나 실행기가 예외로 완료한 경우
     */
    public RunOutcome await() {
        try {
            return outcome.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for run " + runId.getValue(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId.getValue() + " completed abnormally", e.getCause());
        }
    }

    /**
     * 제한 시간 동안만 대기.
     *
     * @param timeout 대기 시간
     * @param unit 시간 단위
     * @return 완료되었으면 결과, 시간 초과면 empty
     * @throws IllegalStateException 대기 중 인터럽트되었거나 실행기가 예외로 완료한 경우
     */
    public Optional<RunOutcome> await(long timeout, TimeUnit unit) {
        try {
            return Optional.of(outcome.get(timeout, unit));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for run " + runId.getValue(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId.getValue() + " completed abnormally", e.getCause());
        }
    }

    @Override
    public String toString() {
        return "RunHandle{" + runId.getValue() + ", done=" + outcome.isDone() + '}';
    }
}
