package com.ryuqq.stepflow.adapter.runner;

import com.ryuqq.stepflow.core.step.BranchInput;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * join 한 번에 대한 branch 도착 집계.
 *
 * <p>split이 branch를 만들 때 폭(width)이 정해지며, branch 번호(1..width)별로 도착을 기록합니다.
 * 모든 branch가 끝나면(성공이든 실패든) 한 번만 해제됩니다.</p>
 *
 * <p><strong>해제 규칙:</strong></p>
 * <ul>
 *   <li>모든 branch 성공: branch 번호 순서의 입력 목록으로 정상 완료</li>
 *   <li>하나라도 실패: 가장 먼저 보고된 실패 원인으로 예외 완료</li>
 *   <li>width = 0: 생성 즉시 빈 목록으로 완료</li>
 * </ul>
 *
 * <p>해제는 스레드를 점유하지 않는 {@link CompletableFuture}로 전달됩니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class JoinBarrier {

    private final String joinStep;
    private final int width;
    private final BranchInput[] arrivals;
    private final boolean[] settled;
    private final CompletableFuture<List<BranchInput>> released = new CompletableFuture<>();
    private int remaining;
    private Throwable failure;

    /**
     * 생성자.
     *
     * @param joinStep join step 이름
     * @param width 기다릴 branch 수 (0 이상)
     * @throws IllegalArgumentException joinStep이 비어있거나 width가 음수인 경우
     */
    public JoinBarrier(String joinStep, int width) {
        if (joinStep == null || joinStep.isBlank()) {
            throw new IllegalArgumentException("joinStep cannot be null or blank");
        }
        if (width < 0) {
            throw new IllegalArgumentException("width must be non-negative (current: " + width + ")");
        }
        this.joinStep = joinStep;
        this.width = width;
        this.arrivals = new BranchInput[width];
        this.settled = new boolean[width];
        this.remaining = width;
        if (width == 0) {
            released.complete(List.of());
        }
    }

    /**
     * branch 성공 도착.
     *
     * @param input branch 입력 (index가 branch 번호)
     * @throws IllegalArgumentException 범위를 벗어난 번호인 경우
     * @throws IllegalStateException 같은 번호가 이미 끝난 경우
     */
    public void arrive(BranchInput input) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        List<BranchInput> ready = null;
        synchronized (this) {
            int slot = claim(input.index());
            arrivals[slot] = input;
            if (--remaining == 0 && failure == null) {
                ready = List.of(arrivals);
            }
        }
        if (ready != null) {
            released.complete(ready);
        } else {
            completeIfFailedAndDone();
        }
    }

    /**
     * branch 실패 도착.
     *
     * @param index branch 번호
     * @param cause 실패 원인
     * @throws IllegalArgumentException 범위를 벗어난 번호이거나 cause가 null인 경우
     * @throws IllegalStateException 같은 번호가 이미 끝난 경우
     */
    public void fail(int index, Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        synchronized (this) {
            claim(index);
            if (failure == null) {
                failure = cause;
            }
            remaining--;
        }
        completeIfFailedAndDone();
    }

    public CompletableFuture<List<BranchInput>> released() {
        return released;
    }

    public String getJoinStep() {
        return joinStep;
    }

    public int getWidth() {
        return width;
    }

    public synchronized int getRemaining() {
        return remaining;
    }

    private int claim(int index) {
        if (index < 1 || index > width) {
            throw new IllegalArgumentException(
                String.format("branch index %d out of range 1..%d for join %s", index, width, joinStep));
        }
        int slot = index - 1;
        if (settled[slot]) {
            throw new IllegalStateException(
                String.format("branch %d already settled for join %s", index, joinStep));
        }
        settled[slot] = true;
        return slot;
    }

    private void completeIfFailedAndDone() {
        Throwable cause;
        synchronized (this) {
            if (remaining != 0 || failure == null) {
                return;
            }
            cause = failure;
        }
        released.completeExceptionally(cause);
    }

    @Override
    public synchronized String toString() {
        return "JoinBarrier{" + joinStep + ", width=" + width + ", remaining=" + remaining + '}';
    }
}
