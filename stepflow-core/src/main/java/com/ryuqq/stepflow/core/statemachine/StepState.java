package com.ryuqq.stepflow.core.statemachine;

/**
 * Step 실행(branch 경로 단위) 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING</li>
 *   <li>PENDING → AWAITING_JOIN (join만, 첫 branch 도착)</li>
 *   <li>AWAITING_JOIN → RUNNING (모든 branch 성공)</li>
 *   <li>AWAITING_JOIN → FAILED (branch 실패)</li>
 *   <li>RUNNING → SUCCEEDED / FAILED</li>
 * </ul>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public enum StepState {

    /**
     * 아직 실행 안 됨.
     */
    PENDING,

    /**
     * join이 branch 도착을 기다리는 중.
     */
    AWAITING_JOIN,

    /**
     * body 실행 중.
     */
    RUNNING,

    SUCCEEDED,

    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
