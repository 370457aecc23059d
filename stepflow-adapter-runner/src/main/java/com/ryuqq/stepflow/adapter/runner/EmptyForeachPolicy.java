package com.ryuqq.stepflow.adapter.runner;

/**
 * foreach split이 원소 0개를 반환했을 때의 처리 방식.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public enum EmptyForeachPolicy {

    /**
     * branch 없이 join을 바로 실행 (입력 목록이 비어있음).
     */
    JOIN_EMPTY,

    /**
     * split step을 {@link com.ryuqq.stepflow.core.error.EmptyForeachException}으로 실패 처리.
     */
    FAIL
}
