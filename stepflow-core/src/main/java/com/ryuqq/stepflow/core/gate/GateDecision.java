package com.ryuqq.stepflow.core.gate;

/**
 * 임계값 게이트 판정 결과.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public enum GateDecision {

    /**
     * 지표가 임계값 이상이어서 동작을 실행함.
     */
    PUBLISHED,

    /**
     * 지표가 임계값 미만(또는 NaN)이어서 동작을 건너뜀. 오류가 아님.
     */
    SKIPPED;

    public boolean isPublished() {
        return this == PUBLISHED;
    }
}
