package com.ryuqq.stepflow.core.error;

/**
 * 실패 원인 분류.
 *
 * <p>실패한 Run은 최초 원인이 된 오류의 종류를 이 값으로 보고합니다.
 * 모든 종류는 Run에 치명적이며 코어는 재시도하지 않습니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 그래프 구조 결함 (빌드 시점).
     */
    GRAPH,

    /**
     * 외부 의존성 초기화 실패 (step 실행 전).
     */
    RUN_INITIALIZATION,

    /**
     * step body 실행 중 예외.
     */
    STEP_EXECUTION,

    /**
     * foreach가 원소를 만들지 않았고 정책이 FAIL인 경우.
     */
    EMPTY_FOREACH,

    /**
     * join에서 해소되지 않은 같은 이름의 서로 다른 값.
     */
    MERGE_CONFLICT
}
