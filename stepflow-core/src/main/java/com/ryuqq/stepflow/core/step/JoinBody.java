package com.ryuqq.stepflow.core.step;

/**
 * join step의 병합 로직.
 *
 * <p>대응하는 split의 모든 branch가 성공한 뒤 한 번만 호출됩니다.
 * {@link JoinContext}로 branch별 Artifact를 받아, join 이후에 보일 Artifact를
 * 명시적으로 골라 {@link StepResult}로 반환합니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface JoinBody {

    /**
     * join 실행.
     *
     * @param context branch 입력과 병합 도구
     * @return join 이후 보일 Artifact
     * @throws Exception 병합 실패
     */
    StepResult execute(JoinContext context) throws Exception;
}
