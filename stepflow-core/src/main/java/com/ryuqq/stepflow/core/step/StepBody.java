package com.ryuqq.stepflow.core.step;

/**
 * linear / split step의 도메인 계산 단위.
 *
 * <p>엔진은 body의 내용을 알지 못합니다. body는 상속받은 Artifact의 불변 뷰를
 * {@link StepContext}로 받고, 새로 만든 Artifact와 successor 선택을
 * {@link StepResult}로 반환합니다. 조상의 상태를 직접 변경하지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * StepBody transform = context -&gt; {
 *     Dataset data = context.getArtifact("data", Dataset.class);
 *     return StepResult.next(Artifacts.of("x", transformer.fitTransform(data)));
 * };
 * </pre>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StepBody {

    /**
     * step 실행.
     *
     * @param context 현재 branch의 실행 컨텍스트
     * @return 새 Artifact와 successor 선택
     * @throws Exception 도메인 계산 실패 (엔진이 StepExecutionException으로 감쌉니다)
     */
    StepResult execute(StepContext context) throws Exception;
}
