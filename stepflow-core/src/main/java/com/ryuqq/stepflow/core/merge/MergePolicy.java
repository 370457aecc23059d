package com.ryuqq.stepflow.core.merge;

import java.util.List;

/**
 * join에서 branch별 수치 Artifact를 합치는 규칙.
 *
 * <p>구현체는 입력 순서(branch 완료 순서)와 무관하게 같은 결과를 내야 합니다.
 * 기본 구현은 {@link MergePolicies#meanAndStd()} 입니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MergePolicy {

    /**
     * 값 병합.
     *
     * @param values branch별 값 (비어있을 수 있음)
     * @return 병합 결과, 값이 없으면 {@link MetricSummary#empty()}
     */
    MetricSummary merge(List<Double> values);
}
