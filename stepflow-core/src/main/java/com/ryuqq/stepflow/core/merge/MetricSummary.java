package com.ryuqq.stepflow.core.merge;

/**
 * branch별 스칼라 값을 하나로 합친 결과.
 *
 * @param value 대표값 (평균, 중앙값, 최댓값 등)
 * @param spread 퍼짐 정도 (정책이 정의하지 않으면 0.0)
 * @param count 합친 값의 개수
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record MetricSummary(
    double value,
    double spread,
    int count
) {

    public MetricSummary {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative (current: " + count + ")");
        }
    }

    /**
     * 값이 하나도 없을 때의 결과 (value, spread 모두 NaN).
     *
     * @return 빈 요약
     */
    public static MetricSummary empty() {
        return new MetricSummary(Double.NaN, Double.NaN, 0);
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
