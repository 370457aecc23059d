package com.ryuqq.stepflow.core.merge;

import java.util.ArrayList;
import java.util.List;

/**
 * 기본 제공 {@link MergePolicy} 모음.
 *
 * <p>모든 정책은 값을 정렬한 뒤 계산하므로 부동소수점 합산 순서까지 입력 순서와 무관합니다.</p>
 *
 * <ul>
 *   <li>{@link #meanAndStd()}: 산술 평균 + 모표준편차 (기본)</li>
 *   <li>{@link #median()}: 중앙값 (spread = 0)</li>
 *   <li>{@link #max()}: 최댓값 (spread = 0)</li>
 *   <li>{@link #weightedMean(List)}: branch 번호 순서의 가중치를 쓰는 가중 평균</li>
 * </ul>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class MergePolicies {

    private static final MergePolicy MEAN_AND_STD = MergePolicies::computeMeanAndStd;
    private static final MergePolicy MEDIAN = MergePolicies::computeMedian;
    private static final MergePolicy MAX = MergePolicies::computeMax;

    // Utility class - prevent instantiation
    private MergePolicies() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 평균과 모표준편차.
     *
     * <pre>
     * mean = (1/K) · Σ vᵢ
     * std  = sqrt((1/K) · Σ (vᵢ − mean)²)
     * </pre>
     *
     * @return 기본 병합 정책
     */
    public static MergePolicy meanAndStd() {
        return MEAN_AND_STD;
    }

    public static MergePolicy median() {
        return MEDIAN;
    }

    public static MergePolicy max() {
        return MAX;
    }

    /**
     * 가중 평균.
     *
     * <p>가중치는 branch 번호 순서(입력 목록 순서)에 대응하므로, 이 정책만은
     * 위치 대응에 의존합니다. spread는 가중 모표준편차입니다.</p>
     *
     * @param weights branch별 가중치 (음수 불가, 합이 양수)
     * @return 가중 평균 정책
     * @throws IllegalArgumentException 가중치가 유효하지 않은 경우
     */
    public static MergePolicy weightedMean(List<Double> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new IllegalArgumentException("weights cannot be null or empty");
        }
        double total = 0.0;
        for (Double weight : weights) {
            if (weight == null || weight < 0.0) {
                throw new IllegalArgumentException("weights must be non-negative (current: " + weights + ")");
            }
            total += weight;
        }
        if (total <= 0.0) {
            throw new IllegalArgumentException("weights must sum to a positive value");
        }
        List<Double> copy = List.copyOf(weights);
        return values -> computeWeightedMean(values, copy);
    }

    private static MetricSummary computeMeanAndStd(List<Double> values) {
        List<Double> sorted = sorted(values);
        int count = sorted.size();
        if (count == 0) {
            return MetricSummary.empty();
        }
        double sum = 0.0;
        for (double value : sorted) {
            sum += value;
        }
        double mean = sum / count;
        double squares = 0.0;
        for (double value : sorted) {
            double diff = value - mean;
            squares += diff * diff;
        }
        return new MetricSummary(mean, Math.sqrt(squares / count), count);
    }

    private static MetricSummary computeMedian(List<Double> values) {
        List<Double> sorted = sorted(values);
        int count = sorted.size();
        if (count == 0) {
            return MetricSummary.empty();
        }
        double median = count % 2 == 1
            ? sorted.get(count / 2)
            : (sorted.get(count / 2 - 1) + sorted.get(count / 2)) / 2.0;
        return new MetricSummary(median, 0.0, count);
    }

    private static MetricSummary computeMax(List<Double> values) {
        List<Double> sorted = sorted(values);
        int count = sorted.size();
        if (count == 0) {
            return MetricSummary.empty();
        }
        return new MetricSummary(sorted.get(count - 1), 0.0, count);
    }

    private static MetricSummary computeWeightedMean(List<Double> values, List<Double> weights) {
        if (values.isEmpty()) {
            return MetricSummary.empty();
        }
        if (values.size() != weights.size()) {
            throw new IllegalArgumentException(
                String.format("weighted mean needs one weight per value (values: %d, weights: %d)",
                    values.size(), weights.size())
            );
        }
        double weightSum = 0.0;
        double weighted = 0.0;
        for (int i = 0; i < values.size(); i++) {
            weightSum += weights.get(i);
            weighted += weights.get(i) * values.get(i);
        }
        double mean = weighted / weightSum;
        double squares = 0.0;
        for (int i = 0; i < values.size(); i++) {
            double diff = values.get(i) - mean;
            squares += weights.get(i) * diff * diff;
        }
        return new MetricSummary(mean, Math.sqrt(squares / weightSum), values.size());
    }

    private static List<Double> sorted(List<Double> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        List<Double> copy = new ArrayList<>(values.size());
        for (Double value : values) {
            if (value == null) {
                throw new IllegalArgumentException("values cannot contain null");
            }
            copy.add(value);
        }
        copy.sort(null);
        return copy;
    }
}
