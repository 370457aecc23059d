package com.ryuqq.stepflow.core.merge;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MergePolicies 테스트.
 *
 * <p>집계 결과는 branch 완료 순서와 무관해야 합니다 (비트 단위까지 동일).</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
class MergePoliciesTest {

    // ========== meanAndStd ==========

    @Test
    void meanAndStd_IdenticalValues_ZeroSpread() {
        // When
        MetricSummary summary = MergePolicies.meanAndStd().merge(List.of(0.8, 0.8, 0.8, 0.8, 0.8));

        // Then
        assertEquals(0.8, summary.value(), 1e-12);
        assertEquals(0.0, summary.spread(), 1e-12);
        assertEquals(5, summary.count());
    }

    @Test
    void meanAndStd_ThreeValues_PopulationStd() {
        MetricSummary summary = MergePolicies.meanAndStd().merge(List.of(0.6, 0.7, 0.8));

        assertEquals(0.7, summary.value(), 1e-9);
        assertEquals(Math.sqrt(0.02 / 3), summary.spread(), 1e-9);
    }

    @Test
    void meanAndStd_AnyPermutation_BitIdentical() {
        // Given
        Random random = new Random(42);
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            values.add(random.nextDouble() * 1e-3 + random.nextInt(1000));
        }
        MetricSummary expected = MergePolicies.meanAndStd().merge(values);

        // When & Then
        for (int round = 0; round < 20; round++) {
            List<Double> shuffled = new ArrayList<>(values);
            Collections.shuffle(shuffled, random);
            MetricSummary actual = MergePolicies.meanAndStd().merge(shuffled);
            assertEquals(Double.doubleToLongBits(expected.value()), Double.doubleToLongBits(actual.value()));
            assertEquals(Double.doubleToLongBits(expected.spread()), Double.doubleToLongBits(actual.spread()));
        }
    }

    @Test
    void meanAndStd_Empty_ReturnsNaNSummary() {
        MetricSummary summary = MergePolicies.meanAndStd().merge(List.of());

        assertTrue(summary.isEmpty());
        assertTrue(Double.isNaN(summary.value()));
        assertTrue(Double.isNaN(summary.spread()));
    }

    @Test
    void meanAndStd_NullValue_ThrowsException() {
        List<Double> values = new ArrayList<>();
        values.add(0.5);
        values.add(null);

        assertThrows(IllegalArgumentException.class, () -> MergePolicies.meanAndStd().merge(values));
    }

    // ========== median / max ==========

    @Test
    void median_OddAndEvenCounts() {
        assertEquals(0.7, MergePolicies.median().merge(List.of(0.9, 0.6, 0.7)).value());
        assertEquals(0.65, MergePolicies.median().merge(List.of(0.9, 0.6, 0.7, 0.5)).value(), 1e-12);
    }

    @Test
    void max_ReturnsLargest() {
        MetricSummary summary = MergePolicies.max().merge(List.of(0.61, 0.93, 0.72));

        assertEquals(0.93, summary.value());
        assertEquals(0.0, summary.spread());
        assertEquals(3, summary.count());
    }

    // ========== weightedMean ==========

    @Test
    void weightedMean_UsesBranchOrderWeights() {
        // Given: fold 크기가 다른 경우 가중 평균
        MergePolicy policy = MergePolicies.weightedMean(List.of(1.0, 3.0));

        // When
        MetricSummary summary = policy.merge(List.of(0.6, 0.8));

        // Then
        assertEquals(0.75, summary.value(), 1e-12);
        assertEquals(Math.sqrt(0.03 / 4), summary.spread(), 1e-12);
    }

    @Test
    void weightedMean_WeightCountMismatch_ThrowsException() {
        MergePolicy policy = MergePolicies.weightedMean(List.of(1.0, 1.0));

        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> policy.merge(List.of(0.5, 0.6, 0.7))
        );
        assertTrue(exception.getMessage().contains("one weight per value"));
    }

    @Test
    void weightedMean_InvalidWeights_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> MergePolicies.weightedMean(List.of()));
        assertThrows(IllegalArgumentException.class, () -> MergePolicies.weightedMean(List.of(-1.0, 2.0)));
        assertThrows(IllegalArgumentException.class, () -> MergePolicies.weightedMean(List.of(0.0, 0.0)));
    }

    @Test
    void metricSummary_NegativeCount_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new MetricSummary(0.5, 0.0, -1));
    }
}
