package com.ryuqq.stepflow.pipeline.training.fold;

import java.util.List;

/**
 * Cross-validation fold: the rows used to train and the held-out rows used to evaluate.
 *
 * @param number fold number (0부터 시작, tracking run 이름에 사용)
 * @param trainIndices 학습 row 번호 (오름차순)
 * @param testIndices 평가 row 번호
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record Fold(
    int number,
    List<Integer> trainIndices,
    List<Integer> testIndices
) {

    public Fold {
        if (number < 0) {
            throw new IllegalArgumentException("number must be non-negative (current: " + number + ")");
        }
        if (trainIndices == null || testIndices == null) {
            throw new IllegalArgumentException("indices cannot be null");
        }
        if (testIndices.isEmpty()) {
            throw new IllegalArgumentException("testIndices cannot be empty (fold: " + number + ")");
        }
        trainIndices = List.copyOf(trainIndices);
        testIndices = List.copyOf(testIndices);
    }

    @Override
    public String toString() {
        return "Fold{" + number + ", train=" + trainIndices.size() + ", test=" + testIndices.size() + '}';
    }
}
