package com.ryuqq.stepflow.core.model;

/**
 * 분기 경로의 한 구간: 어떤 split step에서 몇 번째 branch를 탔는지.
 *
 * <p>index는 1부터 시작하며 spawn 순서대로 결정적으로 부여됩니다.
 * static split은 선언된 successor 순서, foreach split은 원소 순서를 따릅니다.</p>
 *
 * @param splitStep 분기를 만든 split step 이름
 * @param index branch 번호 (1 ~ width)
 * @param width 해당 split이 만든 branch 수
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record BranchSegment(
    String splitStep,
    int index,
    int width
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException splitStep이 비어있거나 index/width가 범위를 벗어난 경우
     */
    public BranchSegment {
        if (splitStep == null || splitStep.isBlank()) {
            throw new IllegalArgumentException("splitStep cannot be null or blank");
        }
        if (width < 1) {
            throw new IllegalArgumentException("width must be positive (current: " + width + ")");
        }
        if (index < 1 || index > width) {
            throw new IllegalArgumentException(
                String.format("index must be between 1 and %d (current: %d)", width, index)
            );
        }
    }

    @Override
    public String toString() {
        return splitStep + "[" + index + "/" + width + "]";
    }
}
