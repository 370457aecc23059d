package com.ryuqq.stepflow.core.step;

import com.ryuqq.stepflow.core.artifact.Artifacts;
import com.ryuqq.stepflow.core.model.BranchPath;

/**
 * join에 도착한 완료된 branch 하나.
 *
 * @param index branch 번호 (1부터, spawn 순서)
 * @param branchPath branch 경로
 * @param lastStep join 직전에 실행된 step
 * @param artifacts branch가 join에 가져온 Artifact
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record BranchInput(
    int index,
    BranchPath branchPath,
    String lastStep,
    Artifacts artifacts
) {

    public BranchInput {
        if (index < 1) {
            throw new IllegalArgumentException("index must be positive (current: " + index + ")");
        }
        if (branchPath == null) {
            throw new IllegalArgumentException("branchPath cannot be null");
        }
        if (lastStep == null || lastStep.isBlank()) {
            throw new IllegalArgumentException("lastStep cannot be null or blank");
        }
        if (artifacts == null) {
            throw new IllegalArgumentException("artifacts cannot be null");
        }
    }
}
