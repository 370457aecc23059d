package com.ryuqq.stepflow.core.artifact;

import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.model.RunId;

/**
 * Artifact 네임스페이스: (run, branch 경로, step) 단위.
 *
 * <p>한 step 실행이 만든 Artifact는 정확히 하나의 scope에 기록되며,
 * 같은 scope의 같은 이름은 두 번 기록될 수 없습니다.</p>
 *
 * @param runId Run ID
 * @param branchPath step이 실행된 branch 경로
 * @param stepName step 이름
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record ArtifactScope(
    RunId runId,
    BranchPath branchPath,
    String stepName
) {

    public ArtifactScope {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (branchPath == null) {
            throw new IllegalArgumentException("branchPath cannot be null");
        }
        if (stepName == null || stepName.isBlank()) {
            throw new IllegalArgumentException("stepName cannot be null or blank");
        }
    }

    public static ArtifactScope of(RunId runId, BranchPath branchPath, String stepName) {
        return new ArtifactScope(runId, branchPath, stepName);
    }

    @Override
    public String toString() {
        return runId.getValue() + ":" + branchPath + ":" + stepName;
    }
}
