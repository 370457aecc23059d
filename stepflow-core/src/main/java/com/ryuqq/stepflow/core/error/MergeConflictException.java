package com.ryuqq.stepflow.core.error;

import com.ryuqq.stepflow.core.model.BranchPath;

import java.util.List;

/**
 * join에서 같은 이름의 Artifact를 branch들이 서로 다른 값으로 제공했는데
 * 명시적인 해소 규칙 없이 선택하려 한 경우.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public class MergeConflictException extends StepflowException {

    private final List<String> artifactNames;

    public MergeConflictException(String joinStep, BranchPath branchPath, List<String> artifactNames) {
        super(ErrorKind.MERGE_CONFLICT,
            String.format("Join %s cannot merge conflicting artifacts %s; select one branch or aggregate explicitly",
                joinStep, artifactNames),
            joinStep, branchPath, null);
        this.artifactNames = List.copyOf(artifactNames);
    }

    public List<String> getArtifactNames() {
        return artifactNames;
    }
}
