package com.ryuqq.stepflow.core.error;

import com.ryuqq.stepflow.core.model.BranchPath;

/**
 * foreach split이 원소를 하나도 만들지 않음 (빈 foreach를 실패로 다루는 정책일 때).
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public class EmptyForeachException extends StepflowException {

    public EmptyForeachException(String stepName, BranchPath branchPath) {
        super(ErrorKind.EMPTY_FOREACH,
            String.format("Foreach step %s produced no elements at %s", stepName, branchPath),
            stepName, branchPath, null);
    }
}
