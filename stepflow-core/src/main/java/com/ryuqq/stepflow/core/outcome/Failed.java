package com.ryuqq.stepflow.core.outcome;

import com.ryuqq.stepflow.core.error.ErrorKind;
import com.ryuqq.stepflow.core.error.StepflowException;
import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.model.RunId;

/**
 * 실패한 Run.
 *
 * <p>가장 먼저 발생한 (원인) 오류를 보고합니다. 형제 branch가 그 뒤에 낸 오류는 로그로만 남습니다.</p>
 *
 * @param runId Run ID
 * @param kind 오류 종류
 * @param stepName 실패한 step (초기화 실패면 null)
 * @param branchPath 실패한 branch 경로 (초기화 실패면 null)
 * @param message 오류 메시지
 * @param cause 원인 예외
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record Failed(
    RunId runId,
    ErrorKind kind,
    String stepName,
    BranchPath branchPath,
    String message,
    StepflowException cause
) implements RunOutcome {

    public Failed {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        if (message == null) {
            message = cause.getMessage();
        }
        // stepName, branchPath는 null 허용
    }

    /**
     * 예외로부터 Failed 생성.
     *
     * @param runId Run ID
     * @param cause 원인 예외
     * @return Failed
     */
    public static Failed of(RunId runId, StepflowException cause) {
        return new Failed(runId, cause.getKind(), cause.getStepNameOrNull(),
            cause.getBranchPathOrNull(), cause.getMessage(), cause);
    }
}
