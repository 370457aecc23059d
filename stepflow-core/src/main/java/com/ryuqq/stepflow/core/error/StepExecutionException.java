package com.ryuqq.stepflow.core.error;

import com.ryuqq.stepflow.core.model.BranchPath;

/**
 * step body 실행 실패.
 *
 * <p>body가 던진 예외를 감싸 step 이름과 branch 경로를 기록합니다.
 * 해당 branch를 실패시키고, 병렬 영역 안이면 영역과 Run 전체를 실패시킵니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public class StepExecutionException extends StepflowException {

    public StepExecutionException(String stepName, BranchPath branchPath, String message, Throwable cause) {
        super(ErrorKind.STEP_EXECUTION, message, requireStep(stepName), branchPath, cause);
    }

    public StepExecutionException(String stepName, BranchPath branchPath, Throwable cause) {
        this(stepName, branchPath, describe(stepName, branchPath, cause), cause);
    }

    private static String describe(String stepName, BranchPath branchPath, Throwable cause) {
        String reason = cause == null ? "unknown error" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return String.format("Step %s failed at %s: %s", stepName, branchPath, reason);
    }

    private static String requireStep(String stepName) {
        if (stepName == null || stepName.isBlank()) {
            throw new IllegalArgumentException("stepName cannot be null or blank");
        }
        return stepName;
    }
}
