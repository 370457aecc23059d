package com.ryuqq.stepflow.core.error;

import com.ryuqq.stepflow.core.model.BranchPath;

/**
 * Stepflow 오류의 공통 상위 타입.
 *
 * <p>오류 종류({@link ErrorKind})와, 알 수 있는 경우 발생 위치(step 이름, branch 경로)를 담습니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public abstract class StepflowException extends RuntimeException {

    private final ErrorKind kind;
    private final String stepName;
    private final BranchPath branchPath;

    protected StepflowException(ErrorKind kind, String message, String stepName, BranchPath branchPath, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
        this.stepName = stepName;
        this.branchPath = branchPath;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * 오류가 발생한 step 이름.
     *
     * @return step 이름 (그래프/초기화 오류는 null)
     */
    public String getStepNameOrNull() {
        return stepName;
    }

    /**
     * 오류가 발생한 branch 경로.
     *
     * @return branch 경로 (그래프/초기화 오류는 null)
     */
    public BranchPath getBranchPathOrNull() {
        return branchPath;
    }
}
