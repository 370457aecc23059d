package com.ryuqq.stepflow.core.step;

import com.ryuqq.stepflow.core.artifact.Artifacts;
import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.model.RunId;
import com.ryuqq.stepflow.core.model.RunParameters;

import java.util.Optional;

/**
 * 하나의 step 실행에 주어지는 불변 컨텍스트.
 *
 * <p>Run 파라미터, 현재 branch 경로, 상속받은 Artifact, 그리고 foreach branch라면
 * 해당 branch의 입력 원소를 제공합니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class StepContext {

    private final RunId runId;
    private final String stepName;
    private final BranchPath branchPath;
    private final RunParameters parameters;
    private final Artifacts artifacts;
    private final Object input;

    private StepContext(RunId runId, String stepName, BranchPath branchPath,
                        RunParameters parameters, Artifacts artifacts, Object input) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (stepName == null || stepName.isBlank()) {
            throw new IllegalArgumentException("stepName cannot be null or blank");
        }
        if (branchPath == null) {
            throw new IllegalArgumentException("branchPath cannot be null");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("parameters cannot be null");
        }
        if (artifacts == null) {
            throw new IllegalArgumentException("artifacts cannot be null");
        }
        this.runId = runId;
        this.stepName = stepName;
        this.branchPath = branchPath;
        this.parameters = parameters;
        this.artifacts = artifacts;
        this.input = input;
    }

    /**
     * StepContext 생성.
     *
     * @param runId Run ID
     * @param stepName 실행할 step
     * @param branchPath 현재 branch 경로
     * @param parameters Run 파라미터
     * @param artifacts 상속받은 Artifact
     * @param inputOrNull foreach 입력 원소 (없으면 null)
     * @return StepContext
     */
    public static StepContext of(RunId runId, String stepName, BranchPath branchPath,
                                 RunParameters parameters, Artifacts artifacts, Object inputOrNull) {
        return new StepContext(runId, stepName, branchPath, parameters, artifacts, inputOrNull);
    }

    public RunId getRunId() {
        return runId;
    }

    public String getStepName() {
        return stepName;
    }

    public BranchPath getBranchPath() {
        return branchPath;
    }

    public RunParameters getParameters() {
        return parameters;
    }

    public Artifacts getArtifacts() {
        return artifacts;
    }

    public <T> T getArtifact(String name, Class<T> type) {
        return artifacts.get(name, type);
    }

    /**
     * 가장 안쪽 branch 번호.
     *
     * @return 1부터 시작하는 번호, 병렬 영역 밖이면 0
     */
    public int getBranchIndex() {
        return branchPath.isRoot() ? 0 : branchPath.innermost().index();
    }

    public Optional<Object> getInput() {
        return Optional.ofNullable(input);
    }

    /**
     * foreach 입력 원소를 타입 검증 후 조회.
     *
     * @param type 기대 타입
     * @param <T> 기대 타입
     * @return 입력 원소
     * @throws IllegalStateException foreach branch가 아니거나 타입이 다른 경우
     */
    public <T> T getInput(Class<T> type) {
        if (input == null) {
            throw new IllegalStateException("Step " + stepName + " has no foreach input at " + branchPath);
        }
        if (!type.isInstance(input)) {
            throw new IllegalStateException(
                String.format("Foreach input of %s has type %s, expected %s",
                    stepName, input.getClass().getName(), type.getName())
            );
        }
        return type.cast(input);
    }

    @Override
    public String toString() {
        return "StepContext{" + runId.getValue() + ", " + stepName + " @ " + branchPath + '}';
    }
}
