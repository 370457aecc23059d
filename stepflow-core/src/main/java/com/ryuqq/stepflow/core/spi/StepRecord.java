package com.ryuqq.stepflow.core.spi;

import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.model.RunId;
import com.ryuqq.stepflow.core.statemachine.StepState;

import java.time.Instant;

/**
 * One step state change within a run.
 *
 * @param runId Run ID
 * @param stepName step name
 * @param branchPath branch path the step executed on
 * @param state new state
 * @param recordedAt time of the change
 * @param message failure message (null unless FAILED)
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record StepRecord(
    RunId runId,
    String stepName,
    BranchPath branchPath,
    StepState state,
    Instant recordedAt,
    String message
) {

    public StepRecord {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (stepName == null || stepName.isBlank()) {
            throw new IllegalArgumentException("stepName cannot be null or blank");
        }
        if (branchPath == null) {
            throw new IllegalArgumentException("branchPath cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (recordedAt == null) {
            throw new IllegalArgumentException("recordedAt cannot be null");
        }
    }

    public static StepRecord of(RunId runId, String stepName, BranchPath branchPath, StepState state) {
        return new StepRecord(runId, stepName, branchPath, state, Instant.now(), null);
    }

    public static StepRecord failed(RunId runId, String stepName, BranchPath branchPath, String message) {
        return new StepRecord(runId, stepName, branchPath, StepState.FAILED, Instant.now(), message);
    }
}
