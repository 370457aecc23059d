package com.ryuqq.stepflow.core.spi;

import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.model.RunId;
import com.ryuqq.stepflow.core.model.RunParameters;
import com.ryuqq.stepflow.core.statemachine.RunState;
import com.ryuqq.stepflow.core.statemachine.StepState;

import java.util.List;

/**
 * Run and step state storage SPI.
 *
 * <p>The runner records every run and step state change here. Implementations
 * validate each change with {@link com.ryuqq.stepflow.core.statemachine.StateTransition}.</p>
 *
 * <p><strong>State flow:</strong></p>
 * <pre>
 * begin(runId, parameters)        → PENDING
 * transition(runId, RUNNING)
 * recordStep(step RUNNING / SUCCEEDED / FAILED ...)
 * transition(runId, SUCCEEDED | FAILED)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: branches record step states concurrently</li>
 *   <li>Step states are tracked per (step, branch path); an unrecorded step is PENDING</li>
 * </ul>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public interface RunStore {

    /**
     * Registers a new run in PENDING state.
     *
     * @param runId the run ID
     * @param parameters run parameters, fixed for the lifetime of the run
     * @throws IllegalArgumentException if runId or parameters is null
     * @throws IllegalStateException if the run is already registered
     */
    void begin(RunId runId, RunParameters parameters);

    /**
     * Transitions the run state.
     *
     * @param runId the run ID
     * @param next next state
     * @throws IllegalStateException if the run is unknown or the transition is invalid
     */
    void transition(RunId runId, RunState next);

    /**
     * Returns the current run state.
     *
     * @param runId the run ID
     * @return current state
     * @throws IllegalStateException if the run is unknown
     */
    RunState getState(RunId runId);

    /**
     * Returns the parameters the run was started with.
     *
     * @param runId the run ID
     * @return run parameters
     * @throws IllegalStateException if the run is unknown
     */
    RunParameters getParameters(RunId runId);

    /**
     * Records a step state change.
     *
     * @param record the change
     * @throws IllegalStateException if the run is unknown or the transition is invalid
     */
    void recordStep(StepRecord record);

    /**
     * Returns the current state of a step on a branch path.
     *
     * @param runId the run ID
     * @param stepName step name
     * @param branchPath branch path
     * @return current state (PENDING if never recorded)
     */
    StepState getStepState(RunId runId, String stepName, BranchPath branchPath);

    /**
     * Returns the step history of a run in record order.
     *
     * @param runId the run ID
     * @return step records
     * @throws IllegalStateException if the run is unknown
     */
    List<StepRecord> steps(RunId runId);
}
