package com.ryuqq.stepflow.adapter.inmemory.store;

import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.model.RunId;
import com.ryuqq.stepflow.core.model.RunParameters;
import com.ryuqq.stepflow.core.spi.RunStore;
import com.ryuqq.stepflow.core.spi.StepRecord;
import com.ryuqq.stepflow.core.statemachine.RunState;
import com.ryuqq.stepflow.core.statemachine.StateTransition;
import com.ryuqq.stepflow.core.statemachine.StepState;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link RunStore} SPI.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>runs:</strong> ConcurrentHashMap&lt;RunId, RunEntity&gt; - run state and parameters</li>
 *   <li><strong>RunEntity.stepStates:</strong> ConcurrentHashMap&lt;StepKey, StepState&gt; - latest state per (step, branch path)</li>
 *   <li><strong>RunEntity.history:</strong> CopyOnWriteArrayList&lt;StepRecord&gt; - every recorded change in order</li>
 * </ul>
 *
 * <p>Each change is validated with {@link StateTransition} inside
 * {@link ConcurrentHashMap#compute}, so an invalid transition leaves the stored state unchanged.</p>
 *
 * <p>Runs are kept until {@link #remove(RunId)} or {@link #clear()} is called.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public class InMemoryRunStore implements RunStore {

    private final ConcurrentHashMap<RunId, RunEntity> runs;

    public InMemoryRunStore() {
        this.runs = new ConcurrentHashMap<>();
    }

    @Override
    public void begin(RunId runId, RunParameters parameters) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("parameters cannot be null");
        }
        RunEntity previous = runs.putIfAbsent(runId, new RunEntity(parameters));
        if (previous != null) {
            throw new IllegalStateException("Run already registered: " + runId);
        }
    }

    @Override
    public void transition(RunId runId, RunState next) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        RunEntity entity = entity(runId);
        synchronized (entity) {
            entity.state = StateTransition.transition(entity.state, next);
        }
    }

    @Override
    public RunState getState(RunId runId) {
        RunEntity entity = entity(runId);
        synchronized (entity) {
            return entity.state;
        }
    }

    @Override
    public RunParameters getParameters(RunId runId) {
        return entity(runId).parameters;
    }

    @Override
    public void recordStep(StepRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        RunEntity entity = entity(record.runId());
        StepKey key = new StepKey(record.stepName(), record.branchPath());
        entity.stepStates.compute(key, (k, current) ->
            StateTransition.transition(current == null ? StepState.PENDING : current, record.state()));
        entity.history.add(record);
    }

    @Override
    public StepState getStepState(RunId runId, String stepName, BranchPath branchPath) {
        StepState state = entity(runId).stepStates.get(new StepKey(stepName, branchPath));
        return state == null ? StepState.PENDING : state;
    }

    @Override
    public List<StepRecord> steps(RunId runId) {
        return List.copyOf(entity(runId).history);
    }

    /**
     * Removes one run with its step history.
     *
     * @param runId the run ID
     * @return true if the run was registered
     * @throws IllegalStateException if the run has not reached a terminal state
     */
    public boolean remove(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        RunEntity entity = runs.get(runId);
        if (entity == null) {
            return false;
        }
        synchronized (entity) {
            if (!entity.state.isTerminal()) {
                throw new IllegalStateException("Run is still active: " + runId + " (" + entity.state + ")");
            }
        }
        return runs.remove(runId, entity);
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        runs.clear();
    }

    private RunEntity entity(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        RunEntity entity = runs.get(runId);
        if (entity == null) {
            throw new IllegalStateException("No run found for runId: " + runId);
        }
        return entity;
    }

    private record StepKey(String stepName, BranchPath branchPath) {
    }

    private static final class RunEntity {
        private final RunParameters parameters;
        private final ConcurrentHashMap<StepKey, StepState> stepStates = new ConcurrentHashMap<>();
        private final CopyOnWriteArrayList<StepRecord> history = new CopyOnWriteArrayList<>();
        private RunState state = RunState.PENDING;

        private RunEntity(RunParameters parameters) {
            this.parameters = parameters;
        }
    }
}
