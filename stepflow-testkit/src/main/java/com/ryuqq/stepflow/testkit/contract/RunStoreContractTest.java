package com.ryuqq.stepflow.testkit.contract;

import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.model.RunId;
import com.ryuqq.stepflow.core.model.RunParameters;
import com.ryuqq.stepflow.core.spi.RunStore;
import com.ryuqq.stepflow.core.spi.StepRecord;
import com.ryuqq.stepflow.core.statemachine.RunState;
import com.ryuqq.stepflow.core.statemachine.StepState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link RunStore} implementations.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Run lifecycle PENDING → RUNNING → SUCCEEDED | FAILED</li>
 *   <li>Backward and terminal transitions rejected, state preserved</li>
 *   <li>Step states tracked per (step, branch path), join passes through AWAITING_JOIN</li>
 *   <li>Unknown runs rejected with IllegalStateException</li>
 * </ul>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public abstract class RunStoreContractTest {

    protected RunStore store;

    protected abstract RunStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    @Test
    void testBegin_RegistersPendingRun() {
        // Given
        RunId runId = RunId.generate();
        RunParameters parameters = RunParameters.builder().put("epochs", 50).build();

        // When
        store.begin(runId, parameters);

        // Then
        assertEquals(RunState.PENDING, store.getState(runId));
        assertEquals(parameters, store.getParameters(runId));
        assertTrue(store.steps(runId).isEmpty());
    }

    @Test
    void testBegin_Twice_ThrowsException() {
        RunId runId = RunId.generate();
        store.begin(runId, RunParameters.empty());

        assertThrows(IllegalStateException.class, () -> store.begin(runId, RunParameters.empty()));
    }

    @Test
    void testTransition_FullLifecycle_Succeeds() {
        RunId runId = RunId.generate();
        store.begin(runId, RunParameters.empty());

        store.transition(runId, RunState.RUNNING);
        store.transition(runId, RunState.SUCCEEDED);

        assertEquals(RunState.SUCCEEDED, store.getState(runId));
    }

    @Test
    void testTransition_FromTerminal_ThrowsAndPreservesState() {
        // Given: run in FAILED state
        RunId runId = RunId.generate();
        store.begin(runId, RunParameters.empty());
        store.transition(runId, RunState.RUNNING);
        store.transition(runId, RunState.FAILED);

        // When/Then
        assertThrows(IllegalStateException.class, () -> store.transition(runId, RunState.RUNNING));
        assertThrows(IllegalStateException.class, () -> store.transition(runId, RunState.SUCCEEDED));
        assertEquals(RunState.FAILED, store.getState(runId));
    }

    @Test
    void testTransition_PendingToSucceeded_ThrowsException() {
        RunId runId = RunId.generate();
        store.begin(runId, RunParameters.empty());

        assertThrows(IllegalStateException.class, () -> store.transition(runId, RunState.SUCCEEDED));
        assertEquals(RunState.PENDING, store.getState(runId));
    }

    @Test
    void testRecordStep_TracksStatePerBranchPath() {
        // Given
        RunId runId = RunId.generate();
        store.begin(runId, RunParameters.empty());
        BranchPath first = BranchPath.root().enter("cv", 1, 2);
        BranchPath second = BranchPath.root().enter("cv", 2, 2);

        // When
        store.recordStep(StepRecord.of(runId, "train_fold", first, StepState.RUNNING));
        store.recordStep(StepRecord.of(runId, "train_fold", first, StepState.SUCCEEDED));
        store.recordStep(StepRecord.of(runId, "train_fold", second, StepState.RUNNING));

        // Then
        assertEquals(StepState.SUCCEEDED, store.getStepState(runId, "train_fold", first));
        assertEquals(StepState.RUNNING, store.getStepState(runId, "train_fold", second));
        assertEquals(StepState.PENDING, store.getStepState(runId, "average_scores", BranchPath.root()));
        assertEquals(3, store.steps(runId).size());
    }

    @Test
    void testRecordStep_JoinLifecycle() {
        RunId runId = RunId.generate();
        store.begin(runId, RunParameters.empty());

        store.recordStep(StepRecord.of(runId, "join", BranchPath.root(), StepState.AWAITING_JOIN));
        store.recordStep(StepRecord.of(runId, "join", BranchPath.root(), StepState.RUNNING));
        store.recordStep(StepRecord.of(runId, "join", BranchPath.root(), StepState.SUCCEEDED));

        List<StepRecord> history = store.steps(runId);
        assertEquals(List.of(StepState.AWAITING_JOIN, StepState.RUNNING, StepState.SUCCEEDED),
            history.stream().map(StepRecord::state).toList());
    }

    @Test
    void testRecordStep_InvalidTransition_ThrowsAndPreservesState() {
        // Given
        RunId runId = RunId.generate();
        store.begin(runId, RunParameters.empty());
        store.recordStep(StepRecord.of(runId, "train", BranchPath.root(), StepState.RUNNING));
        store.recordStep(StepRecord.failed(runId, "train", BranchPath.root(), "boom"));

        // When/Then
        assertThrows(IllegalStateException.class,
            () -> store.recordStep(StepRecord.of(runId, "train", BranchPath.root(), StepState.RUNNING)));
        assertEquals(StepState.FAILED, store.getStepState(runId, "train", BranchPath.root()));
    }

    @Test
    void testUnknownRun_ThrowsException() {
        RunId unknown = RunId.generate();

        assertThrows(IllegalStateException.class, () -> store.getState(unknown));
        assertThrows(IllegalStateException.class, () -> store.transition(unknown, RunState.RUNNING));
        assertThrows(IllegalStateException.class,
            () -> store.recordStep(StepRecord.of(unknown, "start", BranchPath.root(), StepState.RUNNING)));
    }
}
