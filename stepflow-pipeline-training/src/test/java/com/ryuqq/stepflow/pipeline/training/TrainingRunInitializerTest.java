package com.ryuqq.stepflow.pipeline.training;

import com.ryuqq.stepflow.core.artifact.Artifacts;
import com.ryuqq.stepflow.core.error.ErrorKind;
import com.ryuqq.stepflow.core.error.RunInitializationException;
import com.ryuqq.stepflow.core.model.RunId;
import com.ryuqq.stepflow.pipeline.training.spi.ExperimentTracker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * TrainingRunInitializer 단위 테스트.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TrainingRunInitializerTest {

    @Mock
    private ExperimentTracker tracker;

    @Test
    void initialize_상위_tracking_run_ID를_seed_artifact로_반환() {
        // given
        RunId runId = RunId.generate();
        when(tracker.startRun(runId.getValue())).thenReturn("parent-run");
        TrainingRunInitializer initializer = new TrainingRunInitializer(tracker);

        // when
        Artifacts seed = initializer.initialize(runId, new TrainingParameters().toRunParameters());

        // then
        assertThat(seed.names()).containsExactly("tracking_run_id");
        assertThat(seed.get(TrainingArtifacts.TRACKING_RUN_ID)).isEqualTo("parent-run");
        verify(tracker).startRun(runId.getValue());
    }

    @Test
    void initialize_연결_실패_RunInitializationException() {
        // given
        RunId runId = RunId.generate();
        IllegalStateException refused = new IllegalStateException("Connection refused");
        when(tracker.startRun(runId.getValue())).thenThrow(refused);
        TrainingRunInitializer initializer = new TrainingRunInitializer(tracker);
        TrainingParameters parameters = new TrainingParameters().withTrackingUri("http://tracking:8080");

        // when
        RunInitializationException exception = catchThrowableOfType(
            () -> initializer.initialize(runId, parameters.toRunParameters()),
            RunInitializationException.class);

        // then
        assertThat(exception).hasMessage("Failed to connect to tracking server http://tracking:8080");
        assertThat(exception).hasCause(refused);
        assertThat(exception.getKind()).isEqualTo(ErrorKind.RUN_INITIALIZATION);
    }

    @Test
    void initialize_빈_run_ID_RunInitializationException() {
        // given
        RunId runId = RunId.generate();
        when(tracker.startRun(runId.getValue())).thenReturn(" ");
        TrainingRunInitializer initializer = new TrainingRunInitializer(tracker);

        // when & then
        assertThatThrownBy(() -> initializer.initialize(runId, new TrainingParameters().toRunParameters()))
            .isInstanceOf(RunInitializationException.class)
            .hasMessageContaining("returned no run ID");
    }

    @Test
    void constructor_tracker_null_예외() {
        assertThatThrownBy(() -> new TrainingRunInitializer(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("tracker cannot be null");
    }
}
