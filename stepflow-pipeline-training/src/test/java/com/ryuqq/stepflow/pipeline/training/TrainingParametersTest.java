package com.ryuqq.stepflow.pipeline.training;

import com.ryuqq.stepflow.core.model.RunParameters;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TrainingParameters 단위 테스트.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
class TrainingParametersTest {

    @Test
    void constructor_기본값() {
        // when
        TrainingParameters parameters = new TrainingParameters();

        // then
        assertThat(parameters.trackingUri()).isEqualTo("http://127.0.0.1:5000");
        assertThat(parameters.epochs()).isEqualTo(50);
        assertThat(parameters.batchSize()).isEqualTo(32);
        assertThat(parameters.accuracyThreshold()).isEqualTo(0.7);
        assertThat(parameters.folds()).isEqualTo(5);
        assertThat(parameters.shuffleSeed()).isEqualTo(42L);
        assertThat(parameters.production()).isFalse();
        assertThat(parameters.registeredModelName()).isEqualTo("penguins");
        assertThat(parameters.mode()).isEqualTo("development");
    }

    @Test
    void fromEnvironment_MLFLOW_TRACKING_URI_사용() {
        // when
        TrainingParameters parameters = TrainingParameters.fromEnvironment(
            Map.of("MLFLOW_TRACKING_URI", " http://tracking:8080 "));

        // then
        assertThat(parameters.trackingUri()).isEqualTo("http://tracking:8080");
    }

    @Test
    void fromEnvironment_값이_없거나_비어있으면_기본_URI() {
        assertThat(TrainingParameters.fromEnvironment(Map.of()).trackingUri())
            .isEqualTo("http://127.0.0.1:5000");
        assertThat(TrainingParameters.fromEnvironment(Map.of("MLFLOW_TRACKING_URI", "  ")).trackingUri())
            .isEqualTo("http://127.0.0.1:5000");
    }

    @Test
    void toRunParameters_from_값_보존() {
        // given
        TrainingParameters original = new TrainingParameters()
            .withEpochs(10)
            .withBatchSize(8)
            .withAccuracyThreshold(0.9)
            .withFolds(3)
            .withShuffleSeed(7L)
            .withProduction(true)
            .withRegisteredModelName("penguins-prod");

        // when
        TrainingParameters restored = TrainingParameters.from(original.toRunParameters());

        // then
        assertThat(restored).isEqualTo(original);
        assertThat(restored.mode()).isEqualTo("production");
    }

    @Test
    void from_문자열_파라미터_변환_및_누락값_기본값() {
        // given
        RunParameters parameters = RunParameters.of(Map.of(
            "training-epochs", "12",
            "accuracy-threshold", "0.65",
            "production", "true"
        ));

        // when
        TrainingParameters training = TrainingParameters.from(parameters);

        // then
        assertThat(training.epochs()).isEqualTo(12);
        assertThat(training.accuracyThreshold()).isEqualTo(0.65);
        assertThat(training.production()).isTrue();
        assertThat(training.batchSize()).isEqualTo(32);
        assertThat(training.trackingUri()).isEqualTo("http://127.0.0.1:5000");
    }

    @Test
    void constructor_잘못된_값_예외() {
        TrainingParameters defaults = new TrainingParameters();

        assertThatThrownBy(() -> defaults.withEpochs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("epochs must be positive");
        assertThatThrownBy(() -> defaults.withBatchSize(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("batchSize must be positive");
        assertThatThrownBy(() -> defaults.withAccuracyThreshold(1.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("accuracyThreshold must be between 0.0 and 1.0");
        assertThatThrownBy(() -> defaults.withAccuracyThreshold(Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> defaults.withFolds(1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("folds must be at least 2");
        assertThatThrownBy(() -> defaults.withTrackingUri(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("trackingUri cannot be null or blank");
        assertThatThrownBy(() -> TrainingParameters.fromEnvironment(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
