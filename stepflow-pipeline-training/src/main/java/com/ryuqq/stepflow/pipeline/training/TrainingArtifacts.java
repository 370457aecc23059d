package com.ryuqq.stepflow.pipeline.training;

import com.ryuqq.stepflow.core.artifact.ArtifactKey;
import com.ryuqq.stepflow.core.gate.GateDecision;
import com.ryuqq.stepflow.pipeline.training.fold.Fold;
import com.ryuqq.stepflow.pipeline.training.spi.Dataset;
import com.ryuqq.stepflow.pipeline.training.spi.Matrix;
import com.ryuqq.stepflow.pipeline.training.spi.Model;
import com.ryuqq.stepflow.pipeline.training.spi.Transformer;

import java.util.List;

/**
 * 학습 파이프라인 step 사이에서 주고받는 Artifact 이름과 타입.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class TrainingArtifacts {

    /** Initializer가 연 상위 tracking run ID. */
    public static final ArtifactKey<String> TRACKING_RUN_ID = ArtifactKey.of("tracking_run_id", String.class);
    /** "production" 또는 "development". */
    public static final ArtifactKey<String> MODE = ArtifactKey.of("mode", String.class);
    public static final ArtifactKey<Dataset> DATA = ArtifactKey.of("data", Dataset.class);

    @SuppressWarnings({"unchecked", "rawtypes"})
    public static final ArtifactKey<List<Fold>> FOLDS = (ArtifactKey) ArtifactKey.of("folds", List.class);
    public static final ArtifactKey<Fold> FOLD = ArtifactKey.of("fold", Fold.class);

    public static final ArtifactKey<Matrix> X_TRAIN = ArtifactKey.of("x_train", Matrix.class);
    public static final ArtifactKey<Matrix> Y_TRAIN = ArtifactKey.of("y_train", Matrix.class);
    public static final ArtifactKey<Matrix> X_TEST = ArtifactKey.of("x_test", Matrix.class);
    public static final ArtifactKey<Matrix> Y_TEST = ArtifactKey.of("y_test", Matrix.class);
    public static final ArtifactKey<Matrix> X = ArtifactKey.of("x", Matrix.class);
    public static final ArtifactKey<Matrix> Y = ArtifactKey.of("y", Matrix.class);

    public static final ArtifactKey<Transformer> FEATURES_TRANSFORMER =
        ArtifactKey.of("features_transformer", Transformer.class);
    public static final ArtifactKey<Transformer> TARGET_TRANSFORMER =
        ArtifactKey.of("target_transformer", Transformer.class);

    public static final ArtifactKey<Model> MODEL = ArtifactKey.of("model", Model.class);
    /** fold별 nested tracking run ID. */
    public static final ArtifactKey<String> FOLD_TRACKING_RUN_ID =
        ArtifactKey.of("fold_tracking_run_id", String.class);

    public static final ArtifactKey<Double> TEST_LOSS = ArtifactKey.of("test_loss", Double.class);
    public static final ArtifactKey<Double> TEST_ACCURACY = ArtifactKey.of("test_accuracy", Double.class);
    public static final ArtifactKey<Double> TEST_LOSS_STD = ArtifactKey.of("test_loss_std", Double.class);
    public static final ArtifactKey<Double> TEST_ACCURACY_STD = ArtifactKey.of("test_accuracy_std", Double.class);

    /** register_model의 게이트 판정 결과. */
    public static final ArtifactKey<GateDecision> REGISTRATION =
        ArtifactKey.of("registration", GateDecision.class);

    private TrainingArtifacts() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
