package com.ryuqq.stepflow.pipeline.training;

import com.ryuqq.stepflow.core.artifact.Artifacts;
import com.ryuqq.stepflow.core.gate.GateDecision;
import com.ryuqq.stepflow.core.gate.ThresholdGate;
import com.ryuqq.stepflow.core.merge.MetricSummary;
import com.ryuqq.stepflow.core.step.JoinContext;
import com.ryuqq.stepflow.core.step.StepContext;
import com.ryuqq.stepflow.core.step.StepResult;
import com.ryuqq.stepflow.pipeline.training.fold.Fold;
import com.ryuqq.stepflow.pipeline.training.fold.KFoldSplitter;
import com.ryuqq.stepflow.pipeline.training.spi.Dataset;
import com.ryuqq.stepflow.pipeline.training.spi.Evaluation;
import com.ryuqq.stepflow.pipeline.training.spi.Matrix;
import com.ryuqq.stepflow.pipeline.training.spi.Model;
import com.ryuqq.stepflow.pipeline.training.spi.ModelPackage;
import com.ryuqq.stepflow.pipeline.training.spi.ModelSignature;
import com.ryuqq.stepflow.pipeline.training.spi.TrainingHistory;
import com.ryuqq.stepflow.pipeline.training.spi.Transformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ryuqq.stepflow.pipeline.training.TrainingArtifacts.*;

/**
 * 학습 파이프라인의 step body 모음.
 *
 * <p>각 메서드는 {@link com.ryuqq.stepflow.core.step.StepBody} 또는
 * {@link com.ryuqq.stepflow.core.step.JoinBody}로 {@link TrainingFlow}에 등록됩니다.
 * 모든 계산은 {@link TrainingCollaborators}에 위임하며, 이 클래스는 Artifact를 읽고 쓰는 일만 합니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
final class TrainingSteps {

    private static final Logger log = LoggerFactory.getLogger(TrainingSteps.class);

    private static final ThresholdGate ACCURACY_GATE = new ThresholdGate(TEST_ACCURACY.name());

    private final TrainingCollaborators collaborators;

    TrainingSteps(TrainingCollaborators collaborators) {
        if (collaborators == null) {
            throw new IllegalArgumentException("collaborators cannot be null");
        }
        this.collaborators = collaborators;
    }

    // ========================================
    // start
    // ========================================

    StepResult start(StepContext context) {
        TrainingParameters parameters = TrainingParameters.from(context.getParameters());
        String mode = parameters.mode();
        log.info("Running flow in {} mode.", mode);

        Dataset data = collaborators.datasetLoader().load();
        if (data == null) {
            throw new IllegalStateException("Dataset loader returned null");
        }
        log.info("Loaded dataset with {} samples", data.size());

        return StepResult.next(Artifacts.empty()
            .with(MODE, mode)
            .with(DATA, data));
    }

    // ========================================
    // cross-validation branch
    // ========================================

    StepResult crossValidation(StepContext context) {
        TrainingParameters parameters = TrainingParameters.from(context.getParameters());
        Dataset data = context.getArtifacts().get(DATA);

        List<Fold> folds = new KFoldSplitter(parameters.folds(), parameters.shuffleSeed()).split(data.size());
        log.info("Generated {} folds for cross-validation", folds.size());
        return StepResult.foreach(Artifacts.empty().with(FOLDS, folds), folds);
    }

    StepResult transformFold(StepContext context) {
        Fold fold = context.getInput(Fold.class);
        Dataset data = context.getArtifacts().get(DATA);
        Dataset train = data.select(fold.trainIndices());
        Dataset test = data.select(fold.testIndices());

        Transformer features = collaborators.transformerFactory().buildFeaturesTransformer();
        Transformer target = collaborators.transformerFactory().buildTargetTransformer();

        log.debug("Transforming fold {} ({} train / {} test)", fold.number(), train.size(), test.size());
        return StepResult.next(Artifacts.empty()
            .with(FOLD, fold)
            .with(X_TRAIN, features.fitTransform(train))
            .with(X_TEST, features.transform(test))
            .with(Y_TRAIN, target.fitTransform(train))
            .with(Y_TEST, target.transform(test)));
    }

    StepResult trainFold(StepContext context) {
        TrainingParameters parameters = TrainingParameters.from(context.getParameters());
        Artifacts artifacts = context.getArtifacts();
        Fold fold = artifacts.get(FOLD);
        Matrix xTrain = artifacts.get(X_TRAIN);

        String foldRunId = collaborators.tracker().startNestedRun(
            artifacts.get(TRACKING_RUN_ID), "cross-validation-fold-" + fold.number());

        Model model = collaborators.modelFactory().build(xTrain.columns());
        TrainingHistory history = model.fit(
            xTrain, artifacts.get(Y_TRAIN), parameters.epochs(), parameters.batchSize());

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("loss", history.finalLoss());
        metrics.put("accuracy", history.finalAccuracy());
        collaborators.tracker().logMetrics(metrics, foldRunId);

        log.info("Fold {} trained: loss={}, accuracy={}", fold.number(), history.finalLoss(), history.finalAccuracy());
        return StepResult.next(Artifacts.empty()
            .with(FOLD_TRACKING_RUN_ID, foldRunId)
            .with(MODEL, model));
    }

    StepResult evaluateFold(StepContext context) {
        Artifacts artifacts = context.getArtifacts();
        Fold fold = artifacts.get(FOLD);
        Model model = artifacts.get(MODEL);

        Evaluation evaluation = model.evaluate(artifacts.get(X_TEST), artifacts.get(Y_TEST));

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("test_loss", evaluation.loss());
        metrics.put("test_accuracy", evaluation.accuracy());
        collaborators.tracker().logMetrics(metrics, artifacts.get(FOLD_TRACKING_RUN_ID));

        log.info("Fold {} - loss: {} - accuracy: {}", fold.number(), evaluation.loss(), evaluation.accuracy());
        return StepResult.next(Artifacts.empty()
            .with(TEST_LOSS, evaluation.loss())
            .with(TEST_ACCURACY, evaluation.accuracy()));
    }

    StepResult averageScores(JoinContext context) {
        // fold가 없어도 전달되도록 branch 입력이 아닌 split 이전 Artifact에서 고름
        Artifacts forwarded = context.getInherited().retain(Set.of(TRACKING_RUN_ID.name(), MODE.name()));

        MetricSummary accuracy = context.aggregate(TEST_ACCURACY.name());
        MetricSummary loss = context.aggregate(TEST_LOSS.name());
        if (accuracy.isEmpty()) {
            log.warn("No folds were evaluated, cross-validation metrics are not available");
        } else {
            log.info("Cross-validation accuracy: {} ± {}", accuracy.value(), accuracy.spread());
            log.info("Cross-validation loss: {} ± {}", loss.value(), loss.spread());

            Map<String, Double> metrics = new LinkedHashMap<>();
            metrics.put(TEST_ACCURACY.name(), accuracy.value());
            metrics.put(TEST_ACCURACY_STD.name(), accuracy.spread());
            metrics.put(TEST_LOSS.name(), loss.value());
            metrics.put(TEST_LOSS_STD.name(), loss.spread());
            collaborators.tracker().logMetrics(metrics, forwarded.get(TRACKING_RUN_ID));
        }

        return StepResult.next(forwarded
            .with(TEST_ACCURACY, accuracy.value())
            .with(TEST_ACCURACY_STD, accuracy.spread())
            .with(TEST_LOSS, loss.value())
            .with(TEST_LOSS_STD, loss.spread()));
    }

    // ========================================
    // final model branch
    // ========================================

    StepResult transform(StepContext context) {
        Dataset data = context.getArtifacts().get(DATA);
        Transformer features = collaborators.transformerFactory().buildFeaturesTransformer();
        Transformer target = collaborators.transformerFactory().buildTargetTransformer();

        return StepResult.next(Artifacts.empty()
            .with(FEATURES_TRANSFORMER, features)
            .with(TARGET_TRANSFORMER, target)
            .with(X, features.fitTransform(data))
            .with(Y, target.fitTransform(data)));
    }

    StepResult trainModel(StepContext context) {
        TrainingParameters parameters = TrainingParameters.from(context.getParameters());
        Artifacts artifacts = context.getArtifacts();
        Matrix x = artifacts.get(X);

        Model model = collaborators.modelFactory().build(x.columns());
        TrainingHistory history = model.fit(x, artifacts.get(Y), parameters.epochs(), parameters.batchSize());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("epochs", parameters.epochs());
        params.put("batch_size", parameters.batchSize());
        collaborators.tracker().logParams(params, artifacts.get(TRACKING_RUN_ID));

        log.info("Model trained on full dataset: loss={}, accuracy={}",
            history.finalLoss(), history.finalAccuracy());
        return StepResult.next(Artifacts.of(MODEL.name(), model));
    }

    // ========================================
    // registration / end
    // ========================================

    StepResult registerModel(JoinContext context) throws Exception {
        TrainingParameters parameters = TrainingParameters.from(context.getParameters());
        Artifacts merged = context.mergeArtifacts(Set.of(
            TRACKING_RUN_ID.name(), MODE.name(),
            TEST_ACCURACY.name(), TEST_ACCURACY_STD.name(),
            TEST_LOSS.name(), TEST_LOSS_STD.name(),
            MODEL.name(), FEATURES_TRANSFORMER.name(), TARGET_TRANSFORMER.name()
        ));

        double accuracy = merged.get(TEST_ACCURACY);
        GateDecision decision = ACCURACY_GATE.evaluate(accuracy, parameters.accuracyThreshold(), () -> {
            log.info("Registering model {} ({} mode)", parameters.registeredModelName(), merged.get(MODE));
            collaborators.registry().publish(new ModelPackage(
                parameters.registeredModelName(),
                merged.get(TRACKING_RUN_ID),
                merged.get(MODEL),
                merged.get(FEATURES_TRANSFORMER),
                merged.get(TARGET_TRANSFORMER),
                ModelSignature.penguins(),
                ModelPackage.DEFAULT_PIP_REQUIREMENTS
            ));
        });
        return StepResult.next(merged.with(REGISTRATION, decision));
    }

    StepResult end(StepContext context) {
        log.info("The pipeline finished successfully.");
        return StepResult.next();
    }
}
